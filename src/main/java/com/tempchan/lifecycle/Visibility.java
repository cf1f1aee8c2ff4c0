package com.tempchan.lifecycle;

import java.util.Locale;
import java.util.Optional;

public enum Visibility {
    PUBLIC,
    PRIVATE;

    public static Optional<Visibility> parse(String value) {
        if (value == null) return Optional.empty();
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "public" -> Optional.of(PUBLIC);
            case "private" -> Optional.of(PRIVATE);
            default -> Optional.empty();
        };
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
