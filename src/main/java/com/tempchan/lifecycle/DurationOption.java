package com.tempchan.lifecycle;

import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Channel lifetimes a user may pick at creation.
 */
public enum DurationOption {
    MIN_5("5min", "5m", Duration.ofMinutes(5)),
    MIN_10("10min", "10m", Duration.ofMinutes(10)),
    MIN_15("15min", "15m", Duration.ofMinutes(15)),
    MIN_30("30min", "30m", Duration.ofMinutes(30)),
    MIN_45("45min", "45m", Duration.ofMinutes(45)),
    H_1("1h", "60m", Duration.ofHours(1)),
    H_1_30("1h30m", "90m", Duration.ofMinutes(90)),
    H_2("2h", "120m", Duration.ofHours(2)),
    H_3("3h", "180m", Duration.ofHours(3)),
    H_4("4h", "240m", Duration.ofHours(4)),
    H_6("6h", "360m", Duration.ofHours(6)),
    H_8("8h", "480m", Duration.ofHours(8)),
    H_12("12h", "720m", Duration.ofHours(12)),
    H_24("24h", "1440m", Duration.ofHours(24));

    private final String label;
    private final String alias;
    private final Duration duration;

    DurationOption(String label, String alias, Duration duration) {
        this.label = label;
        this.alias = alias;
        this.duration = duration;
    }

    public String label() { return label; }

    public Duration duration() { return duration; }

    public static Optional<DurationOption> parse(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(o -> o.label.equals(normalized) || o.alias.equals(normalized))
                .findFirst();
    }

    public static String allowedLabels() {
        return Arrays.stream(values()).map(DurationOption::label).collect(Collectors.joining(", "));
    }
}
