package com.tempchan.lifecycle;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Reactions offered on the expiry warning, each extending the channel by a fixed amount.
 */
public enum ExtensionShortcut {
    PLUS_5("🕐", Duration.ofMinutes(5)),
    PLUS_10("🕙", Duration.ofMinutes(10)),
    PLUS_30("🕞", Duration.ofMinutes(30));

    private final String emoji;
    private final Duration amount;

    ExtensionShortcut(String emoji, Duration amount) {
        this.emoji = emoji;
        this.amount = amount;
    }

    public String emoji() { return emoji; }

    public Duration amount() { return amount; }

    public static Optional<ExtensionShortcut> fromEmoji(String emoji) {
        return Arrays.stream(values()).filter(s -> s.emoji.equals(emoji)).findFirst();
    }

    public static List<String> emojis() {
        return Arrays.stream(values()).map(ExtensionShortcut::emoji).toList();
    }
}
