package com.tempchan.lifecycle;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Renders remaining lifetime into the channel display name, e.g.
 * {@code ⏰・study-group-1h30m}.
 */
public final class CountdownFormatter {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DISALLOWED = Pattern.compile("[^\\p{L}\\p{N}_-]");
    private static final Pattern DASH_RUNS = Pattern.compile("-{2,}");
    private static final int MAX_SLUG_LENGTH = 80;

    private CountdownFormatter() {}

    /**
     * Under an hour: minutes. One to two hours: hours and minutes. Two hours
     * and up: whole hours, or whole days from 24 hours.
     */
    public static String format(Duration remaining) {
        long totalMinutes = Math.max(0, remaining.toMinutes());
        long hours = totalMinutes / 60;
        long minutes = totalMinutes % 60;

        if (totalMinutes >= 120) {
            return hours >= 24 ? (hours / 24) + "d" : hours + "h";
        }
        if (totalMinutes >= 60) {
            return minutes > 0 ? hours + "h" + minutes + "m" : hours + "h";
        }
        return totalMinutes + "m";
    }

    /** Human form used in replies, e.g. {@code 1h 5m}. */
    public static String formatLong(Duration remaining) {
        long totalMinutes = Math.max(0, remaining.toMinutes());
        long hours = totalMinutes / 60;
        long minutes = totalMinutes % 60;
        return hours > 0 ? hours + "h " + minutes + "m" : minutes + "m";
    }

    public static String slug(String topic) {
        String slug = WHITESPACE.matcher(topic.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
        slug = DISALLOWED.matcher(slug).replaceAll("");
        slug = DASH_RUNS.matcher(slug).replaceAll("-");
        if (slug.startsWith("-")) slug = slug.substring(1);
        if (slug.endsWith("-")) slug = slug.substring(0, slug.length() - 1);
        if (slug.length() > MAX_SLUG_LENGTH) slug = slug.substring(0, MAX_SLUG_LENGTH);
        return slug.isEmpty() ? "temp" : slug;
    }

    public static String channelName(String prefix, String displayTopic, Duration remaining) {
        return prefix + displayTopic + "-" + format(remaining);
    }
}
