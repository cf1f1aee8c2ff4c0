package com.tempchan.observability;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * {@code %redacted} conversion word for logback-spring.xml. JDA exceptions and
 * our own startup logs can carry the bot's credentials, so anything shaped like
 * a Discord bot token or a webhook URL is masked before it reaches an appender.
 * Operators may add patterns under {@code tempchan.logging.redact-patterns}.
 */
public class SecretRedactionConverter extends ClassicConverter {

    static final String MASK = "[REDACTED]";

    private static final List<Pattern> BUILT_IN = List.of(
            Pattern.compile("[MN][A-Za-z\\d_-]{23,25}\\.[A-Za-z\\d_-]{6}\\.[A-Za-z\\d_-]{27,38}"),
            Pattern.compile("https://(?:\\w+\\.)?discord(?:app)?\\.com/api/webhooks/\\d+/[A-Za-z\\d_-]+")
    );

    private static volatile List<Pattern> active = BUILT_IN;

    /** Replaces the extra patterns; the built-in ones always stay. */
    public static void setConfiguredPatterns(List<String> extra) {
        List<Pattern> all = new ArrayList<>(BUILT_IN);
        if (extra != null) {
            extra.stream().map(Pattern::compile).forEach(all::add);
        }
        active = List.copyOf(all);
    }

    static void resetPatterns() {
        active = BUILT_IN;
    }

    @Override
    public String convert(ILoggingEvent event) {
        return redact(event.getFormattedMessage());
    }

    static String redact(String message) {
        if (message == null) return "";
        String masked = message;
        for (Pattern secret : active) {
            masked = secret.matcher(masked).replaceAll(MASK);
        }
        return masked;
    }
}
