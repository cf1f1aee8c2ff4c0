package com.tempchan.command;

import com.tempchan.config.TempchanProperties;
import com.tempchan.error.ValidationException;
import org.springframework.stereotype.Component;

import java.text.Normalizer;

/**
 * Cleans a user-supplied channel topic before it reaches the engine.
 */
@Component
public class TopicSanitizer {

    private final int maxLength;

    public TopicSanitizer(TempchanProperties properties) {
        this.maxLength = properties.getChannel().getMaxTopicLength();
    }

    public String sanitize(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new ValidationException("Please give your channel a topic!");
        }

        // Control characters are dropped, line breaks become spaces
        StringBuilder cleaned = new StringBuilder(topic.length());
        for (char c : topic.toCharArray()) {
            if (c == '\n' || c == '\r' || c == '\t') {
                cleaned.append(' ');
            } else if (!Character.isISOControl(c)) {
                cleaned.append(c);
            }
        }
        String normalized = Normalizer.normalize(cleaned.toString(), Normalizer.Form.NFC).trim();

        if (normalized.isEmpty()) {
            throw new ValidationException("Please give your channel a topic!");
        }
        if (normalized.codePointCount(0, normalized.length()) > maxLength) {
            throw new ValidationException("Topic is too long! Keep it under " + maxLength + " characters.");
        }
        return normalized;
    }
}
