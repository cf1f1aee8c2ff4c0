package com.tempchan.command;

import com.tempchan.config.TempchanProperties;
import com.tempchan.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TopicSanitizerTest {

    private final TopicSanitizer sanitizer = new TopicSanitizer(new TempchanProperties());

    @Test
    void stripsControlCharactersAndTrims() {
        assertEquals("Study Group", sanitizer.sanitize("  Study\u0000 Group "));
        assertEquals("line one line two", sanitizer.sanitize("line one\nline two"));
    }

    @Test
    void normalizesToComposedForm() {
        assertEquals("caf\u00e9", sanitizer.sanitize("cafe\u0301"));
    }

    @Test
    void rejectsEmptyTopics() {
        assertThrows(ValidationException.class, () -> sanitizer.sanitize(null));
        assertThrows(ValidationException.class, () -> sanitizer.sanitize("   "));
        assertThrows(ValidationException.class, () -> sanitizer.sanitize("\u0001\u0002"));
    }

    @Test
    void enforcesMaximumLength() {
        assertEquals(80, sanitizer.sanitize("a".repeat(80)).length());
        ValidationException e = assertThrows(ValidationException.class, () -> sanitizer.sanitize("a".repeat(81)));
        assertEquals("Topic is too long! Keep it under 80 characters.", e.getMessage());
    }
}
