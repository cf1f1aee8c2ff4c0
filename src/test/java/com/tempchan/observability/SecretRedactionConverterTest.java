package com.tempchan.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SecretRedactionConverterTest {

    private static final String TOKEN = "MTA4NzY1NDMyMTIzNDU2Nzg5.GaBcDe.abcdefghijklmnopqrstuvwxyz012345";

    @AfterEach
    void tearDown() {
        SecretRedactionConverter.resetPatterns();
    }

    @Test
    void redactsBotTokens() {
        assertEquals("Logging in with [REDACTED]", SecretRedactionConverter.redact("Logging in with " + TOKEN));
    }

    @Test
    void redactsWebhookUrls() {
        assertEquals("Posting to [REDACTED] failed", SecretRedactionConverter.redact(
                "Posting to https://discord.com/api/webhooks/123456789/AbC-dEf_123 failed"));
    }

    @Test
    void leavesOrdinaryMessagesAlone() {
        assertEquals("Temp channel created: id=123", SecretRedactionConverter.redact("Temp channel created: id=123"));
        assertEquals("", SecretRedactionConverter.redact(null));
    }

    @Test
    void configuredPatternsAddToDefaults() {
        SecretRedactionConverter.setConfiguredPatterns(List.of("secret-\\d+"));

        assertEquals("[REDACTED] and [REDACTED]", SecretRedactionConverter.redact("secret-42 and " + TOKEN));
    }
}
