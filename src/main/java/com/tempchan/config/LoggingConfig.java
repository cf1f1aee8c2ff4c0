package com.tempchan.config;

import com.tempchan.observability.SecretRedactionConverter;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Logback builds its converters before the Spring context exists, so extra
 * secret patterns from {@code tempchan.logging} are handed over once the
 * properties are bound.
 */
@Configuration
public class LoggingConfig {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfig.class);

    private final TempchanProperties properties;

    public LoggingConfig(TempchanProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void installRedactionPatterns() {
        List<String> extra = properties.getLogging().getRedactPatterns();
        SecretRedactionConverter.setConfiguredPatterns(extra);
        log.info("Log redaction active: bot tokens, webhook URLs and {} configured pattern(s)",
                extra == null ? 0 : extra.size());
    }
}
