package com.tempchan.security;

import com.tempchan.config.TempchanProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Administrator switch for temp channel creation, per scope (server).
 * Scopes without an override fall back to tempchan.channel.enabled-by-default.
 */
@Service
public class FeatureToggleService {

    private static final Logger log = LoggerFactory.getLogger(FeatureToggleService.class);

    private final Map<String, Boolean> overrides = new ConcurrentHashMap<>();
    private final boolean enabledByDefault;

    public FeatureToggleService(TempchanProperties properties) {
        this.enabledByDefault = properties.getChannel().isEnabledByDefault();
    }

    public boolean isEnabled(String scopeId) {
        if (scopeId == null) return enabledByDefault;
        return overrides.getOrDefault(scopeId, enabledByDefault);
    }

    public void forceEnable(String scopeId, String adminId) {
        overrides.put(scopeId, true);
        log.info("Temp channels force-enabled for scope={} by admin={}", scopeId, adminId);
    }

    public void forceDisable(String scopeId, String adminId) {
        overrides.put(scopeId, false);
        log.info("Temp channels force-disabled for scope={} by admin={}", scopeId, adminId);
    }
}
