package com.tempchan.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "tempchan")
public class TempchanProperties {

    private LifecycleProperties lifecycle = new LifecycleProperties();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private ChannelProperties channel = new ChannelProperties();
    private SecurityProperties security = new SecurityProperties();
    private LoggingProperties logging = new LoggingProperties();

    public LifecycleProperties getLifecycle() { return lifecycle; }
    public void setLifecycle(LifecycleProperties lifecycle) { this.lifecycle = lifecycle; }

    public RateLimitProperties getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitProperties rateLimit) { this.rateLimit = rateLimit; }

    public ChannelProperties getChannel() { return channel; }
    public void setChannel(ChannelProperties channel) { this.channel = channel; }

    public SecurityProperties getSecurity() { return security; }
    public void setSecurity(SecurityProperties security) { this.security = security; }

    public LoggingProperties getLogging() { return logging; }
    public void setLogging(LoggingProperties logging) { this.logging = logging; }

    public static class LifecycleProperties {
        private Duration displayRefreshInterval = Duration.ofMinutes(5);
        private Duration warningWindow = Duration.ofMinutes(5);
        private Duration inactivityGracePeriod = Duration.ofMinutes(10);
        private Duration minInactivityGrace = Duration.ofMinutes(2);
        private boolean adaptiveInactivity = true;
        private Duration maxLifetime = Duration.ofHours(48);
        private int deleteMaxRetries = 3;
        private Duration deleteRetryBackoff = Duration.ofSeconds(2);
        private Duration farewellDelay = Duration.ofSeconds(2);
        private long checkIntervalMs = 60000;
        private Duration platformCallTimeout = Duration.ofSeconds(30);

        public Duration getDisplayRefreshInterval() { return displayRefreshInterval; }
        public void setDisplayRefreshInterval(Duration d) { this.displayRefreshInterval = d; }
        public Duration getWarningWindow() { return warningWindow; }
        public void setWarningWindow(Duration warningWindow) { this.warningWindow = warningWindow; }
        public Duration getInactivityGracePeriod() { return inactivityGracePeriod; }
        public void setInactivityGracePeriod(Duration d) { this.inactivityGracePeriod = d; }
        public Duration getMinInactivityGrace() { return minInactivityGrace; }
        public void setMinInactivityGrace(Duration d) { this.minInactivityGrace = d; }
        public boolean isAdaptiveInactivity() { return adaptiveInactivity; }
        public void setAdaptiveInactivity(boolean adaptiveInactivity) { this.adaptiveInactivity = adaptiveInactivity; }
        public Duration getMaxLifetime() { return maxLifetime; }
        public void setMaxLifetime(Duration maxLifetime) { this.maxLifetime = maxLifetime; }
        public int getDeleteMaxRetries() { return deleteMaxRetries; }
        public void setDeleteMaxRetries(int deleteMaxRetries) { this.deleteMaxRetries = deleteMaxRetries; }
        public Duration getDeleteRetryBackoff() { return deleteRetryBackoff; }
        public void setDeleteRetryBackoff(Duration d) { this.deleteRetryBackoff = d; }
        public Duration getFarewellDelay() { return farewellDelay; }
        public void setFarewellDelay(Duration farewellDelay) { this.farewellDelay = farewellDelay; }
        public long getCheckIntervalMs() { return checkIntervalMs; }
        public void setCheckIntervalMs(long checkIntervalMs) { this.checkIntervalMs = checkIntervalMs; }
        public Duration getPlatformCallTimeout() { return platformCallTimeout; }
        public void setPlatformCallTimeout(Duration d) { this.platformCallTimeout = d; }
    }

    public static class RateLimitProperties {
        private int maxChannelsPerUser = 2;
        private Duration creationCooldown = Duration.ofMinutes(5);

        public int getMaxChannelsPerUser() { return maxChannelsPerUser; }
        public void setMaxChannelsPerUser(int v) { this.maxChannelsPerUser = v; }
        public Duration getCreationCooldown() { return creationCooldown; }
        public void setCreationCooldown(Duration creationCooldown) { this.creationCooldown = creationCooldown; }
    }

    public static class ChannelProperties {
        private String categoryName = "Temp Channels";
        private String namePrefix = "⏰・";
        private int maxTopicLength = 80;
        private boolean enabledByDefault = true;

        public String getCategoryName() { return categoryName; }
        public void setCategoryName(String categoryName) { this.categoryName = categoryName; }
        public String getNamePrefix() { return namePrefix; }
        public void setNamePrefix(String namePrefix) { this.namePrefix = namePrefix; }
        public int getMaxTopicLength() { return maxTopicLength; }
        public void setMaxTopicLength(int maxTopicLength) { this.maxTopicLength = maxTopicLength; }
        public boolean isEnabledByDefault() { return enabledByDefault; }
        public void setEnabledByDefault(boolean enabledByDefault) { this.enabledByDefault = enabledByDefault; }
    }

    public static class SecurityProperties {
        private List<String> adminUserIds = new ArrayList<>();

        public List<String> getAdminUserIds() { return adminUserIds; }
        public void setAdminUserIds(List<String> adminUserIds) { this.adminUserIds = adminUserIds; }
    }

    public static class LoggingProperties {
        private List<String> redactPatterns = new ArrayList<>();

        public List<String> getRedactPatterns() { return redactPatterns; }
        public void setRedactPatterns(List<String> redactPatterns) { this.redactPatterns = redactPatterns; }
    }
}
