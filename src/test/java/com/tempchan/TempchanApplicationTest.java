package com.tempchan;

import com.tempchan.channel.ChannelPlatform;
import com.tempchan.command.CommandFacade;
import com.tempchan.config.TempchanProperties;
import com.tempchan.lifecycle.LifecycleEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
class TempchanApplicationTest {

    @Autowired private TempchanProperties properties;
    @Autowired private LifecycleEngine engine;
    @Autowired private CommandFacade commandFacade;
    @Autowired private ChannelPlatform platform;

    @Test
    void contextLoadsWithoutDiscordToken() {
        assertNotNull(engine);
        assertNotNull(commandFacade);
        assertFalse(platform.isConnected());
        assertEquals(0, engine.trackedCount());
    }

    @Test
    void propertiesBindFromYaml() {
        assertEquals(Duration.ZERO, properties.getLifecycle().getFarewellDelay());
        assertEquals(Duration.ofHours(48), properties.getLifecycle().getMaxLifetime());
        assertEquals(2, properties.getRateLimit().getMaxChannelsPerUser());
        assertEquals("Temp Channels", properties.getChannel().getCategoryName());
        assertTrue(properties.getSecurity().getAdminUserIds().contains("admin-1"));
    }
}
