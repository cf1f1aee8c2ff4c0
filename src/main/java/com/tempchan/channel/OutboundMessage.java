package com.tempchan.channel;

import java.time.Instant;
import java.util.List;

public record OutboundMessage(
        String channelId,
        String content,
        List<String> reactions,
        Instant sentAt
) {
    public OutboundMessage(String channelId, String content, List<String> reactions) {
        this(channelId, content, reactions != null ? List.copyOf(reactions) : List.of(), Instant.now());
    }

    public OutboundMessage(String channelId, String content) {
        this(channelId, content, List.of(), Instant.now());
    }
}
