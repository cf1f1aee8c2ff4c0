package com.tempchan.channel;

import com.tempchan.permission.GrantSet;

public record ChannelSpec(
        String scopeId,
        String categoryName,
        String name,
        String topicLine,
        GrantSet grants
) {}
