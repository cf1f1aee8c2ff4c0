package com.tempchan.lifecycle;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-scoped table of every tracked temp channel. Starts empty; nothing
 * survives a restart.
 */
@Component
public class DescriptorStore {

    private static final Logger log = LoggerFactory.getLogger(DescriptorStore.class);

    private final Map<String, ChannelDescriptor> descriptors = new ConcurrentHashMap<>();

    public void register(ChannelDescriptor descriptor) {
        ChannelDescriptor existing = descriptors.putIfAbsent(descriptor.id(), descriptor);
        if (existing != null) {
            throw new IllegalStateException("Channel " + descriptor.id() + " is already tracked");
        }
    }

    public Optional<ChannelDescriptor> get(String channelId) {
        return Optional.ofNullable(descriptors.get(channelId));
    }

    /** Removes the entry only if it still maps to {@code descriptor}. */
    public boolean remove(ChannelDescriptor descriptor) {
        return descriptors.remove(descriptor.id(), descriptor);
    }

    public Collection<ChannelDescriptor> all() {
        return List.copyOf(descriptors.values());
    }

    public List<ChannelDescriptor> ownedBy(String userId) {
        return descriptors.values().stream()
                .filter(d -> d.ownerId().equals(userId))
                .sorted(Comparator.comparing(ChannelDescriptor::createdAt))
                .toList();
    }

    public int size() {
        return descriptors.size();
    }

    @PreDestroy
    public void drain() {
        if (!descriptors.isEmpty()) {
            log.info("Dropping {} tracked temp channels on shutdown", descriptors.size());
        }
        descriptors.clear();
    }
}
