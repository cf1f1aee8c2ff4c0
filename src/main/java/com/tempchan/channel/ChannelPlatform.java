package com.tempchan.channel;

import com.tempchan.permission.Grant;
import com.tempchan.permission.GrantDelta;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Capabilities the lifecycle needs from the chat platform. Failures are
 * signalled as {@link com.tempchan.error.PlatformException}.
 */
public interface ChannelPlatform {

    String platformType();

    /** Overrides of the parent category, empty when the category does not exist yet. */
    Mono<List<Grant>> categoryGrants(String scopeId, String categoryName);

    /** Creates the channel (and its category if missing) and emits the new channel id. */
    Mono<String> createChannel(ChannelSpec spec);

    Mono<DeleteOutcome> deleteChannel(String channelId, String reason);

    Mono<Void> renameChannel(String channelId, String newName);

    Mono<Void> applyGrants(String channelId, GrantDelta delta);

    /** Posts a message, adds the requested reactions, and emits the message id. */
    Mono<String> sendMessage(OutboundMessage message);

    Flux<ActivityEvent> activityEvents();

    Flux<ReactionEvent> reactionEvents();

    Flux<ChannelRemovedEvent> removedChannels();

    boolean isConnected();

    /** How a user is referenced in message text. */
    default String mention(String userId) { return userId; }
}
