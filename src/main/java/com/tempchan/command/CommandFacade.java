package com.tempchan.command;

import com.tempchan.channel.ChannelPlatform;
import com.tempchan.channel.ReactionEvent;
import com.tempchan.error.AuthorizationException;
import com.tempchan.error.ChannelStateException;
import com.tempchan.error.TempChannelException;
import com.tempchan.error.ValidationException;
import com.tempchan.lifecycle.ChannelSnapshot;
import com.tempchan.lifecycle.CountdownFormatter;
import com.tempchan.lifecycle.DurationOption;
import com.tempchan.lifecycle.ExtensionResult;
import com.tempchan.lifecycle.ExtensionShortcut;
import com.tempchan.lifecycle.LifecycleEngine;
import com.tempchan.lifecycle.MembershipChange;
import com.tempchan.lifecycle.Visibility;
import com.tempchan.security.FeatureToggleService;
import com.tempchan.security.RbacService;
import com.tempchan.security.Requester;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Entry point for user and admin commands. Validates raw input, calls the
 * engine and turns the outcome into reply text; failures never escape as
 * errors, they become an error reply.
 */
@Service
public class CommandFacade {

    private static final Logger log = LoggerFactory.getLogger(CommandFacade.class);

    private final LifecycleEngine engine;
    private final TopicSanitizer topicSanitizer;
    private final FeatureToggleService featureToggle;
    private final RbacService rbacService;
    private final ChannelPlatform platform;
    private final Clock clock;

    public CommandFacade(LifecycleEngine engine,
                         TopicSanitizer topicSanitizer,
                         FeatureToggleService featureToggle,
                         RbacService rbacService,
                         ChannelPlatform platform,
                         Clock clock) {
        this.engine = engine;
        this.topicSanitizer = topicSanitizer;
        this.featureToggle = featureToggle;
        this.rbacService = rbacService;
        this.platform = platform;
        this.clock = clock;
    }

    // --- User commands ---

    public Mono<CommandReply> create(Requester requester, String topic, String visibility, String duration) {
        return reply("create a channel", requester, () -> {
            String cleanTopic = topicSanitizer.sanitize(topic);
            Visibility parsedVisibility = Visibility.parse(visibility)
                    .orElseThrow(() -> new ValidationException("Channel type must be public or private!"));
            DurationOption parsedDuration = DurationOption.parse(duration)
                    .orElseThrow(() -> new ValidationException(
                            "Invalid duration! Use: " + DurationOption.allowedLabels()));

            return engine.create(requester, cleanTopic, parsedVisibility, parsedDuration)
                    .map(this::createdReply);
        });
    }

    public Mono<CommandReply> extend(Requester requester, String channelId, Duration amount) {
        return reply("extend the channel", requester,
                () -> engine.extend(requester, channelId, amount).map(this::extendedReply));
    }

    /**
     * Extension shortcut reactions. Emits nothing for reactions that are not
     * shortcuts, for untracked channels, and for reactors who may not extend.
     */
    public Mono<CommandReply> handleReaction(ReactionEvent event) {
        return Mono.defer(() -> {
            Optional<ExtensionShortcut> shortcut = ExtensionShortcut.fromEmoji(event.emoji());
            if (shortcut.isEmpty() || engine.find(event.channelId()).isEmpty()) {
                return Mono.empty();
            }
            Requester requester = new Requester(event.userId(), event.userName(),
                    event.scopeId(), event.platformAdmin());
            return engine.extend(requester, event.channelId(), shortcut.get().amount())
                    .map(this::extendedReply)
                    .onErrorResume(e -> e instanceof AuthorizationException || e instanceof ChannelStateException,
                            e -> {
                                log.debug("Ignoring reaction {} on channel={} by user={}: {}",
                                        event.emoji(), event.channelId(), event.userId(), e.getMessage());
                                return Mono.empty();
                            });
        }).onErrorResume(e -> Mono.just(errorReply("extend the channel", event.userId(), e)));
    }

    public Mono<CommandReply> invite(Requester requester, String channelId, String targetId) {
        return reply("invite the user", requester, () -> {
            if (requester.userId().equals(targetId)) {
                throw new ValidationException("You're already in this channel!");
            }
            String who = platform.mention(targetId);
            return engine.invite(requester, channelId, targetId)
                    .map(change -> change == MembershipChange.APPLIED
                            ? CommandReply.ok("✅ " + who + " has been invited to the channel!")
                            : CommandReply.ok("ℹ️ " + who + " already has access to this channel."));
        });
    }

    public Mono<CommandReply> kick(Requester requester, String channelId, String targetId) {
        return reply("kick the user", requester, () -> {
            if (requester.userId().equals(targetId)) {
                throw new ValidationException("You can't kick yourself! Use close to close the channel instead.");
            }
            String who = platform.mention(targetId);
            return engine.kick(requester, channelId, targetId)
                    .map(change -> change == MembershipChange.APPLIED
                            ? CommandReply.ok("✅ " + who + " has been kicked from the channel!")
                            : CommandReply.ok("ℹ️ " + who + " isn't invited to this channel."));
        });
    }

    public Mono<CommandReply> close(Requester requester, String channelId) {
        return reply("close the channel", requester,
                () -> engine.close(requester, channelId).thenReturn(CommandReply.ok("✅ Channel will be closed!")));
    }

    public Mono<CommandReply> list(Requester requester) {
        return reply("list your channels", requester, () -> {
            List<ChannelSnapshot> owned = engine.listOwnedBy(requester.userId());
            if (owned.isEmpty()) {
                return Mono.just(CommandReply.ok("You don't have any temp channels."));
            }
            Instant now = clock.instant();
            String lines = owned.stream()
                    .map(s -> "**" + s.topic() + "** - " + CountdownFormatter.formatLong(s.remaining(now))
                            + " left (" + s.visibility().label() + ")")
                    .collect(Collectors.joining("\n"));
            return Mono.just(CommandReply.ok(lines));
        });
    }

    // --- Admin commands ---

    public Mono<CommandReply> forceEnable(Requester requester, String scopeId) {
        return reply("enable temp channels", requester, () -> {
            requireAdmin(requester);
            featureToggle.forceEnable(scopeId, requester.userId());
            return Mono.just(CommandReply.ok("✅ Temp channels have been enabled!"));
        });
    }

    public Mono<CommandReply> forceDisable(Requester requester, String scopeId) {
        return reply("disable temp channels", requester, () -> {
            requireAdmin(requester);
            featureToggle.forceDisable(scopeId, requester.userId());
            return Mono.just(CommandReply.ok(
                    "✅ Temp channels have been disabled! Existing channels will run out normally."));
        });
    }

    public Mono<CommandReply> forceClose(Requester requester, String channelId) {
        return reply("close the channel", requester,
                () -> engine.forceClose(requester, channelId)
                        .thenReturn(CommandReply.ok("✅ Channel closed by administrator.")));
    }

    public Mono<CommandReply> status(String scopeId) {
        return Mono.fromSupplier(() -> CommandReply.ok(
                "Temp channels are **" + (featureToggle.isEnabled(scopeId) ? "enabled" : "disabled")
                        + "**. Active channels: " + engine.activeCount()));
    }

    // --- Rendering ---

    private CommandReply createdReply(ChannelSnapshot s) {
        Duration grace = Duration.between(s.createdAt(), s.inactivityDeadline());
        return CommandReply.ok("✅ Created " + s.visibility().label() + " channel **" + s.displayName()
                + "**! It will be deleted in **" + s.duration().label() + "** or after **"
                + grace.toMinutes() + " minutes** of inactivity.");
    }

    private CommandReply extendedReply(ExtensionResult result) {
        long minutes = result.applied().toMinutes();
        if (result.applied().isZero()) {
            String left = CountdownFormatter.formatLong(Duration.between(clock.instant(), result.newExpiresAt()));
            return CommandReply.ok("✅ This channel is already at its maximum lifetime and will be deleted in **"
                    + left + "**.");
        }
        if (result.capped()) {
            return CommandReply.ok("✅ Channel extended by " + minutes
                    + " minutes (maximum lifetime reached)!");
        }
        return CommandReply.ok("✅ Channel extended by " + minutes + " minutes!");
    }

    private Mono<CommandReply> reply(String action, Requester requester, Supplier<Mono<CommandReply>> command) {
        return Mono.defer(command)
                .onErrorResume(e -> Mono.just(errorReply(action, requester.userId(), e)));
    }

    private CommandReply errorReply(String action, String userId, Throwable e) {
        if (e instanceof TempChannelException tce) {
            log.debug("Command '{}' by user={} rejected ({}): {}", action, userId, tce.category(), tce.getMessage());
            return CommandReply.error("❌ " + tce.getMessage());
        }
        log.error("Unexpected failure trying to {} for user={}", action, userId, e);
        return CommandReply.error("❌ Something went wrong while trying to " + action + ". Please try again.");
    }

    private void requireAdmin(Requester requester) {
        if (!rbacService.isAdmin(requester)) {
            throw new AuthorizationException("Only administrators can do that!");
        }
    }
}
