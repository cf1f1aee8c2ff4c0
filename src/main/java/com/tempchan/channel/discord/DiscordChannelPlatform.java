package com.tempchan.channel.discord;

import com.tempchan.channel.ActivityEvent;
import com.tempchan.channel.ChannelPlatform;
import com.tempchan.channel.ChannelRemovedEvent;
import com.tempchan.channel.ChannelSpec;
import com.tempchan.channel.DeleteOutcome;
import com.tempchan.channel.OutboundMessage;
import com.tempchan.channel.ReactionEvent;
import com.tempchan.config.SecretsConfig;
import com.tempchan.error.PlatformException;
import com.tempchan.permission.Grant;
import com.tempchan.permission.GrantDelta;
import com.tempchan.permission.GrantTarget;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.PermissionOverride;
import net.dv8tion.jda.api.entities.channel.attribute.IPermissionContainer;
import net.dv8tion.jda.api.entities.channel.concrete.Category;
import net.dv8tion.jda.api.entities.channel.concrete.TextChannel;
import net.dv8tion.jda.api.entities.channel.middleman.GuildChannel;
import net.dv8tion.jda.api.entities.emoji.Emoji;
import net.dv8tion.jda.api.events.channel.ChannelDeleteEvent;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.events.message.react.MessageReactionAddEvent;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.exceptions.RateLimitedException;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.managers.channel.attribute.IPermissionContainerManager;
import net.dv8tion.jda.api.requests.ErrorResponse;
import net.dv8tion.jda.api.requests.GatewayIntent;
import net.dv8tion.jda.api.requests.restaction.ChannelAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

@Component
public class DiscordChannelPlatform extends ListenerAdapter implements ChannelPlatform {

    private static final Logger log = LoggerFactory.getLogger(DiscordChannelPlatform.class);

    private final SecretsConfig secretsConfig;
    private final Sinks.Many<ActivityEvent> activitySink =
            Sinks.many().multicast().onBackpressureBuffer();
    private final Sinks.Many<ReactionEvent> reactionSink =
            Sinks.many().multicast().onBackpressureBuffer();
    private final Sinks.Many<ChannelRemovedEvent> removedSink =
            Sinks.many().multicast().onBackpressureBuffer();
    private JDA jda;

    public DiscordChannelPlatform(SecretsConfig secretsConfig) {
        this.secretsConfig = secretsConfig;
    }

    @PostConstruct
    public void init() {
        try {
            String token = secretsConfig.getDiscordBotToken();
            if (token == null || token.isEmpty()) {
                log.warn("Discord bot token not configured, platform disabled");
                return;
            }

            jda = JDABuilder.createDefault(token)
                    .enableIntents(GatewayIntent.GUILD_MESSAGES, GatewayIntent.GUILD_MESSAGE_REACTIONS)
                    .addEventListeners(this)
                    .build();
            log.info("Discord channel platform initialized");
        } catch (Exception e) {
            log.error("Failed to initialize Discord platform", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (jda != null) jda.shutdown();
        activitySink.tryEmitComplete();
        reactionSink.tryEmitComplete();
        removedSink.tryEmitComplete();
    }

    // --- Gateway events ---

    @Override
    public void onMessageReceived(MessageReceivedEvent event) {
        if (!event.isFromGuild() || event.getAuthor().isBot()) return;

        activitySink.tryEmitNext(new ActivityEvent(
                event.getGuild().getId(),
                event.getChannel().getId(),
                event.getAuthor().getId(),
                Instant.now()));
    }

    @Override
    public void onMessageReactionAdd(MessageReactionAddEvent event) {
        if (!event.isFromGuild()) return;
        if (event.getUserIdLong() == event.getJDA().getSelfUser().getIdLong()) return;
        Member member = event.getMember();
        if (member != null && member.getUser().isBot()) return;

        reactionSink.tryEmitNext(new ReactionEvent(
                event.getGuild().getId(),
                event.getChannel().getId(),
                event.getMessageId(),
                event.getUserId(),
                member != null ? member.getEffectiveName() : event.getUserId(),
                event.getReaction().getEmoji().getName(),
                member != null && member.hasPermission(Permission.ADMINISTRATOR),
                Instant.now()));
    }

    @Override
    public void onChannelDelete(ChannelDeleteEvent event) {
        removedSink.tryEmitNext(new ChannelRemovedEvent(event.getChannel().getId(), Instant.now()));
    }

    @Override
    public String platformType() { return "discord"; }

    @Override
    public Flux<ActivityEvent> activityEvents() { return activitySink.asFlux(); }

    @Override
    public Flux<ReactionEvent> reactionEvents() { return reactionSink.asFlux(); }

    @Override
    public Flux<ChannelRemovedEvent> removedChannels() { return removedSink.asFlux(); }

    // --- Channel operations ---

    @Override
    public Mono<List<Grant>> categoryGrants(String scopeId, String categoryName) {
        return Mono.defer(() -> {
            Guild guild = requireGuild(scopeId, "categoryGrants");
            List<Category> categories = guild.getCategoriesByName(categoryName, true);
            if (categories.isEmpty()) return Mono.just(List.<Grant>of());

            List<Grant> grants = new ArrayList<>();
            for (PermissionOverride override : categories.get(0).getPermissionOverrides()) {
                grants.add(new Grant(targetOf(guild, override),
                        DiscordPermissions.fromDiscord(override.getAllowed()),
                        DiscordPermissions.fromDiscord(override.getDenied())));
            }
            return Mono.just(List.copyOf(grants));
        });
    }

    @Override
    public Mono<String> createChannel(ChannelSpec spec) {
        return Mono.defer(() -> {
            Guild guild = requireGuild(spec.scopeId(), "createChannel");
            return findOrCreateCategory(guild, spec.categoryName())
                    .flatMap(category -> {
                        ChannelAction<TextChannel> action = guild.createTextChannel(spec.name(), category)
                                .setTopic(spec.topicLine());
                        for (Grant grant : spec.grants().grants()) {
                            addOverride(guild, action, grant);
                        }
                        return Mono.fromFuture(action.submit());
                    })
                    .map(TextChannel::getId);
        }).onErrorMap(e -> toPlatformException("createChannel", e));
    }

    @Override
    public Mono<DeleteOutcome> deleteChannel(String channelId, String reason) {
        return Mono.defer(() -> {
            GuildChannel channel = requireJda("deleteChannel").getGuildChannelById(channelId);
            if (channel == null) return Mono.just(DeleteOutcome.NOT_FOUND);
            return Mono.fromFuture(channel.delete().reason(reason).submit())
                    .thenReturn(DeleteOutcome.DELETED);
        })
        .onErrorResume(e -> isUnknownChannel(e), e -> Mono.just(DeleteOutcome.NOT_FOUND))
        .onErrorMap(e -> toPlatformException("deleteChannel", e));
    }

    @Override
    public Mono<Void> renameChannel(String channelId, String newName) {
        return Mono.defer(() -> {
            GuildChannel channel = requireChannel(channelId, "renameChannel");
            return Mono.fromFuture(channel.getManager().setName(newName).submit());
        }).onErrorMap(e -> toPlatformException("renameChannel", e));
    }

    @Override
    public Mono<Void> applyGrants(String channelId, GrantDelta delta) {
        return Mono.defer(() -> {
            GuildChannel channel = requireChannel(channelId, "applyGrants");
            if (!(channel instanceof IPermissionContainer container)) {
                return Mono.error(new PlatformException("applyGrants",
                        "Channel " + channelId + " does not support permission overrides", false));
            }
            IPermissionContainerManager<?, ?> manager = container.getManager();
            Guild guild = channel.getGuild();
            for (Grant grant : delta.put()) {
                long id = holderId(guild, grant.target());
                if (isRole(grant.target())) {
                    manager.putRolePermissionOverride(id,
                            DiscordPermissions.toDiscord(grant.allow()), DiscordPermissions.toDiscord(grant.deny()));
                } else {
                    manager.putMemberPermissionOverride(id,
                            DiscordPermissions.toDiscord(grant.allow()), DiscordPermissions.toDiscord(grant.deny()));
                }
            }
            for (GrantTarget target : delta.remove()) {
                manager.removePermissionOverride(holderId(guild, target));
            }
            return Mono.fromFuture(manager.submit());
        }).onErrorMap(e -> toPlatformException("applyGrants", e));
    }

    @Override
    public Mono<String> sendMessage(OutboundMessage message) {
        return Mono.defer(() -> {
            TextChannel channel = requireJda("sendMessage").getTextChannelById(message.channelId());
            if (channel == null) {
                return Mono.error(new PlatformException("sendMessage",
                        "Channel " + message.channelId() + " not found", false));
            }
            return Mono.fromFuture(channel.sendMessage(message.content()).submit())
                    .flatMap(sent -> Flux.fromIterable(message.reactions())
                            .concatMap(emoji -> Mono.fromFuture(
                                    sent.addReaction(Emoji.fromUnicode(emoji)).submit()))
                            .then(Mono.just(sent.getId())));
        }).onErrorMap(e -> toPlatformException("sendMessage", e));
    }

    @Override
    public boolean isConnected() {
        return jda != null && jda.getStatus() == JDA.Status.CONNECTED;
    }

    @Override
    public String mention(String userId) {
        return "<@" + userId + ">";
    }

    // --- Helpers ---

    private Mono<Category> findOrCreateCategory(Guild guild, String name) {
        List<Category> existing = guild.getCategoriesByName(name, true);
        if (!existing.isEmpty()) return Mono.just(existing.get(0));
        log.info("Creating category '{}' in guild={}", name, guild.getId());
        return Mono.fromFuture(guild.createCategory(name).submit());
    }

    private void addOverride(Guild guild, ChannelAction<TextChannel> action, Grant grant) {
        long id = holderId(guild, grant.target());
        if (isRole(grant.target())) {
            action.addRolePermissionOverride(id,
                    DiscordPermissions.toDiscord(grant.allow()), DiscordPermissions.toDiscord(grant.deny()));
        } else {
            action.addMemberPermissionOverride(id,
                    DiscordPermissions.toDiscord(grant.allow()), DiscordPermissions.toDiscord(grant.deny()));
        }
    }

    private static boolean isRole(GrantTarget target) {
        return target.type() == GrantTarget.Type.EVERYONE || target.type() == GrantTarget.Type.ROLE;
    }

    private static long holderId(Guild guild, GrantTarget target) {
        return switch (target.type()) {
            case EVERYONE -> guild.getPublicRole().getIdLong();
            case SELF -> guild.getSelfMember().getIdLong();
            case MEMBER, ROLE -> Long.parseLong(target.id());
        };
    }

    private static GrantTarget targetOf(Guild guild, PermissionOverride override) {
        if (override.isRoleOverride()) {
            return override.getIdLong() == guild.getPublicRole().getIdLong()
                    ? GrantTarget.everyone()
                    : GrantTarget.role(override.getId());
        }
        return override.getIdLong() == guild.getSelfMember().getIdLong()
                ? GrantTarget.self()
                : GrantTarget.member(override.getId());
    }

    private JDA requireJda(String operation) {
        if (jda == null) {
            throw new PlatformException(operation, "Discord is not connected", false);
        }
        return jda;
    }

    private Guild requireGuild(String scopeId, String operation) {
        Guild guild = requireJda(operation).getGuildById(scopeId);
        if (guild == null) {
            throw new PlatformException(operation, "Guild " + scopeId + " not available", false);
        }
        return guild;
    }

    private GuildChannel requireChannel(String channelId, String operation) {
        GuildChannel channel = requireJda(operation).getGuildChannelById(channelId);
        if (channel == null) {
            throw new PlatformException(operation, "Channel " + channelId + " not found", false);
        }
        return channel;
    }

    private static boolean isUnknownChannel(Throwable e) {
        Throwable cause = unwrap(e);
        return cause instanceof ErrorResponseException ere
                && ere.getErrorResponse() == ErrorResponse.UNKNOWN_CHANNEL;
    }

    static PlatformException toPlatformException(String operation, Throwable e) {
        Throwable cause = unwrap(e);
        if (cause instanceof PlatformException pe) return pe;
        boolean transientFailure = cause instanceof RateLimitedException
                || cause instanceof IOException
                || cause instanceof TimeoutException
                || (cause instanceof ErrorResponseException ere && ere.isServerError());
        return new PlatformException(operation,
                "Discord " + operation + " failed: " + cause.getMessage(), transientFailure, cause);
    }

    private static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
