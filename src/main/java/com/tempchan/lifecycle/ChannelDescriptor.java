package com.tempchan.lifecycle;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory record of one temporary channel. Identity fields are immutable;
 * everything else must only be read or written while holding {@link #lock()}.
 */
public class ChannelDescriptor {

    private final String id;
    private final String scopeId;
    private final String ownerId;
    private final String ownerName;
    private final String topic;
    private final String displayTopic;
    private final Visibility visibility;
    private final DurationOption duration;
    private final Instant createdAt;
    private final ReentrantLock lock = new ReentrantLock();

    private Instant expiresAt;
    private Instant lastActivityAt;
    private Instant inactivityDeadline;
    private final Set<String> invitedUsers = new LinkedHashSet<>();
    private DescriptorState state = DescriptorState.ACTIVE;
    private DeletionReason deletionReason;

    private boolean expiryWarned;
    private boolean inactivityWarned;
    private boolean extended;
    private String lastRenderedName;
    private Instant lastRenamedAt;
    private String warningMessageId;
    private boolean membershipChangeInFlight;

    public ChannelDescriptor(String id, String scopeId, String ownerId, String ownerName,
                             String topic, String displayTopic, Visibility visibility,
                             DurationOption duration, Instant createdAt, Instant expiresAt) {
        if (!expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("expiresAt must be after createdAt");
        }
        this.id = id;
        this.scopeId = scopeId;
        this.ownerId = ownerId;
        this.ownerName = ownerName;
        this.topic = topic;
        this.displayTopic = displayTopic;
        this.visibility = visibility;
        this.duration = duration;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.lastActivityAt = createdAt;
        this.inactivityDeadline = expiresAt;
    }

    public void lock() { lock.lock(); }

    public void unlock() { lock.unlock(); }

    // --- immutable ---

    public String id() { return id; }
    public String scopeId() { return scopeId; }
    public String ownerId() { return ownerId; }
    public String ownerName() { return ownerName; }
    public String topic() { return topic; }
    public String displayTopic() { return displayTopic; }
    public Visibility visibility() { return visibility; }
    public DurationOption duration() { return duration; }
    public Instant createdAt() { return createdAt; }

    // --- guarded by lock ---

    public Instant expiresAt() { return expiresAt; }
    public Instant lastActivityAt() { return lastActivityAt; }
    public Instant inactivityDeadline() { return inactivityDeadline; }
    public DescriptorState state() { return state; }
    public DeletionReason deletionReason() { return deletionReason; }
    public boolean isActive() { return state == DescriptorState.ACTIVE; }
    public boolean isExpiryWarned() { return expiryWarned; }
    public boolean isInactivityWarned() { return inactivityWarned; }
    public boolean isExtended() { return extended; }
    public String lastRenderedName() { return lastRenderedName; }
    public Instant lastRenamedAt() { return lastRenamedAt; }
    public String warningMessageId() { return warningMessageId; }
    public boolean isMembershipChangeInFlight() { return membershipChangeInFlight; }

    public boolean isMember(String userId) {
        return ownerId.equals(userId) || invitedUsers.contains(userId);
    }

    public boolean isInvited(String userId) {
        return invitedUsers.contains(userId);
    }

    public Set<String> invitedUsers() {
        return Set.copyOf(invitedUsers);
    }

    void extendTo(Instant newExpiresAt) {
        if (newExpiresAt.isBefore(expiresAt)) {
            throw new IllegalArgumentException("expiresAt can only increase");
        }
        if (newExpiresAt.isAfter(expiresAt)) {
            extended = true;
        }
        expiresAt = newExpiresAt;
        expiryWarned = false;
    }

    void touch(Instant at) {
        if (at.isAfter(lastActivityAt)) {
            lastActivityAt = at;
        }
        inactivityWarned = false;
    }

    void setInactivityDeadline(Instant deadline) {
        this.inactivityDeadline = deadline.isAfter(expiresAt) ? expiresAt : deadline;
    }

    boolean addInvited(String userId) { return invitedUsers.add(userId); }

    boolean removeInvited(String userId) { return invitedUsers.remove(userId); }

    void setMembershipChangeInFlight(boolean inFlight) { this.membershipChangeInFlight = inFlight; }

    void markExpiryWarned() { expiryWarned = true; }

    void markInactivityWarned() { inactivityWarned = true; }

    void setWarningMessageId(String messageId) { this.warningMessageId = messageId; }

    void rendered(String name, Instant at) {
        this.lastRenderedName = name;
        this.lastRenamedAt = at;
    }

    void markPendingDeletion(DeletionReason reason) {
        if (state != DescriptorState.ACTIVE) {
            throw new IllegalStateException("Channel " + id + " already " + state);
        }
        state = DescriptorState.PENDING_DELETION;
        deletionReason = reason;
    }

    public ChannelSnapshot snapshot() {
        return new ChannelSnapshot(id, scopeId, ownerId, topic, displayTopic, visibility, duration,
                createdAt, expiresAt, lastActivityAt, inactivityDeadline, invitedUsers(),
                state, deletionReason, extended, lastRenderedName);
    }
}
