package com.tempchan.lifecycle;

public enum DeletionReason {
    EXPIRED("⏰ Time's up!"),
    INACTIVE("💤 Channel deleted due to inactivity"),
    CLOSED_BY_OWNER("Channel closed by creator"),
    CLOSED_BY_ADMIN("Channel closed by administrator"),
    REMOVED_EXTERNALLY("Channel removed outside the bot");

    private final String farewell;

    DeletionReason(String farewell) {
        this.farewell = farewell;
    }

    /** Text posted in the channel before it goes away, also used as the audit-log reason. */
    public String farewell() {
        return farewell;
    }
}
