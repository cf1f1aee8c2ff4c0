package com.tempchan.lifecycle;

import java.time.Duration;

/**
 * Text the engine posts into managed channels.
 */
final class ChannelNotices {

    private ChannelNotices() {}

    static String welcome(ChannelDescriptor d, String ownerMention, Duration inactivityGrace) {
        String visibilityLine = d.visibility() == Visibility.PRIVATE
                ? "🔒 This is a private channel. Use invite to add people."
                : "🌍 This is a public channel - anyone can join!";
        return "**" + d.topic() + "** - Created by " + ownerMention + "\n"
                + "⏰ This channel will be deleted in **" + d.duration().label() + "** or after **"
                + minutes(inactivityGrace) + "** of inactivity.\n"
                + visibilityLine;
    }

    static String expiryWarning(Duration left) {
        return "⚠️ **Channel Expiring Soon**\n"
                + "This channel will be deleted in **" + minutes(left) + "**!\n"
                + "Want to extend? 🕐 +5min | 🕙 +10min | 🕞 +30min";
    }

    static String inactivityWarning(Duration left) {
        return "💤 **Channel Inactive**\n"
                + "This channel will be deleted in **" + minutes(left) + "** due to inactivity.\n"
                + "Send a message to reset the timer.";
    }

    static String topicLine(DurationOption duration, String ownerName) {
        return "⏰ Expires in " + duration.label() + " | Created by " + ownerName;
    }

    static String minutes(Duration d) {
        long seconds = Math.max(0, d.getSeconds());
        long minutes = Math.max(1, (seconds + 59) / 60);
        return minutes + (minutes == 1 ? " minute" : " minutes");
    }
}
