package com.tempchan.error;

/**
 * Action on a channel that is closing, unknown, or in a scope where the
 * feature is switched off.
 */
public class ChannelStateException extends TempChannelException {

    public ChannelStateException(String message) {
        super(message);
    }

    public static ChannelStateException closing(String channelId) {
        return new ChannelStateException("Channel " + channelId + " is closing");
    }

    public static ChannelStateException notTracked(String channelId) {
        return new ChannelStateException("Channel " + channelId + " is not a temp channel");
    }

    @Override
    public String category() { return "state"; }
}
