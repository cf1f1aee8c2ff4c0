package com.tempchan.error;

public class RateLimitException extends TempChannelException {

    public enum Reason { COOLDOWN_ACTIVE, MAX_CHANNELS_REACHED }

    private final Reason reason;

    public RateLimitException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() { return reason; }

    @Override
    public String category() { return "rate_limit"; }
}
