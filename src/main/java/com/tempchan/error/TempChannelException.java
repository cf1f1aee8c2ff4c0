package com.tempchan.error;

/**
 * Base of every failure reported back to a requester. Subclasses other than
 * {@link PlatformException} are raised before any state is mutated.
 */
public abstract class TempChannelException extends RuntimeException {

    protected TempChannelException(String message) {
        super(message);
    }

    protected TempChannelException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Short machine-readable category, used as a metric and log tag. */
    public abstract String category();
}
