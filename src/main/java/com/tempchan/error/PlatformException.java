package com.tempchan.error;

/**
 * I/O failure reported by the chat platform. Transient failures (rate limits,
 * server errors, timeouts) are retried by callers; permanent ones are not.
 */
public class PlatformException extends TempChannelException {

    private final String operation;
    private final boolean transientFailure;

    public PlatformException(String operation, String message, boolean transientFailure) {
        super(message);
        this.operation = operation;
        this.transientFailure = transientFailure;
    }

    public PlatformException(String operation, String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.transientFailure = transientFailure;
    }

    public String operation() { return operation; }

    public boolean isTransient() { return transientFailure; }

    public static boolean isTransientFailure(Throwable t) {
        return t instanceof PlatformException pe && pe.isTransient();
    }

    @Override
    public String category() { return "platform"; }
}
