package com.splitttr.canvas.message;

/**
 * Raised when an inbound frame cannot become an {@link Envelope}. Only
 * {@link Reason#TOO_LARGE} is reported back to the sender.
 */
public class EnvelopeException extends RuntimeException {

    public enum Reason {
        TOO_LARGE,
        MALFORMED,
        UNKNOWN_TYPE
    }

    private final Reason reason;

    public EnvelopeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public EnvelopeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
