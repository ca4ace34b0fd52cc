package com.nomadtap.tap.error;

/**
 * Base type for every failure raised by the tap.
 *
 * Subclasses decide their blast radius: {@link #isFatal()} errors abort the whole run,
 * everything else only fails the stream that raised it.
 */
public abstract class TapException extends RuntimeException {

    protected TapException(String message) {
        super(message);
    }

    protected TapException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isFatal() {
        return false;
    }
}
