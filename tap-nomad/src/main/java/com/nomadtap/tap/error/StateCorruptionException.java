package com.nomadtap.tap.error;

/**
 * The persisted state document cannot be trusted, so there is no safe resume point.
 */
public class StateCorruptionException extends TapException {

    public StateCorruptionException(String message) {
        super(message);
    }

    public StateCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
