package com.nomadtap.tap.error;

/**
 * Messages can no longer be delivered downstream. Nothing after this point would be consumed,
 * so the run stops.
 */
public class OutputException extends TapException {

    public OutputException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
