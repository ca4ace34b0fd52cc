package com.nomadtap.tap.error;

import lombok.Getter;

/**
 * Transient failures kept happening until the retry budget ran out.
 */
@Getter
public class SourceUnavailableException extends TapException {

    private final String path;
    private final int attempts;

    public SourceUnavailableException(String path, int attempts, Throwable cause) {
        super("Source unavailable for " + path + " after " + attempts + " attempts: "
                + (cause != null ? cause.getMessage() : "unknown cause"), cause);
        this.path = path;
        this.attempts = attempts;
    }
}
