package com.nomadtap.tap.error;

import lombok.Getter;

/**
 * Non-retryable API failure (4xx other than 429, or a broken pagination sequence).
 */
@Getter
public class SourceRequestException extends TapException {

    private final String path;
    private final int status;

    public SourceRequestException(String path, int status, String message) {
        super("Request to " + path + " failed with HTTP " + status + ": " + message);
        this.path = path;
        this.status = status;
    }

    public SourceRequestException(String path, String message) {
        super("Request to " + path + " failed: " + message);
        this.path = path;
        this.status = 0;
    }
}
