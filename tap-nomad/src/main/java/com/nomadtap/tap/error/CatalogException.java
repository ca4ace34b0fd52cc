package com.nomadtap.tap.error;

/**
 * The catalog could not be read or resolved to any stream. Aborts the run before any stream starts.
 */
public class CatalogException extends TapException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
