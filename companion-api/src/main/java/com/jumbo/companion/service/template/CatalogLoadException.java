package com.jumbo.companion.service.template;

/**
 * Raised when the template catalog cannot produce a single valid template. Fatal at startup.
 */
public class CatalogLoadException extends RuntimeException {

    public CatalogLoadException(String message) {
        super(message);
    }

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
