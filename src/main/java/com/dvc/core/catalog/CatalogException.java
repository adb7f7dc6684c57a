package com.dvc.core.catalog;

/**
 * Raised when the challenge catalog cannot be read or contains invalid entries.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
