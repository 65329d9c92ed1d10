package com.skillbench.core.persistence;

/**
 * Wraps an I/O or serialization failure of the file store.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
