package com.resourcelocator.domain.repository;

/**
 * Storage adapter I/O failure. Distinct from "not found" and from any
 * authorization outcome.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
