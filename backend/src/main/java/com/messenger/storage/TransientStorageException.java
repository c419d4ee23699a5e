package com.messenger.storage;

/**
 * A storage call that may succeed if simply repeated (timeout, unavailable replicas,
 * a conditional write whose winner is not yet readable).
 */
public class TransientStorageException extends RuntimeException {

    public TransientStorageException(String message) {
        super(message);
    }

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
