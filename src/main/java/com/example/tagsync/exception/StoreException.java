package com.example.tagsync.exception;

/**
 * Local library access failed. A failed batch load is fatal to the batch; a failed write
 * only fails the item being written.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
