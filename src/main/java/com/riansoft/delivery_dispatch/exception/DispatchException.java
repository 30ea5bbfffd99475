package com.riansoft.delivery_dispatch.exception;

/**
 * Base type of every failure that ends a dispatch run.
 */
public class DispatchException extends RuntimeException {
    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
