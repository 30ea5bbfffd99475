package com.riansoft.delivery_dispatch.exception;

public class CustomerDataException extends DispatchException {
    public CustomerDataException(String message) {
        super(message);
    }

    public CustomerDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
