package com.notifykit.pem.exception;

/**
 * Raised when externally supplied data (such as a Web Push subscription)
 * cannot be loaded.
 */
public class InvalidDataException extends NotifyException {

    private static final String CODE = "INVALID_DATA";

    public InvalidDataException(String message) {
        super(message, CODE);
    }

    public InvalidDataException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
