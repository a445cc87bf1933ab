package com.notifykit.pem.exception;

/**
 * Base notifykit exception class
 * 
 * This is an unchecked exception (RuntimeException) so that routine key and
 * cipher calls stay free of throws clauses; the code identifies the failure.
 */
public class NotifyException extends RuntimeException {
    private final String code;

    public NotifyException(String message) {
        this(message, null, null);
    }

    public NotifyException(String message, String code) {
        this(message, code, null);
    }

    public NotifyException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
