package com.notifykit.pem.exception;

/**
 * Thrown by every PEM controller operation when no usable crypto backend
 * is present in this runtime.
 *
 * <p>This signals that the feature cannot function here at all; it is never
 * used for a single failed encrypt, decrypt or key load.
 */
public class PemUnavailableException extends NotifyException {

    public static final String CODE = "PEM_UNAVAILABLE";

    private static final String DEFAULT_MESSAGE =
        "PEM support unavailable; an EC capable crypto provider and BouncyCastle are required";

    public PemUnavailableException() {
        this(DEFAULT_MESSAGE, null);
    }

    public PemUnavailableException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
