package dev.kms.core;

public class KMSException extends Exception {
    public KMSException(String message) {
        super(message);
    }

    public KMSException(String message, Throwable cause) {
        super(message, cause);
    }
}
