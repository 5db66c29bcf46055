package dev.kms.crypto;

import dev.kms.core.KMSException;

public class CryptoException extends KMSException {
    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
