package dev.kms.crypto;

public class RandomSourceFailureException extends CryptoException {
    public RandomSourceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
