package dev.kms.crypto;

/**
 * Не сошёлся тег: подмена данных, чужой ключ или повреждение.
 */
public class AuthenticationFailureException extends CryptoException {
    public AuthenticationFailureException(String message) {
        super(message);
    }

    public AuthenticationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
