package dev.kms.crypto;

/**
 * Блоб короче nonce: это не наш формат или файл повреждён.
 */
public class InvalidEncodingException extends CryptoException {
    public InvalidEncodingException(String message) {
        super(message);
    }
}
