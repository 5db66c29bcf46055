package dev.kms.fs;

public enum StoreVariant {
    BINARY,
    JSON,
    /**
     * Бинарный снимок, зашифрованный XChaCha20-Poly1305.
     */
    ENCRYPTED
}
