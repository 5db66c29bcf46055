package dev.kms.crypto;

import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Симметричный ключ ровно на 256 бит. Приходит от вызывающего, в файлы не пишется.
 */
public final class CryptoKey {
    public static final int LENGTH = 32;

    private final byte[] material;

    private CryptoKey(final byte[] material) {
        this.material = material;
    }

    public static CryptoKey of(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("key must be " + LENGTH + " bytes, got " + bytes.length);
        }
        return new CryptoKey(bytes.clone());
    }

    /**
     * Ключ из одних нулей. Только для тестов и отладки.
     */
    public static CryptoKey zero() {
        return new CryptoKey(new byte[LENGTH]);
    }

    public static CryptoKey fromHex(final String hex) {
        Objects.requireNonNull(hex, "hex");
        return of(HexFormat.of().parseHex(hex.strip()));
    }

    public static CryptoKey fromBase64(final String base64) {
        Objects.requireNonNull(base64, "base64");
        return of(Base64.getDecoder().decode(base64.strip()));
    }

    byte[] material() {
        return material;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CryptoKey other)) return false;
        return MessageDigest.isEqual(material, other.material);
    }

    @Override
    public int hashCode() {
        return 0; // материал ключа не участвует в хеше
    }

    @Override
    public String toString() {
        return "CryptoKey[redacted]";
    }
}
