package dev.kms.crypto;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

/**
 * XChaCha20-Poly1305 поверх JCA.
 * <p>
 * Формат блоба: {@code [nonce: 24][ciphertext][tag: 16]}. Nonce новый на каждый вызов
 * {@link #encrypt}, берётся из {@link SecureRandom}; 192 бита позволяют не вести учёт выданных nonce.
 */
public final class CryptoBox {
    public static final int KEY_LEN = CryptoKey.LENGTH;

    public static final int NONCE_LEN = 24;

    public static final int TAG_LEN = 16;

    private static final String CIPHER = "ChaCha20-Poly1305";

    private static final int IV_LEN = 12;

    private final SecureRandom random;

    public CryptoBox() {
        this(new SecureRandom());
    }

    public CryptoBox(final SecureRandom random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public byte[] encrypt(final CryptoKey key, final byte[] plaintext) throws RandomSourceFailureException {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(plaintext, "plaintext");

        final byte[] nonce = new byte[NONCE_LEN];
        try {
            random.nextBytes(nonce);
        } catch (RuntimeException e) {
            throw new RandomSourceFailureException("secure random source failed", e);
        }

        final byte[] sealed;
        try {
            sealed = cipher(Cipher.ENCRYPT_MODE, key, nonce).doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(CIPHER + " encrypt failed", e);
        }

        return ByteBuffer.allocate(NONCE_LEN + sealed.length)
                .put(nonce)
                .put(sealed)
                .array();
    }

    public byte[] decrypt(final CryptoKey key, final byte[] blob)
            throws InvalidEncodingException, AuthenticationFailureException {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(blob, "blob");

        if (blob.length < NONCE_LEN) {
            throw new InvalidEncodingException(
                    "encrypted blob is " + blob.length + " bytes, shorter than the " + NONCE_LEN + " byte nonce");
        }
        if (blob.length < NONCE_LEN + TAG_LEN) {
            throw new AuthenticationFailureException("encrypted blob has no room for the authentication tag");
        }

        final byte[] nonce = Arrays.copyOfRange(blob, 0, NONCE_LEN);
        try {
            return cipher(Cipher.DECRYPT_MODE, key, nonce).doFinal(blob, NONCE_LEN, blob.length - NONCE_LEN);
        } catch (AEADBadTagException e) {
            throw new AuthenticationFailureException("authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(CIPHER + " decrypt failed", e);
        }
    }

    private static Cipher cipher(final int mode, final CryptoKey key, final byte[] nonce)
            throws GeneralSecurityException {
        final byte[] subkey = HChaCha20.subkey(key.material(), Arrays.copyOfRange(nonce, 0, HChaCha20.INPUT_LEN));
        try {
            // первые 4 байта IV нулевые, дальше хвост nonce
            final byte[] iv = new byte[IV_LEN];
            System.arraycopy(nonce, HChaCha20.INPUT_LEN, iv, IV_LEN - (NONCE_LEN - HChaCha20.INPUT_LEN),
                    NONCE_LEN - HChaCha20.INPUT_LEN);

            final Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(mode, new SecretKeySpec(subkey, "ChaCha20"), new IvParameterSpec(iv));
            return cipher;
        } finally {
            Arrays.fill(subkey, (byte) 0);
        }
    }
}
