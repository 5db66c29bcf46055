package dev.kms.crypto;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * HChaCha20 (draft-irtf-cfrg-xchacha): из ключа и первых 16 байт 24-байтового nonce
 * получаем подключ для обычного ChaCha20-Poly1305. В JCA есть только 12-байтовый вариант.
 */
final class HChaCha20 {
    static final int INPUT_LEN = 16;

    private static final int[] SIGMA = {0x61707865, 0x3320646e, 0x79622d32, 0x6b206574};

    private HChaCha20() {
    }

    static byte[] subkey(final byte[] key, final byte[] input) {
        if (key.length != CryptoKey.LENGTH || input.length != INPUT_LEN) {
            throw new IllegalArgumentException("HChaCha20 needs a 32 byte key and 16 byte input");
        }
        final ByteBuffer k = ByteBuffer.wrap(key).order(ByteOrder.LITTLE_ENDIAN);
        final ByteBuffer n = ByteBuffer.wrap(input).order(ByteOrder.LITTLE_ENDIAN);

        final int[] x = new int[16];
        System.arraycopy(SIGMA, 0, x, 0, 4);
        for (int i = 0; i < 8; i++) {
            x[4 + i] = k.getInt();
        }
        for (int i = 0; i < 4; i++) {
            x[12 + i] = n.getInt();
        }

        for (int round = 0; round < 10; round++) {
            // столбцы
            quarterRound(x, 0, 4, 8, 12);
            quarterRound(x, 1, 5, 9, 13);
            quarterRound(x, 2, 6, 10, 14);
            quarterRound(x, 3, 7, 11, 15);
            // диагонали
            quarterRound(x, 0, 5, 10, 15);
            quarterRound(x, 1, 6, 11, 12);
            quarterRound(x, 2, 7, 8, 13);
            quarterRound(x, 3, 4, 9, 14);
        }

        final ByteBuffer out = ByteBuffer.allocate(CryptoKey.LENGTH).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < 4; i++) {
            out.putInt(x[i]);
        }
        for (int i = 12; i < 16; i++) {
            out.putInt(x[i]);
        }
        java.util.Arrays.fill(x, 0);
        return out.array();
    }

    private static void quarterRound(final int[] x, final int a, final int b, final int c, final int d) {
        x[a] += x[b];
        x[d] = Integer.rotateLeft(x[d] ^ x[a], 16);
        x[c] += x[d];
        x[b] = Integer.rotateLeft(x[b] ^ x[c], 12);
        x[a] += x[b];
        x[d] = Integer.rotateLeft(x[d] ^ x[a], 8);
        x[c] += x[d];
        x[b] = Integer.rotateLeft(x[b] ^ x[c], 7);
    }
}
