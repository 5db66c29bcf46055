package dev.kms.codec;

import java.nio.ByteBuffer;

/**
 * Беззнаковые varint (LEB128).
 * Формат: младшие 7 бит в каждом байте полезные, старший бит признак продолжения.
 * Для {@code int} максимум 5 байт, для {@code long} 10 байт.
 * <p>
 * Отрицательные значения не пишем: версии, длины и счётчики всегда неотрицательны.
 */
public final class VarInts {
    public static final int MAX_VARINT_BYTES = 5;

    public static final int MAX_VARLONG_BYTES = 10;

    private VarInts() {
    }

    public static void putVarInt(int value, ByteBuffer dst) {
        if (value < 0) {
            throw new IllegalArgumentException("negative varint: " + value);
        }
        putVarLong(value, dst);
    }

    public static void putVarLong(long value, ByteBuffer dst) {
        if (value < 0) {
            throw new IllegalArgumentException("negative varlong: " + value);
        }
        while ((value & ~0x7FL) != 0) {
            dst.put((byte) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        // последний байт без флага продолжения
        dst.put((byte) value);
    }

    public static int sizeOfVarLong(long value) {
        int size = 1;
        while ((value & ~0x7FL) != 0) {
            value >>>= 7;
            size++;
        }
        return size;
    }

    public static int getVarInt(ByteBuffer src) throws CodecFormatException {
        final long v = read(src, MAX_VARINT_BYTES);
        if (v > Integer.MAX_VALUE) {
            throw new CodecFormatException("varint out of int range: " + v);
        }
        return (int) v;
    }

    public static long getVarLong(ByteBuffer src) throws CodecFormatException {
        final long v = read(src, MAX_VARLONG_BYTES);
        if (v < 0) {
            throw new CodecFormatException("varlong out of range: " + Long.toUnsignedString(v));
        }
        return v;
    }

    private static long read(ByteBuffer src, int maxBytes) throws CodecFormatException {
        long result = 0;
        int shift = 0;
        for (int i = 0; i < maxBytes; i++) {
            if (!src.hasRemaining()) {
                throw new CodecFormatException("truncated varint at offset " + src.position());
            }
            final byte b = src.get();
            if (shift == 63 && (b & 0x7E) != 0) {
                throw new CodecFormatException("Malformed varint: exceeds 64 bits");
            }
            result |= (long) (b & 0x7F) << shift;
            if (b >= 0) {
                return result;
            }
            shift += 7;
        }
        throw new CodecFormatException("Malformed varint: exceeds " + maxBytes + " bytes");
    }
}
