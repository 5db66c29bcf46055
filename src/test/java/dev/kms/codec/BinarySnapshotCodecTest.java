package dev.kms.codec;

import dev.kms.core.model.Key;
import dev.kms.core.model.StoreSnapshot;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.TreeMap;
import java.util.zip.CRC32C;

import static org.junit.jupiter.api.Assertions.*;

public class BinarySnapshotCodecTest {

    private final BinarySnapshotCodec<Long> codec = new BinarySnapshotCodec<>(RecordType.LONGS);

    static StoreSnapshot<Long> sample() {
        final var entries = new TreeMap<Long, Long>();
        entries.put(1L, 10L);
        entries.put(2L, 1L);
        entries.put(4L, 4L);
        return new StoreSnapshot<>(5, entries);
    }

    /**
     * Дописывает корректную CRC32C, чтобы проверять разбор тела, а не контрольную сумму.
     */
    static byte[] withCrc(byte[] body) {
        final CRC32C crc = new CRC32C();
        crc.update(body, 0, body.length);
        return ByteBuffer.allocate(body.length + 4).put(body).putInt((int) crc.getValue()).array();
    }

    static ByteBuffer header(int capacity) {
        final ByteBuffer buf = ByteBuffer.allocate(capacity);
        buf.put("KMSB".getBytes(StandardCharsets.US_ASCII));
        buf.put(BinarySnapshotCodec.FORMAT_VERSION);
        return buf;
    }

    static byte[] body(ByteBuffer buf) {
        return Arrays.copyOf(buf.array(), buf.position());
    }

    @Test
    void roundTrip() throws CodecFormatException {
        final var snapshot = sample();
        assertEquals(snapshot, codec.decode(codec.encode(snapshot)));
    }

    @Test
    void emptySnapshot() throws CodecFormatException {
        final byte[] bytes = codec.encode(StoreSnapshot.empty());
        // magic + format + counter + count + crc
        assertEquals(4 + 1 + 1 + 1 + 4, bytes.length);
        assertEquals(StoreSnapshot.<Long>empty(), codec.decode(bytes));
    }

    @Test
    void counterComesBeforeEntries() {
        final byte[] bytes = codec.encode(sample());
        final ByteBuffer buf = ByteBuffer.wrap(bytes, 5, bytes.length - 5);
        assertDoesNotThrow(() -> {
            assertEquals(5, VarInts.getVarLong(buf));
            assertEquals(3, VarInts.getVarInt(buf));
            assertEquals(1, VarInts.getVarLong(buf));
        });
    }

    @Test
    void keysRoundTrip() throws CodecFormatException {
        final var keys = new BinarySnapshotCodec<>(RecordType.KEYS);
        final var entries = new TreeMap<Long, Key>();
        entries.put(1L, new Key(new byte[]{1, 2, 3}, 1_700_000_000L));
        entries.put(3L, new Key(new byte[0], 0));
        final var snapshot = new StoreSnapshot<>(3, entries);

        assertEquals(snapshot, keys.decode(keys.encode(snapshot)));
    }

    @Test
    void bytesRoundTrip() throws CodecFormatException {
        final var bytes = new BinarySnapshotCodec<>(RecordType.BYTES);
        final var entries = new TreeMap<Long, byte[]>();
        entries.put(2L, new byte[]{9, 8, 7});
        final var decoded = bytes.decode(bytes.encode(new StoreSnapshot<>(2, entries)));

        assertEquals(2, decoded.counter());
        assertArrayEquals(new byte[]{9, 8, 7}, decoded.entries().get(2L));
    }

    @Test
    void checksumMismatch() {
        final byte[] bytes = codec.encode(sample());
        bytes[7] ^= 0x01;
        final var e = assertThrows(CodecFormatException.class, () -> codec.decode(bytes));
        assertTrue(e.getMessage().contains("checksum"));
    }

    @Test
    void tooShort() {
        assertThrows(CodecFormatException.class, () -> codec.decode(new byte[0]));
        assertThrows(CodecFormatException.class, () -> codec.decode(new byte[8]));
    }

    @Test
    void wrongMagic() {
        final ByteBuffer buf = ByteBuffer.allocate(16);
        buf.put("JUNK".getBytes(StandardCharsets.US_ASCII)).put((byte) 1).put((byte) 0).put((byte) 0);
        assertThrows(CodecFormatException.class, () -> codec.decode(withCrc(body(buf))));
    }

    @Test
    void unsupportedFormat() {
        final ByteBuffer buf = ByteBuffer.allocate(16);
        buf.put("KMSB".getBytes(StandardCharsets.US_ASCII)).put((byte) 2).put((byte) 0).put((byte) 0);
        final var e = assertThrows(CodecFormatException.class, () -> codec.decode(withCrc(body(buf))));
        assertTrue(e.getMessage().contains("format"));
    }

    @Test
    void versionsMustAscend() {
        final ByteBuffer buf = header(64);
        VarInts.putVarLong(3, buf);
        VarInts.putVarInt(2, buf);
        VarInts.putVarLong(2, buf);
        VarInts.putVarInt(8, buf);
        buf.putLong(1);
        VarInts.putVarLong(1, buf);
        VarInts.putVarInt(8, buf);
        buf.putLong(2);

        assertThrows(CodecFormatException.class, () -> codec.decode(withCrc(body(buf))));
    }

    @Test
    void versionAboveCounter() {
        final ByteBuffer buf = header(64);
        VarInts.putVarLong(1, buf);
        VarInts.putVarInt(1, buf);
        VarInts.putVarLong(2, buf);
        VarInts.putVarInt(8, buf);
        buf.putLong(1);

        final var e = assertThrows(CodecFormatException.class, () -> codec.decode(withCrc(body(buf))));
        assertTrue(e.getMessage().contains("inconsistent"));
    }

    @Test
    void truncatedRecord() {
        final ByteBuffer buf = header(64);
        VarInts.putVarLong(1, buf);
        VarInts.putVarInt(1, buf);
        VarInts.putVarLong(1, buf);
        VarInts.putVarInt(8, buf);
        buf.putInt(1);

        assertThrows(CodecFormatException.class, () -> codec.decode(withCrc(body(buf))));
    }

    @Test
    void trailingBytes() {
        final ByteBuffer buf = header(64);
        VarInts.putVarLong(0, buf);
        VarInts.putVarInt(0, buf);
        buf.put((byte) 7);

        assertThrows(CodecFormatException.class, () -> codec.decode(withCrc(body(buf))));
    }

    @Test
    void wrongRecordSize() {
        final ByteBuffer buf = header(64);
        VarInts.putVarLong(1, buf);
        VarInts.putVarInt(1, buf);
        VarInts.putVarLong(1, buf);
        VarInts.putVarInt(4, buf);
        buf.putInt(1);

        assertThrows(CodecFormatException.class, () -> codec.decode(withCrc(body(buf))));
    }
}
