package dev.kms.codec;

import dev.kms.core.model.StoreSnapshot;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;
import java.util.zip.CRC32C;

/**
 * Бинарный формат снимка хранилища.
 * <ul>
 *   <li>{@code magic}: 4 байта {@code "KMSB"}</li>
 *   <li>{@code format}: 1 байт, сейчас {@code 1}</li>
 *   <li>{@code counter}: varlong, максимальная выданная версия</li>
 *   <li>{@code entryCount}: varint количество записей</li>
 *   <li>{@code entries[entryCount]}: {@code version} varlong, {@code recordLen} varint,
 *   {@code recordBytes[recordLen]}; версии строго по возрастанию</li>
 *   <li>{@code crc32c}: 4 байта big-endian на всё предыдущее содержимое</li>
 * </ul>
 * Поле {@code counter} всегда идёт раньше {@code entries}.
 */
public final class BinarySnapshotCodec<K> implements SnapshotCodec<K> {
    private static final byte[] MAGIC = {'K', 'M', 'S', 'B'};

    static final byte FORMAT_VERSION = 1;

    private static final int HEADER_LEN = MAGIC.length + 1;

    private static final int CRC_LEN = 4;

    private final RecordSerializer<K> serializer;

    public BinarySnapshotCodec(final RecordSerializer<K> serializer) {
        this.serializer = Objects.requireNonNull(serializer, "serializer");
    }

    public BinarySnapshotCodec(final RecordType<K> recordType) {
        this(recordType.serializer());
    }

    @Override
    public byte[] encode(final StoreSnapshot<K> snapshot) {
        final var entries = snapshot.entries();
        final List<byte[]> records = new ArrayList<>(entries.size());

        int size = HEADER_LEN
                + VarInts.sizeOfVarLong(snapshot.counter())
                + VarInts.sizeOfVarLong(entries.size())
                + CRC_LEN;
        for (var e : entries.entrySet()) {
            final byte[] rec = serializer.toBytes(e.getValue());
            records.add(rec);
            size += VarInts.sizeOfVarLong(e.getKey()) + VarInts.sizeOfVarLong(rec.length) + rec.length;
        }

        final ByteBuffer buf = ByteBuffer.allocate(size);
        buf.put(MAGIC);
        buf.put(FORMAT_VERSION);
        VarInts.putVarLong(snapshot.counter(), buf);
        VarInts.putVarInt(entries.size(), buf);

        int i = 0;
        for (long version : entries.keySet()) {
            final byte[] rec = records.get(i++);
            VarInts.putVarLong(version, buf);
            VarInts.putVarInt(rec.length, buf);
            buf.put(rec);
        }

        final CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, buf.position());
        buf.putInt((int) crc.getValue());
        return buf.array();
    }

    @Override
    public StoreSnapshot<K> decode(final byte[] bytes) throws CodecFormatException {
        if (bytes.length < HEADER_LEN + CRC_LEN) {
            throw new CodecFormatException("snapshot too short: " + bytes.length + " bytes");
        }

        final int bodyLen = bytes.length - CRC_LEN;
        final CRC32C crc = new CRC32C();
        crc.update(bytes, 0, bodyLen);
        final int expected = ByteBuffer.wrap(bytes, bodyLen, CRC_LEN).getInt();
        if ((int) crc.getValue() != expected) {
            throw new CodecFormatException("snapshot checksum mismatch");
        }

        final ByteBuffer buf = ByteBuffer.wrap(bytes, 0, bodyLen);
        final byte[] magic = new byte[MAGIC.length];
        buf.get(magic);
        if (!Arrays.equals(MAGIC, magic)) {
            throw new CodecFormatException("not a binary key store snapshot");
        }
        final byte format = buf.get();
        if (format != FORMAT_VERSION) {
            throw new CodecFormatException("unsupported snapshot format: " + format);
        }

        final long counter = VarInts.getVarLong(buf);
        final int count = VarInts.getVarInt(buf);

        final var entries = new TreeMap<Long, K>();
        long previous = 0;
        for (int i = 0; i < count; i++) {
            final long version = VarInts.getVarLong(buf);
            if (version <= previous) {
                throw new CodecFormatException("versions are not ascending at " + version);
            }
            final int len = VarInts.getVarInt(buf);
            if (buf.remaining() < len) {
                throw new CodecFormatException("truncated record for version " + version);
            }
            final byte[] rec = new byte[len];
            buf.get(rec);
            entries.put(version, serializer.fromBytes(rec));
            previous = version;
        }
        if (buf.hasRemaining()) {
            throw new CodecFormatException(buf.remaining() + " trailing bytes after entries");
        }

        try {
            return new StoreSnapshot<>(counter, entries);
        } catch (IllegalArgumentException e) {
            throw new CodecFormatException("inconsistent snapshot: " + e.getMessage(), e);
        }
    }
}
