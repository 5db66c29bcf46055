package dev.kms.codec;

import dev.kms.core.model.Key;

import java.nio.ByteBuffer;

public final class RecordSerializers {
    private RecordSerializers() {
    }

    /**
     * {@code created} varlong, дальше сырой материал ключа до конца записи.
     */
    public static final RecordSerializer<Key> KEYS = new RecordSerializer<>() {
        @Override
        public byte[] toBytes(Key record) {
            final byte[] data = record.data();
            final ByteBuffer buf = ByteBuffer.allocate(VarInts.sizeOfVarLong(record.created()) + data.length);
            VarInts.putVarLong(record.created(), buf);
            buf.put(data);
            return buf.array();
        }

        @Override
        public Key fromBytes(byte[] bytes) throws CodecFormatException {
            final ByteBuffer buf = ByteBuffer.wrap(bytes);
            final long created = VarInts.getVarLong(buf);
            final byte[] data = new byte[buf.remaining()];
            buf.get(data);
            return new Key(data, created);
        }
    };

    /**
     * 8 байт big-endian.
     */
    public static final RecordSerializer<Long> LONGS = new RecordSerializer<>() {
        @Override
        public byte[] toBytes(Long record) {
            return ByteBuffer.allocate(Long.BYTES).putLong(record).array();
        }

        @Override
        public Long fromBytes(byte[] bytes) throws CodecFormatException {
            if (bytes.length != Long.BYTES) {
                throw new CodecFormatException("long record must be 8 bytes, got " + bytes.length);
            }
            return ByteBuffer.wrap(bytes).getLong();
        }
    };

    public static final RecordSerializer<byte[]> BYTES = new RecordSerializer<>() {
        @Override
        public byte[] toBytes(byte[] record) {
            return record.clone();
        }

        @Override
        public byte[] fromBytes(byte[] bytes) {
            return bytes.clone();
        }
    };
}
