package dev.kms.codec;

/**
 * Бинарное представление одной записи внутри снимка.
 */
public interface RecordSerializer<K> {

    byte[] toBytes(K record);

    K fromBytes(byte[] bytes) throws CodecFormatException;
}
