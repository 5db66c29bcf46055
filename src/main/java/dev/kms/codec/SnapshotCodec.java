package dev.kms.codec;

import dev.kms.core.model.StoreSnapshot;

/**
 * Кодек без состояния: снимок хранилища в байты и обратно.
 */
public interface SnapshotCodec<K> {

    byte[] encode(StoreSnapshot<K> snapshot) throws CodecFormatException;

    StoreSnapshot<K> decode(byte[] bytes) throws CodecFormatException;
}
