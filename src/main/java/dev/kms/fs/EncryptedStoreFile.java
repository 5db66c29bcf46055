package dev.kms.fs;

import dev.kms.codec.BinarySnapshotCodec;
import dev.kms.codec.RecordType;
import dev.kms.core.KMSException;
import dev.kms.core.VersionedStore;
import dev.kms.core.model.StoreSnapshot;
import dev.kms.crypto.CryptoBox;
import dev.kms.crypto.CryptoKey;
import dev.kms.crypto.RandomSourceFailureException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Бинарный снимок, запечатанный {@link CryptoBox}. Ключ живёт только в памяти.
 */
public class EncryptedStoreFile<K> extends AbstractStoreFile<K> {
    private final BinarySnapshotCodec<K> codec;

    private final CryptoKey key;

    private final CryptoBox box;

    public EncryptedStoreFile(final VersionedStore<K> store, final Path path, final CryptoKey key,
                              final RecordType<K> recordType) {
        this(store, path, key, recordType, new CryptoBox());
    }

    public EncryptedStoreFile(final VersionedStore<K> store, final Path path, final CryptoKey key,
                              final RecordType<K> recordType, final CryptoBox box) {
        super(store, path);
        this.key = Objects.requireNonNull(key, "key");
        this.box = Objects.requireNonNull(box, "box");
        this.codec = new BinarySnapshotCodec<>(recordType);
    }

    public static <K> EncryptedStoreFile<K> load(final Path path, final CryptoKey key, final RecordType<K> recordType)
            throws IOException, KMSException {
        return load(path, key, recordType, new CryptoBox());
    }

    public static <K> EncryptedStoreFile<K> load(final Path path, final CryptoKey key, final RecordType<K> recordType,
                                                 final CryptoBox box)
            throws IOException, KMSException {
        final byte[] plain = box.decrypt(key, readFile(path));
        final StoreSnapshot<K> snapshot = new BinarySnapshotCodec<>(recordType).decode(plain);
        logLoaded(StoreVariant.ENCRYPTED, path, snapshot);
        return new EncryptedStoreFile<>(VersionedStore.fromSnapshot(snapshot, recordType.copier()), path, key,
                recordType, box);
    }

    @Override
    protected byte[] encode(final StoreSnapshot<K> snapshot) throws RandomSourceFailureException {
        return box.encrypt(key, codec.encode(snapshot));
    }

    public CryptoKey key() {
        return key;
    }

    @Override
    public StoreVariant variant() {
        return StoreVariant.ENCRYPTED;
    }
}
