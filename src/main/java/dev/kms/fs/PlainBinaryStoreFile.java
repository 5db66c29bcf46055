package dev.kms.fs;

import dev.kms.codec.BinarySnapshotCodec;
import dev.kms.codec.CodecFormatException;
import dev.kms.codec.RecordType;
import dev.kms.core.VersionedStore;
import dev.kms.core.model.StoreSnapshot;

import java.io.IOException;
import java.nio.file.Path;

public class PlainBinaryStoreFile<K> extends AbstractStoreFile<K> {
    private final BinarySnapshotCodec<K> codec;

    public PlainBinaryStoreFile(final VersionedStore<K> store, final Path path, final RecordType<K> recordType) {
        super(store, path);
        this.codec = new BinarySnapshotCodec<>(recordType);
    }

    public static <K> PlainBinaryStoreFile<K> load(final Path path, final RecordType<K> recordType)
            throws IOException, CodecFormatException {
        final var codec = new BinarySnapshotCodec<>(recordType);
        final StoreSnapshot<K> snapshot = codec.decode(readFile(path));
        logLoaded(StoreVariant.BINARY, path, snapshot);
        return new PlainBinaryStoreFile<>(VersionedStore.fromSnapshot(snapshot, recordType.copier()), path, recordType);
    }

    @Override
    protected byte[] encode(final StoreSnapshot<K> snapshot) {
        return codec.encode(snapshot);
    }

    @Override
    public StoreVariant variant() {
        return StoreVariant.BINARY;
    }
}
