package dev.kms.fs;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.kms.codec.CodecFormatException;
import dev.kms.codec.JsonSnapshotCodec;
import dev.kms.codec.RecordType;
import dev.kms.core.VersionedStore;
import dev.kms.core.model.StoreSnapshot;

import java.io.IOException;
import java.nio.file.Path;

public class PlainJsonStoreFile<K> extends AbstractStoreFile<K> {
    private final JsonSnapshotCodec<K> codec;

    public PlainJsonStoreFile(final VersionedStore<K> store, final Path path, final RecordType<K> recordType) {
        this(store, path, recordType, JsonSnapshotCodec.defaultMapper());
    }

    public PlainJsonStoreFile(final VersionedStore<K> store, final Path path, final RecordType<K> recordType,
                              final ObjectMapper mapper) {
        super(store, path);
        this.codec = new JsonSnapshotCodec<>(mapper, recordType);
    }

    public static <K> PlainJsonStoreFile<K> load(final Path path, final RecordType<K> recordType)
            throws IOException, CodecFormatException {
        return load(path, recordType, JsonSnapshotCodec.defaultMapper());
    }

    public static <K> PlainJsonStoreFile<K> load(final Path path, final RecordType<K> recordType,
                                                 final ObjectMapper mapper)
            throws IOException, CodecFormatException {
        final var codec = new JsonSnapshotCodec<>(mapper, recordType);
        final StoreSnapshot<K> snapshot = codec.decode(readFile(path));
        logLoaded(StoreVariant.JSON, path, snapshot);
        return new PlainJsonStoreFile<>(VersionedStore.fromSnapshot(snapshot, recordType.copier()), path,
                recordType, mapper);
    }

    @Override
    protected byte[] encode(final StoreSnapshot<K> snapshot) throws CodecFormatException {
        return codec.encode(snapshot);
    }

    @Override
    public StoreVariant variant() {
        return StoreVariant.JSON;
    }
}
