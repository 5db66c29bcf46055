package dev.kms.fs;

import dev.kms.codec.RecordType;
import dev.kms.core.KMSException;
import dev.kms.core.VersionedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;

/**
 * Выбор обёртки по {@link StoreFileOptions}, чтобы вызывающий код не зависел от конкретного класса.
 */
public final class StoreFiles {
    private static final Logger log = LoggerFactory.getLogger(StoreFiles.class);

    private StoreFiles() {
    }

    public static <K> StoreFile<K> load(final StoreFileOptions options, final RecordType<K> recordType)
            throws IOException, KMSException {
        return switch (options.variant()) {
            case BINARY -> PlainBinaryStoreFile.load(options.path(), recordType);
            case JSON -> PlainJsonStoreFile.load(options.path(), recordType);
            case ENCRYPTED -> EncryptedStoreFile.load(options.path(), options.key(), recordType);
        };
    }

    /**
     * Загружает существующий файл; если файла нет и это разрешено опциями, оборачивает пустое хранилище.
     * Сам файл появится только после первого {@code save()}.
     */
    public static <K> StoreFile<K> open(final StoreFileOptions options, final RecordType<K> recordType)
            throws IOException, KMSException {
        if (Files.exists(options.path())) {
            return load(options, recordType);
        }
        if (!options.createIfMissing()) {
            throw new NoSuchFileException(options.path().toString());
        }
        log.info("No store file at {}, starting with an empty {} store", options.path(), options.variant());
        return wrap(new VersionedStore<>(recordType.copier()), options, recordType);
    }

    public static <K> StoreFile<K> wrap(final VersionedStore<K> store, final StoreFileOptions options,
                                        final RecordType<K> recordType) {
        return switch (options.variant()) {
            case BINARY -> new PlainBinaryStoreFile<>(store, options.path(), recordType);
            case JSON -> new PlainJsonStoreFile<>(store, options.path(), recordType);
            case ENCRYPTED -> new EncryptedStoreFile<>(store, options.path(), options.key(), recordType);
        };
    }
}
