package dev.kms.fs;

import dev.kms.core.KMSException;
import dev.kms.core.VersionedStore;
import dev.kms.core.model.StoreSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Общая часть обёрток: снимок хранилища, кодирование в байты наследником и атомарная запись.
 */
public abstract class AbstractStoreFile<K> implements StoreFile<K> {
    private static final Logger log = LoggerFactory.getLogger(AbstractStoreFile.class);

    private final VersionedStore<K> store;

    private final Path path;

    protected AbstractStoreFile(final VersionedStore<K> store, final Path path) {
        this.store = Objects.requireNonNull(store, "store");
        this.path = Objects.requireNonNull(path, "path");
    }

    /**
     * Снимок в байты, ровно в том виде, в каком они лягут в файл.
     */
    protected abstract byte[] encode(StoreSnapshot<K> snapshot) throws KMSException;

    @Override
    public final void save() throws IOException, KMSException {
        final StoreSnapshot<K> snapshot = store.snapshot();
        final byte[] bytes = encode(snapshot);
        AtomicFiles.write(path, bytes);
        log.debug("Saved {} store: {} entries, counter {}, {} bytes to {}",
                variant(), snapshot.entries().size(), snapshot.counter(), bytes.length, path);
    }

    @Override
    public VersionedStore<K> store() {
        return store;
    }

    @Override
    public Path path() {
        return path;
    }

    static byte[] readFile(final Path path) throws IOException {
        return Files.readAllBytes(path);
    }

    static <K> void logLoaded(final StoreVariant variant, final Path path, final StoreSnapshot<K> snapshot) {
        log.info("Loaded {} store from {}: {} entries, counter {}",
                variant, path, snapshot.entries().size(), snapshot.counter());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[path=" + path + "]";
    }
}
