package dev.kms.fs;

import dev.kms.core.KMSException;
import dev.kms.core.KeyManager;
import dev.kms.core.StorePoisonedException;
import dev.kms.core.StoreReader;
import dev.kms.core.VersionedStore;
import dev.kms.core.model.VersionedKey;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Хранилище, привязанное к одному файлу и одной кодировке.
 * Все операции чтения и записи проксируются в обёрнутый {@link VersionedStore};
 * на диск состояние попадает только через {@link #save()}.
 */
public interface StoreFile<K> extends KeyManager<K> {

    VersionedStore<K> store();

    Path path();

    StoreVariant variant();

    void save() throws IOException, KMSException;

    default long count() throws StorePoisonedException {
        return store().count();
    }

    default long update(K key) throws KMSException {
        return store().update(key);
    }

    default Optional<K> drop(long version) throws StorePoisonedException {
        return store().drop(version);
    }

    default Optional<VersionedKey<K>> getWithVersion(long version) throws StorePoisonedException {
        return store().getWithVersion(version);
    }

    default Optional<VersionedKey<K>> latestWithVersion() throws StorePoisonedException {
        return store().latestWithVersion();
    }

    default StoreReader<K> storeReader() throws StorePoisonedException {
        return store().storeReader();
    }

    @Override
    default Optional<K> get(long version) throws KMSException {
        return store().get(version);
    }

    @Override
    default Optional<K> latest() throws KMSException {
        return store().latest();
    }

    @Override
    default long create(K key) throws KMSException {
        return store().create(key);
    }

    @Override
    default Optional<K> delete(long version) throws KMSException {
        return store().delete(version);
    }
}
