package dev.kms.fs;

import dev.kms.crypto.CryptoKey;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Что открыть: вариант обёртки, путь к файлу и ключ (только для {@link StoreVariant#ENCRYPTED}).
 */
public record StoreFileOptions(StoreVariant variant, Path path, CryptoKey key, boolean createIfMissing) {

    public StoreFileOptions {
        Objects.requireNonNull(variant, "variant");
        Objects.requireNonNull(path, "path");
        if (variant == StoreVariant.ENCRYPTED && key == null) {
            throw new IllegalArgumentException("encrypted store file requires a key");
        }
        if (variant != StoreVariant.ENCRYPTED && key != null) {
            throw new IllegalArgumentException(variant + " store file does not take a key");
        }
    }

    public static StoreFileOptions binary(final Path path) {
        return new StoreFileOptions(StoreVariant.BINARY, path, null, false);
    }

    public static StoreFileOptions json(final Path path) {
        return new StoreFileOptions(StoreVariant.JSON, path, null, false);
    }

    public static StoreFileOptions encrypted(final Path path, final CryptoKey key) {
        return new StoreFileOptions(StoreVariant.ENCRYPTED, path, key, false);
    }

    public StoreFileOptions withCreateIfMissing(final boolean create) {
        return new StoreFileOptions(variant, path, key, create);
    }
}
