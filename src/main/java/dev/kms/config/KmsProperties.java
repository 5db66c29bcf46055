package dev.kms.config;

import dev.kms.crypto.CryptoKey;
import dev.kms.fs.StoreFileOptions;
import dev.kms.fs.StoreVariant;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

/**
 * Настройки {@code kms.store.*}: вариант обёртки, путь к файлу и ключ для зашифрованного варианта.
 *
 * @param key 64 hex-символа, нужен только для {@code encrypted}
 */
@ConfigurationProperties(prefix = "kms.store")
public record KmsProperties(
        @DefaultValue("binary") StoreVariant variant,
        @DefaultValue("./data/keys.kms") String path,
        String key,
        @DefaultValue("true") boolean createIfMissing
) {

    public StoreFileOptions toOptions() {
        final Path file = Path.of(path);
        final StoreFileOptions options = switch (variant) {
            case BINARY -> StoreFileOptions.binary(file);
            case JSON -> StoreFileOptions.json(file);
            case ENCRYPTED -> StoreFileOptions.encrypted(file, cryptoKey());
        };
        return options.withCreateIfMissing(createIfMissing);
    }

    private CryptoKey cryptoKey() {
        if (key == null || key.isBlank()) {
            throw new IllegalStateException("kms.store.key is required for the encrypted variant");
        }
        try {
            return CryptoKey.fromHex(key);
        } catch (IllegalArgumentException e) {
            // само значение в сообщение не попадает
            throw new IllegalStateException("kms.store.key must be " + CryptoKey.LENGTH * 2 + " hex characters");
        }
    }

    @Override
    public String toString() {
        return "KmsProperties[variant=" + variant + ", path=" + path + ", createIfMissing=" + createIfMissing + "]";
    }
}
