package dev.kms.cli;

import dev.kms.core.KMSException;
import dev.kms.core.model.Key;
import dev.kms.core.model.VersionedKey;
import dev.kms.fs.StoreFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Одна команда за запуск:
 * <pre>
 *   generate [bytes]   новый случайный ключ (по умолчанию 32 байта), файл сохраняется
 *   get &lt;version&gt;
 *   latest
 *   drop &lt;version&gt;     файл сохраняется, если запись была
 *   count              максимальная выданная версия
 * </pre>
 * Без аргументов ничего не делает.
 */
@Component
public class KeyStoreCommandRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(KeyStoreCommandRunner.class);

    static final int DEFAULT_KEY_SIZE = 32;

    private final StoreFile<Key> storeFile;

    private final PrintStream out;

    @Autowired
    public KeyStoreCommandRunner(final StoreFile<Key> storeFile) {
        this(storeFile, System.out);
    }

    KeyStoreCommandRunner(final StoreFile<Key> storeFile, final PrintStream out) {
        this.storeFile = storeFile;
        this.out = out;
    }

    @Override
    public void run(final ApplicationArguments args) throws IOException, KMSException {
        final List<String> command = args.getNonOptionArgs();
        if (command.isEmpty()) {
            return;
        }
        execute(command);
    }

    void execute(final List<String> command) throws IOException, KMSException {
        switch (command.get(0)) {
            case "generate" -> {
                final int size = command.size() > 1 ? parseInt(command.get(1)) : DEFAULT_KEY_SIZE;
                final long version = storeFile.update(Key.randomBuilder(size).build());
                storeFile.save();
                log.info("Generated key version {} ({} bytes)", version, size);
                out.println("created version " + version);
            }
            case "get" -> {
                final long version = parseVersion(command);
                print(storeFile.getWithVersion(version), "version " + version + " not found");
            }
            case "latest" -> print(storeFile.latestWithVersion(), "store is empty");
            case "drop" -> {
                final long version = parseVersion(command);
                final Optional<Key> removed = storeFile.drop(version);
                if (removed.isPresent()) {
                    storeFile.save();
                    log.info("Dropped key version {}", version);
                    out.println("dropped version " + version);
                } else {
                    out.println("version " + version + " not found");
                }
            }
            case "count" -> out.println(storeFile.count());
            default -> throw new IllegalArgumentException("unknown command: " + command.get(0));
        }
    }

    private void print(final Optional<VersionedKey<Key>> found, final String missing) {
        out.println(found.map(KeyStoreCommandRunner::describe).orElse(missing));
    }

    static String describe(final VersionedKey<Key> vk) {
        final Key key = vk.key();
        return "version=" + vk.version()
                + " created=" + key.created()
                + " data=" + Base64.getEncoder().encodeToString(key.data());
    }

    private static long parseVersion(final List<String> command) {
        if (command.size() < 2) {
            throw new IllegalArgumentException(command.get(0) + " needs a version");
        }
        try {
            return Long.parseLong(command.get(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid version: " + command.get(1), e);
        }
    }

    private static int parseInt(final String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid key size: " + value, e);
        }
    }
}
