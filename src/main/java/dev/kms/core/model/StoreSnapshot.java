package dev.kms.core.model;

import java.util.Collections;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Стабильная форма хранилища для сериализации: {@code counter} и упорядоченные {@code entries}.
 * Никаких блокировок, только значения. Кодеки работают исключительно с этим типом.
 */
public record StoreSnapshot<K>(long counter, NavigableMap<Long, K> entries) {

    public StoreSnapshot {
        Objects.requireNonNull(entries, "entries");
        if (counter < 0) {
            throw new IllegalArgumentException("counter must not be negative: " + counter);
        }
        final var copy = new TreeMap<Long, K>();
        for (var e : entries.entrySet()) {
            final long version = Objects.requireNonNull(e.getKey(), "version");
            if (version <= 0 || version > counter) {
                throw new IllegalArgumentException(
                        "version " + version + " is outside of 1.." + counter);
            }
            copy.put(version, Objects.requireNonNull(e.getValue(), "record for version " + version));
        }
        entries = Collections.unmodifiableNavigableMap(copy);
    }

    public static <K> StoreSnapshot<K> empty() {
        return new StoreSnapshot<>(0, new TreeMap<>());
    }
}
