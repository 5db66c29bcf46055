package dev.kms.codec;

import dev.kms.core.model.Key;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Всё, что кодекам и хранилищу нужно знать о типе записи:
 * класс для JSON, бинарный сериализатор и способ копирования.
 */
public record RecordType<K>(Class<K> type, RecordSerializer<K> serializer, UnaryOperator<K> copier) {

    public static final RecordType<Key> KEYS =
            new RecordType<>(Key.class, RecordSerializers.KEYS, UnaryOperator.identity());

    public static final RecordType<Long> LONGS =
            new RecordType<>(Long.class, RecordSerializers.LONGS, UnaryOperator.identity());

    public static final RecordType<byte[]> BYTES =
            new RecordType<>(byte[].class, RecordSerializers.BYTES, byte[]::clone);

    public RecordType {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(serializer, "serializer");
        Objects.requireNonNull(copier, "copier");
    }
}
