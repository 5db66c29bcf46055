package dev.kms.core.model;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Arrays;
import java.util.Objects;

/**
 * Ключевой материал и время создания (секунды с эпохи).
 * Неизменяемый: массив копируется и при создании, и при чтении.
 */
public record Key(byte[] data, long created) {

    private static final SecureRandom RANDOM = new SecureRandom();

    public Key {
        Objects.requireNonNull(data, "data");
        if (created < 0) {
            throw new IllegalArgumentException("created must not be negative: " + created);
        }
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    public int length() {
        return data.length;
    }

    public static Builder builder(final byte[] data) {
        return new Builder(data);
    }

    /**
     * Билдер со случайным материалом из {@link SecureRandom}.
     */
    public static Builder randomBuilder(final int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("key size must be positive: " + size);
        }
        final byte[] bytes = new byte[size];
        RANDOM.nextBytes(bytes);
        return new Builder(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Key other)) return false;
        return created == other.created && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(data) + Long.hashCode(created);
    }

    // материал ключа в лог не попадает
    @Override
    public String toString() {
        return "Key[length=" + data.length + ", created=" + created + "]";
    }

    public static final class Builder {
        private final byte[] data;

        private Long created;

        private Clock clock = Clock.systemUTC();

        private Builder(final byte[] data) {
            this.data = Objects.requireNonNull(data, "data");
        }

        public Builder created(final long created) {
            this.created = created;
            return this;
        }

        Builder clock(final Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Key build() {
            final long ts = created != null ? created : clock.instant().getEpochSecond();
            return new Key(data, ts);
        }
    }
}
