package dev.kms.core;

import dev.kms.core.model.StoreSnapshot;
import dev.kms.core.model.VersionedKey;

import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/**
 * Версионированное хранилище ключей.
 * <p>
 * Две независимые блокировки: мьютекс счётчика и read/write блокировка карты.
 * Порядок захвата всегда один: сначала счётчик, потом карта. Обратного порядка нет ни в одной операции.
 * <p>
 * Счётчик хранит максимальную выданную версию и никогда не уменьшается; удалённые версии
 * больше не выдаются. Исключение, вылетевшее из критической секции записи, помечает хранилище
 * как повреждённое, после чего все операции бросают {@link StorePoisonedException}.
 */
public class VersionedStore<K> implements KeyManager<K> {

    private final NavigableMap<Long, K> store = new TreeMap<>();

    private final ReadWriteLock storeLock = new ReentrantReadWriteLock();

    private final Lock countLock = new ReentrantLock();

    private long count;

    private final UnaryOperator<K> copier;

    private volatile Throwable poisonCause;

    public VersionedStore() {
        this(UnaryOperator.identity());
    }

    /**
     * @param copier копирование записи при вставке и при чтении; для неизменяемых типов подходит identity
     */
    public VersionedStore(final UnaryOperator<K> copier) {
        this.copier = Objects.requireNonNull(copier, "copier");
    }

    public static <K> VersionedStore<K> fromSnapshot(final StoreSnapshot<K> snapshot,
                                                     final UnaryOperator<K> copier) {
        final var local = new VersionedStore<K>(copier);
        local.store.putAll(snapshot.entries());
        local.count = snapshot.counter();
        return local;
    }

    public long count() throws StorePoisonedException {
        countLock.lock();
        try {
            checkPoisoned();
            return count;
        } finally {
            countLock.unlock();
        }
    }

    /**
     * Вставляет запись под следующей версией.
     * Счётчик фиксируется только после успешной вставки, поэтому читатель не увидит
     * значение счётчика без соответствующей записи. Если вставка упала, запись откатывается,
     * счётчик остаётся прежним, а хранилище помечается повреждённым.
     *
     * @return присвоенная версия
     */
    public long update(final K key) throws KMSException {
        Objects.requireNonNull(key, "key");

        countLock.lock();
        try {
            checkPoisoned();
            if (count == Long.MAX_VALUE) {
                throw new VersionExhaustedException(count);
            }
            final long version = count + 1;

            storeLock.writeLock().lock();
            try {
                checkPoisoned();
                store.put(version, copier.apply(key));
            } catch (RuntimeException | Error e) {
                store.remove(version);
                poison(e);
                throw e;
            } finally {
                storeLock.writeLock().unlock();
            }

            count = version;
            return version;
        } finally {
            countLock.unlock();
        }
    }

    /**
     * Удаляет запись. Счётчик не трогается: версия остаётся выведенной из оборота.
     */
    public Optional<K> drop(final long version) throws StorePoisonedException {
        storeLock.writeLock().lock();
        try {
            checkPoisoned();
            return Optional.ofNullable(store.remove(version));
        } finally {
            storeLock.writeLock().unlock();
        }
    }

    @Override
    public Optional<K> get(final long version) throws StorePoisonedException {
        return getWithVersion(version).map(VersionedKey::key);
    }

    public Optional<VersionedKey<K>> getWithVersion(final long version) throws StorePoisonedException {
        storeLock.readLock().lock();
        try {
            checkPoisoned();
            final K key = store.get(version);
            if (key == null) {
                return Optional.empty();
            }
            return Optional.of(new VersionedKey<>(version, copier.apply(key)));
        } finally {
            storeLock.readLock().unlock();
        }
    }

    /**
     * Запись с максимальной присутствующей версией. Может быть меньше {@link #count()},
     * если последнюю запись удалили.
     */
    @Override
    public Optional<K> latest() throws StorePoisonedException {
        return latestWithVersion().map(VersionedKey::key);
    }

    public Optional<VersionedKey<K>> latestWithVersion() throws StorePoisonedException {
        storeLock.readLock().lock();
        try {
            checkPoisoned();
            final Map.Entry<Long, K> last = store.lastEntry();
            if (last == null) {
                return Optional.empty();
            }
            return Optional.of(new VersionedKey<>(last.getKey(), copier.apply(last.getValue())));
        } finally {
            storeLock.readLock().unlock();
        }
    }

    /**
     * Открывает разделяемую блокировку на всю карту для массового обхода без копирования.
     * Закрывать нужно в том же потоке; изменять хранилище, пока читатель открыт, нельзя.
     */
    public StoreReader<K> storeReader() throws StorePoisonedException {
        final Lock readLock = storeLock.readLock();
        readLock.lock();
        try {
            checkPoisoned();
        } catch (StorePoisonedException e) {
            readLock.unlock();
            throw e;
        }
        return new StoreReader<>(store, readLock);
    }

    /**
     * Согласованный снимок счётчика и записей для кодеков.
     */
    public StoreSnapshot<K> snapshot() throws StorePoisonedException {
        countLock.lock();
        try {
            checkPoisoned();
            storeLock.readLock().lock();
            try {
                checkPoisoned();
                final var entries = new TreeMap<Long, K>();
                for (var e : store.entrySet()) {
                    entries.put(e.getKey(), copier.apply(e.getValue()));
                }
                return new StoreSnapshot<>(count, entries);
            } finally {
                storeLock.readLock().unlock();
            }
        } finally {
            countLock.unlock();
        }
    }

    public boolean isPoisoned() {
        return poisonCause != null;
    }

    @Override
    public long create(final K key) throws KMSException {
        return update(key);
    }

    @Override
    public Optional<K> delete(final long version) throws KMSException {
        return drop(version);
    }

    private void poison(final Throwable cause) {
        if (poisonCause == null) {
            poisonCause = cause;
        }
    }

    private void checkPoisoned() throws StorePoisonedException {
        final Throwable cause = poisonCause;
        if (cause != null) {
            throw new StorePoisonedException("Store poisoned by a failed write", cause);
        }
    }

    @Override
    public String toString() {
        return "VersionedStore[poisoned=" + isPoisoned() + "]";
    }
}
