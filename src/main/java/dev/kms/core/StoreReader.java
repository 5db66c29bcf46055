package dev.kms.core;

import java.util.Collections;
import java.util.NavigableMap;
import java.util.concurrent.locks.Lock;

/**
 * Представление всей карты под разделяемой блокировкой. Блокировка снимается в {@link #close()}.
 */
public final class StoreReader<K> implements AutoCloseable {
    private final NavigableMap<Long, K> view;

    private final Lock readLock;

    private boolean closed;

    StoreReader(final NavigableMap<Long, K> store, final Lock readLock) {
        this.view = Collections.unmodifiableNavigableMap(store);
        this.readLock = readLock;
    }

    public NavigableMap<Long, K> entries() {
        if (closed) {
            throw new IllegalStateException("StoreReader is closed");
        }
        return view;
    }

    public int size() {
        return entries().size();
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            readLock.unlock();
        }
    }
}
