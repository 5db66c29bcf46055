package dev.kms.core;

import java.util.Optional;

/**
 * Общий контракт менеджера ключей. Локальное хранилище, файловые обёртки
 * и будущие удалённые источники должны быть взаимозаменяемы через него.
 */
public interface KeyManager<K> {

    Optional<K> get(long version) throws KMSException;

    Optional<K> latest() throws KMSException;

    /**
     * @return версия, присвоенная новой записи
     */
    long create(K key) throws KMSException;

    Optional<K> delete(long version) throws KMSException;
}
