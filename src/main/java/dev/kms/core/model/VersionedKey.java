package dev.kms.core.model;

/**
 * Пара (версия, запись), которую отдают операции чтения. Запись уже скопирована из хранилища.
 */
public record VersionedKey<K>(long version, K key) {
}
