package dev.kms.core;

/**
 * Хранилище повреждено: предыдущий владелец блокировки упал посреди изменения.
 * Экземпляр больше не используется, его нужно пересоздать (например, перечитать файл).
 */
public class StorePoisonedException extends KMSException {
    public StorePoisonedException(String message) {
        super(message);
    }

    public StorePoisonedException(String message, Throwable cause) {
        super(message, cause);
    }
}
