package dev.kms.fs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Замена файла целиком: пишем во временный файл рядом, сбрасываем на диск и атомарно переименовываем.
 * При любой ошибке старое содержимое остаётся на месте, временный файл удаляется.
 * После переименования сбрасывается и сам каталог, иначе rename может потеряться при сбое.
 */
final class AtomicFiles {
    private static final Logger log = LoggerFactory.getLogger(AtomicFiles.class);

    private AtomicFiles() {
    }

    static void write(final Path target, final byte[] bytes) throws IOException {
        final Path absolute = target.toAbsolutePath();
        final Path dir = absolute.getParent();
        Files.createDirectories(dir);

        final Path tmp = Files.createTempFile(dir, absolute.getFileName() + ".", ".tmp");
        try {
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                final ByteBuffer buf = ByteBuffer.wrap(bytes);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                ch.force(true);
            }
            Files.move(tmp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        syncDirectory(dir);
    }

    /**
     * fsync каталога. Не везде поддерживается (например, Windows), такие отказы только логируются.
     */
    static void syncDirectory(final Path dir) {
        try (FileChannel ch = FileChannel.open(dir, StandardOpenOption.READ)) {
            ch.force(true);
        } catch (IOException e) {
            log.debug("Directory sync is not available for {}: {}", dir, e.toString());
        }
    }
}
