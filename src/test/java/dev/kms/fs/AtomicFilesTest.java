package dev.kms.fs;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class AtomicFilesTest {

    @TempDir
    Path tmp;

    private List<Path> listing() throws IOException {
        try (Stream<Path> files = Files.list(tmp)) {
            return files.toList();
        }
    }

    @Test
    void replacesExistingFile() throws IOException {
        final Path target = tmp.resolve("store.bin");
        Files.write(target, new byte[]{1, 2, 3, 4, 5, 6});

        AtomicFiles.write(target, new byte[]{9, 9});

        assertArrayEquals(new byte[]{9, 9}, Files.readAllBytes(target));
        assertEquals(List.of(target), listing());
    }

    @Test
    void createsMissingFile() throws IOException {
        final Path target = tmp.resolve("fresh.bin");
        AtomicFiles.write(target, new byte[0]);
        assertEquals(0, Files.size(target));
    }

    @Test
    void directorySyncToleratesUnsupportedTargets() throws IOException {
        AtomicFiles.syncDirectory(tmp);
        AtomicFiles.syncDirectory(tmp.resolve("missing"));
        assertEquals(List.of(), listing());
    }

    @Test
    void failedRenameRemovesTempFile() throws IOException {
        // на месте файла непустой каталог: rename не пройдёт
        final Path target = tmp.resolve("occupied");
        Files.createDirectory(target);
        Files.write(target.resolve("child"), new byte[]{1});

        assertThrows(IOException.class, () -> AtomicFiles.write(target, new byte[]{1, 2}));

        assertEquals(List.of(target), listing());
        assertTrue(Files.isDirectory(target));
    }
}
