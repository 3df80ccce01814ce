package org.iceforge.hoard.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BlobFilesTest {

    @TempDir
    Path dir;

    @Test
    void writeAtomically_replacesAndLeavesNoTempFiles() throws Exception {
        Path target = dir.resolve("a/b/x.blob");
        BlobFiles.writeAtomically(target, new byte[]{1});
        BlobFiles.writeAtomically(target, new byte[]{2, 3});

        assertArrayEquals(new byte[]{2, 3}, Files.readAllBytes(target));
        try (var files = Files.list(target.getParent())) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void copyAtomically_keepsSource() throws Exception {
        Path src = dir.resolve("src.bin");
        Files.write(src, new byte[]{4, 5});
        Path target = dir.resolve("out/copy.bin");

        BlobFiles.copyAtomically(src, target);

        assertArrayEquals(new byte[]{4, 5}, Files.readAllBytes(target));
        assertTrue(Files.exists(src));
    }

    @Test
    void resolveInside_rejectsTraversal() {
        assertEquals(dir.toAbsolutePath().normalize().resolve("entries/k.blob"),
                BlobFiles.resolveInside(dir, "entries/k.blob"));
        assertThrows(IllegalArgumentException.class, () -> BlobFiles.resolveInside(dir, "../escape.blob"));
        assertThrows(IllegalArgumentException.class, () -> BlobFiles.resolveInside(dir, "entries/.."));
    }

    @Test
    void deleteRecursively_toleratesMissingDir() throws Exception {
        Path tree = dir.resolve("v1");
        Files.createDirectories(tree.resolve("nested"));
        Files.write(tree.resolve("nested/f"), new byte[]{1});

        BlobFiles.deleteRecursively(tree);
        BlobFiles.deleteRecursively(tree);

        assertFalse(Files.exists(tree));
    }
}
