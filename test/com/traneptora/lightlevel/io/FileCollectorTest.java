package com.traneptora.lightlevel.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileCollectorTest {

    @TempDir
    Path tempDir;

    @Test
    void testIsTiff() {
        assertTrue(FileCollector.isTiff(Path.of("a.tif")));
        assertTrue(FileCollector.isTiff(Path.of("a.TIFF")));
        assertTrue(FileCollector.isTiff(Path.of("dir/b.Tif")));
        assertFalse(FileCollector.isTiff(Path.of("a.png")));
        assertFalse(FileCollector.isTiff(Path.of("tif.txt")));
        assertFalse(FileCollector.isTiff(Path.of("motif")));
        assertFalse(FileCollector.isTiff(Path.of("frames/0001_tif")));
        assertFalse(FileCollector.isTiff(Path.of("stiff")));
    }

    @Test
    void testFindsTiffFilesRecursivelyInOrder() throws IOException {
        Path reel = Files.createDirectories(tempDir.resolve("Reel2"));
        Path nested = Files.createDirectories(tempDir.resolve("reel1").resolve("sub"));
        Files.createFile(reel.resolve("B.tif"));
        Files.createFile(reel.resolve("a.TIFF"));
        Files.createFile(nested.resolve("c.tif"));
        Files.createFile(tempDir.resolve("notes.txt"));
        Files.createFile(tempDir.resolve("motif"));
        Files.createDirectories(tempDir.resolve("folder.tif"));

        List<Path> files = FileCollector.findTiffFiles(tempDir);
        assertEquals(List.of(nested.resolve("c.tif"), reel.resolve("a.TIFF"), reel.resolve("B.tif")), files);
    }

    @Test
    void testEmptyDirectory() throws IOException {
        assertTrue(FileCollector.findTiffFiles(tempDir).isEmpty());
    }

    @Test
    void testResolveUserPath() {
        Path home = Path.of(System.getProperty("user.home")).toAbsolutePath().normalize();
        assertEquals(home.resolve("scans"), FileCollector.resolveUserPath("~/scans"));
        assertEquals(Path.of("x").toAbsolutePath(), FileCollector.resolveUserPath("./x"));
    }
}
