package com.traneptora.lightlevel.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileListsTest {

    @TempDir
    Path tempDir;

    private final List<Path> found = List.of(
        Path.of("/scans/reel1/f0003.tif"),
        Path.of("/scans/reel1/f0001.tif"),
        Path.of("/scans/reel2/f0002.tif"));

    @Test
    void testBaseName() {
        assertEquals("f0001.tif", FileLists.baseName("/scans/reel1/f0001.tif"));
        assertEquals("f0001.tif", FileLists.baseName("D:\\scans\\reel1\\f0001.tif"));
        assertEquals("f0001.tif", FileLists.baseName("f0001.tif"));
        assertEquals("", FileLists.baseName("/scans/"));
    }

    @Test
    void testReadListSkipsBlanksAndStripsTimestamps() throws IOException {
        Path list = tempDir.resolve("processed.txt");
        Files.write(list, List.of("Tue Mar 5 14:07:09 2024", "/scans/a.tif\tTue Mar 5 14:08:00 2024", "",
            "/scans/b.tif"), StandardCharsets.UTF_8);
        assertEquals(List.of("Tue Mar 5 14:07:09 2024", "/scans/a.tif", "/scans/b.tif"), FileLists.readList(list));
    }

    @Test
    void testSelectMandatory() {
        FileLists.Selection selection = FileLists.selectMandatory(found,
            List.of("C:\\elsewhere\\f0002.tif", "f0001.tif", "f0009.tif"));
        assertEquals(List.of(Path.of("/scans/reel1/f0001.tif"), Path.of("/scans/reel2/f0002.tif")), selection.files);
        assertEquals(List.of("f0009.tif"), selection.missing);
    }

    @Test
    void testSelectMandatoryAllPresent() {
        FileLists.Selection selection = FileLists.selectMandatory(found, List.of("f0003.tif"));
        assertEquals(List.of(Path.of("/scans/reel1/f0003.tif")), selection.files);
        assertTrue(selection.missing.isEmpty());
    }

    @Test
    void testRemoveProcessedOrdersByName() {
        List<Path> remaining = FileLists.removeProcessed(found, List.of("/old/machine/f0003.tif"));
        assertEquals(List.of(Path.of("/scans/reel1/f0001.tif"), Path.of("/scans/reel2/f0002.tif")), remaining);
    }

    @Test
    void testRemoveProcessedIgnoresUnknownNames() {
        assertEquals(3, FileLists.removeProcessed(found, List.of("Tue Mar 5 14:07:09 2024")).size());
    }

    @Test
    void testSharedNamesAreNotCollapsed() {
        List<Path> twins = List.of(
            Path.of("/scans/reel1/f0001.tif"),
            Path.of("/scans/reel2/f0001.tif"),
            Path.of("/scans/reel2/f0002.tif"));
        assertEquals(Set.of("f0001.tif"), FileLists.duplicateBaseNames(twins));
        assertTrue(FileLists.duplicateBaseNames(found).isEmpty());

        assertEquals(List.of(Path.of("/scans/reel1/f0001.tif"), Path.of("/scans/reel2/f0001.tif")),
            FileLists.selectMandatory(twins, List.of("f0001.tif")).files);
        assertEquals(List.of(Path.of("/scans/reel1/f0001.tif"), Path.of("/scans/reel2/f0001.tif")),
            FileLists.removeProcessed(twins, List.of("f0002.tif")));
        assertEquals(List.of(Path.of("/scans/reel2/f0002.tif")),
            FileLists.removeProcessed(twins, List.of("/elsewhere/f0001.tif")));
    }
}
