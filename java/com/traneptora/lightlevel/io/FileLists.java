package com.traneptora.lightlevel.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Set arithmetic on file lists. Files are matched by their last path
 * component only, so lists written on another machine, or with Windows
 * separators, still line up with the files found locally.
 */
public final class FileLists {

    public static final class Selection {
        public final List<Path> files;
        public final List<String> missing;

        private Selection(List<Path> files, List<String> missing) {
            this.files = Collections.unmodifiableList(files);
            this.missing = Collections.unmodifiableList(missing);
        }
    }

    private FileLists() {

    }

    /**
     * @return the file name after the last forward or back slash
     */
    public static String baseName(String path) {
        int index = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return path.substring(index + 1);
    }

    /**
     * Reads one path per line. Blank lines are skipped, and anything after
     * the first tab is dropped so a processed log can be read back as a list.
     */
    public static List<String> readList(Path listFile) throws IOException {
        List<String> list = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(listFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                int tab = line.indexOf('\t');
                if (tab >= 0)
                    line = line.substring(0, tab);
                if (!line.isEmpty())
                    list.add(line);
            }
        }
        return list;
    }

    /**
     * Groups paths by file name. Paths sharing a name stay together in
     * their original order, so none of them is lost.
     */
    public static SortedMap<String, List<Path>> byBaseName(List<Path> paths) {
        SortedMap<String, List<Path>> map = new TreeMap<>();
        for (Path path : paths) {
            String name = baseName(path.toString());
            if (!name.isEmpty())
                map.computeIfAbsent(name, k -> new ArrayList<>()).add(path);
        }
        return map;
    }

    private static SortedSet<String> baseNames(List<String> paths) {
        SortedSet<String> names = new TreeSet<>();
        for (String path : paths) {
            String name = baseName(path);
            if (!name.isEmpty())
                names.add(name);
        }
        return names;
    }

    /**
     * @return the names shared by more than one of {@code found}; a list entry
     *         naming one of them selects or skips every file with that name
     */
    public static SortedSet<String> duplicateBaseNames(List<Path> found) {
        SortedSet<String> duplicates = new TreeSet<>();
        for (Map.Entry<String, List<Path>> entry : byBaseName(found).entrySet()) {
            if (entry.getValue().size() > 1)
                duplicates.add(entry.getKey());
        }
        return duplicates;
    }

    /**
     * @return the found files named in {@code mandatory}, ordered by name,
     *         and the names in {@code mandatory} that were not found
     */
    public static Selection selectMandatory(List<Path> found, List<String> mandatory) {
        SortedMap<String, List<Path>> foundMap = byBaseName(found);
        List<Path> files = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String name : baseNames(mandatory)) {
            List<Path> paths = foundMap.get(name);
            if (paths == null)
                missing.add(name);
            else
                files.addAll(paths);
        }
        return new Selection(files, missing);
    }

    /**
     * @return the found files whose names do not appear in {@code processed}, ordered by name
     */
    public static List<Path> removeProcessed(List<Path> found, List<String> processed) {
        SortedSet<String> processedNames = baseNames(processed);
        List<Path> remaining = new ArrayList<>();
        for (Map.Entry<String, List<Path>> entry : byBaseName(found).entrySet()) {
            if (!processedNames.contains(entry.getKey()))
                remaining.addAll(entry.getValue());
        }
        return remaining;
    }
}
