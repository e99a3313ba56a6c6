package com.traneptora.lightlevel.io;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Append-only record of finished files: a timestamp line per session, then
 * {@code path \t timestamp} per file. It can be passed back as a processed
 * file list to resume an interrupted batch.
 */
public class ProcessedLog implements Closeable {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy", Locale.US);

    private final Writer out;
    private final Clock clock;

    public ProcessedLog(Writer out, Clock clock) throws IOException {
        this.out = out;
        this.clock = clock;
        out.write(timestamp());
        out.write('\n');
        out.flush();
    }

    public static ProcessedLog append(Path path) throws IOException {
        return new ProcessedLog(Files.newBufferedWriter(path, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE),
            Clock.systemDefaultZone());
    }

    private String timestamp() {
        return ZonedDateTime.now(clock).format(STAMP);
    }

    public void record(Path path) throws IOException {
        out.write(path.toString());
        out.write('\t');
        out.write(timestamp());
        out.write('\n');
    }

    public void flush() throws IOException {
        out.flush();
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
