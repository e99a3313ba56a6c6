package com.traneptora.lightlevel.io;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Locale;

import com.traneptora.lightlevel.analysis.FileResult;

/**
 * Appends {@code path \t maxFALL \t maxCLL} lines. Failed files carry the
 * sentinel values of their {@link com.traneptora.lightlevel.analysis.FrameMetrics}.
 */
public class ResultWriter implements Closeable {

    private final Writer out;

    public ResultWriter(Writer out) {
        this.out = out;
    }

    public static ResultWriter append(Path path) throws IOException {
        return new ResultWriter(Files.newBufferedWriter(path, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE));
    }

    public static String format(FileResult result) {
        return String.format("%s\t%s\t%s", result.path, formatNumber(result.metrics.maxFALL),
            formatNumber(result.metrics.maxCLL));
    }

    /* six significant digits, like a default C++ ostream */
    static String formatNumber(double value) {
        String s = String.format(Locale.ROOT, "%.6g", value);
        int exponent = s.indexOf('e');
        if (exponent < 0)
            return stripZeros(s);
        return stripZeros(s.substring(0, exponent)) + s.substring(exponent);
    }

    private static String stripZeros(String mantissa) {
        if (mantissa.indexOf('.') < 0)
            return mantissa;
        String s = mantissa.replaceAll("0+$", "");
        if (s.endsWith("."))
            s = s.substring(0, s.length() - 1);
        return s;
    }

    public void write(FileResult result) throws IOException {
        out.write(format(result));
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
