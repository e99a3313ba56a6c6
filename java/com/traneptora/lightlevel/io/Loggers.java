package com.traneptora.lightlevel.io;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.stream.Stream;

public class Loggers {

    public static final int LOG_BASE = 0;
    public static final int LOG_INFO = 8;
    public static final int LOG_VERBOSE = 16;
    public static final int LOG_TRACE = 24;

    public final int verbosity;
    public final PrintWriter err;

    public Loggers(int verbosity, PrintWriter err) {
        this.verbosity = verbosity;
        this.err = err;
    }

    public Loggers(int verbosity, Writer err) {
        this(verbosity, new PrintWriter(err));
    }

    public static Loggers stderr(int verbosity) {
        return new Loggers(verbosity, new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8)));
    }

    private static Object deepToThing(Object arg) {
        if (arg == null)
            return "null";
        if (arg instanceof Object[])
            return Arrays.deepToString((Object[])arg);
        if (arg instanceof int[])
            return Arrays.toString((int[])arg);
        if (arg instanceof float[])
            return Arrays.toString((float[])arg);
        if (arg instanceof double[])
            return Arrays.toString((double[])arg);
        return arg;
    }

    public boolean isEnabled(int logLevel) {
        return logLevel <= verbosity;
    }

    public void log(int logLevel, String format, Object... args) {
        if (!isEnabled(logLevel))
            return;
        Object[] things = Stream.of(args).map(Loggers::deepToThing).toArray();
        synchronized (err) {
            err.println(String.format(format, things));
            err.flush();
        }
    }
}
