package com.traneptora.lightlevel.analysis;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.Objects;

public final class FileResult {

    public static final Comparator<FileResult> BY_PATH = Comparator.comparing((FileResult r) -> r.path.toString());

    public final Path path;
    public final FrameMetrics metrics;

    public FileResult(Path path, FrameMetrics metrics) {
        this.path = Objects.requireNonNull(path);
        this.metrics = Objects.requireNonNull(metrics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, metrics);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        FileResult other = (FileResult) obj;
        return path.equals(other.path) && metrics.equals(other.metrics);
    }

    @Override
    public String toString() {
        return String.format("%s: %s", path, metrics);
    }
}
