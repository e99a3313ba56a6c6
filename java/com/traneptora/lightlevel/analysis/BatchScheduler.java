package com.traneptora.lightlevel.analysis;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.traneptora.lightlevel.InvalidParameterException;
import com.traneptora.lightlevel.color.ColorSpace;
import com.traneptora.lightlevel.color.LuminanceTable;
import com.traneptora.lightlevel.color.RangePolicy;
import com.traneptora.lightlevel.io.FrameDecoder;
import com.traneptora.lightlevel.io.Loggers;
import com.traneptora.lightlevel.util.Region;
import com.traneptora.lightlevel.util.TaskList;

/**
 * Runs {@link FrameAnalyzer} over an ordered list of files.
 * <p>
 * Files are dispatched in groups of exactly {@code workerCount}, one file
 * per worker. A group is fully joined and sorted by path before any of its
 * results are handed out, and the next group is not submitted until then, so
 * the output order does not depend on which worker finishes first. Any
 * leftover files that do not fill a group are analyzed on the calling thread.
 * With a worker count of one or less, or fewer files than workers, everything
 * runs on the calling thread in input order.
 */
public class BatchScheduler implements Closeable {

    private final FrameDecoder decoder;
    private final int workerCount;
    private final Region region;
    private final ColorSpace colorSpace;
    private final LuminanceTable table;
    private final Loggers loggers;

    private volatile boolean cancelled = false;
    private ExecutorService threadPool = null;

    public BatchScheduler(FrameDecoder decoder, int workerCount, Region region, ColorSpace colorSpace,
            RangePolicy range, Loggers loggers) {
        this(decoder, workerCount, region, colorSpace, LuminanceTable.forRange(range), loggers);
    }

    public BatchScheduler(FrameDecoder decoder, int workerCount, Region region, ColorSpace colorSpace,
            LuminanceTable table, Loggers loggers) {
        if (workerCount < 0)
            throw new InvalidParameterException("Worker count must be nonnegative: " + workerCount);
        if (region == null)
            throw new InvalidParameterException("Missing active area");
        if (region.rowCount == 0)
            throw new InvalidParameterException("Active area must be at least one row tall: " + region);
        this.decoder = decoder;
        this.workerCount = workerCount;
        this.region = region;
        this.colorSpace = colorSpace;
        this.table = table;
        this.loggers = loggers;
    }

    public boolean isParallel(int fileCount) {
        return workerCount > 1 && fileCount >= workerCount;
    }

    /**
     * @return a lazy iterator over one result per path. Work for a group
     *         starts when the previous group's results have all been taken.
     */
    public Iterator<FileResult> run(List<Path> paths) {
        return new BatchIterator(new ArrayList<>(paths));
    }

    public Stream<FileResult> stream(List<Path> paths) {
        Spliterator<FileResult> spliterator = Spliterators.spliteratorUnknownSize(run(paths),
            Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false);
    }

    /**
     * Stops the batch at the next group boundary. The group in flight
     * finishes and its results are still delivered.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public synchronized void close() {
        if (threadPool != null) {
            threadPool.shutdownNow();
            threadPool = null;
        }
    }

    private synchronized ExecutorService getThreadPool() {
        if (threadPool == null)
            threadPool = Executors.newFixedThreadPool(workerCount);
        return threadPool;
    }

    private FileResult analyzeFile(Path path) {
        return new FileResult(path, FrameAnalyzer.analyze(decoder, path, region, colorSpace, table, loggers));
    }

    private List<FileResult> analyzeGroup(List<Path> group) {
        TaskList<FileResult> tasks = new TaskList<>(getThreadPool());
        for (Path path : group)
            tasks.submit(() -> analyzeFile(path));
        List<FileResult> results = tasks.collect();
        results.sort(FileResult.BY_PATH);
        return results;
    }

    private class BatchIterator implements Iterator<FileResult> {
        private final List<Path> paths;
        private final int parallelEnd;
        private final Deque<FileResult> pending = new ArrayDeque<>();
        private int next = 0;
        private boolean done = false;

        private BatchIterator(List<Path> paths) {
            this.paths = paths;
            this.parallelEnd = isParallel(paths.size()) ? paths.size() - paths.size() % workerCount : 0;
            loggers.log(Loggers.LOG_INFO, "Analyzing %d files with %d workers, %s", paths.size(),
                workerCount, isParallel(paths.size()) ? "in parallel" : "sequentially");
        }

        private void fill() {
            while (pending.isEmpty() && !done) {
                if (next >= paths.size() || cancelled) {
                    if (cancelled && next < paths.size())
                        loggers.log(Loggers.LOG_BASE, "Batch cancelled with %d files left", paths.size() - next);
                    finish();
                    return;
                }
                try {
                    if (next < parallelEnd) {
                        List<Path> group = paths.subList(next, next + workerCount);
                        loggers.log(Loggers.LOG_TRACE, "Dispatching group of %d at %d", group.size(), next);
                        pending.addAll(analyzeGroup(group));
                        next += workerCount;
                    } else {
                        pending.add(analyzeFile(paths.get(next)));
                        next++;
                    }
                } catch (RuntimeException | Error ex) {
                    finish();
                    throw ex;
                }
            }
        }

        private void finish() {
            done = true;
            close();
        }

        @Override
        public boolean hasNext() {
            fill();
            return !pending.isEmpty();
        }

        @Override
        public FileResult next() {
            fill();
            if (pending.isEmpty())
                throw new NoSuchElementException();
            return pending.poll();
        }
    }
}
