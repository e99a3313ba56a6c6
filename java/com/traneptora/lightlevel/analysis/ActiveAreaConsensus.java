package com.traneptora.lightlevel.analysis;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import java.util.SortedMap;
import java.util.TreeMap;

import com.traneptora.lightlevel.InvalidParameterException;
import com.traneptora.lightlevel.io.FrameDecoder;
import com.traneptora.lightlevel.io.Loggers;

/**
 * Picks the active area of a batch by majority vote over a random sample of
 * its files. Files are drawn independently, so one file may vote twice.
 * Ties go to the lexicographically smallest {@code "rowOffset,rowCount"} key.
 */
public class ActiveAreaConsensus {

    private final FrameDecoder decoder;
    private final Loggers loggers;

    public ActiveAreaConsensus(FrameDecoder decoder, Loggers loggers) {
        this.decoder = decoder;
        this.loggers = loggers;
    }

    public ActiveArea observe(Path path) {
        try {
            ActiveArea area = ActiveAreaDetector.detect(decoder.decode(path));
            loggers.log(Loggers.LOG_VERBOSE, "Active area of %s: %s", path, area.toKey());
            return area;
        } catch (IOException ex) {
            loggers.log(Loggers.LOG_INFO, "Unable to open %s: %s", path, ex.getMessage());
            return ActiveArea.UNREADABLE;
        }
    }

    public ConsensusResult vote(List<Path> paths, int sampleSize, Random random) {
        if (sampleSize < 0)
            throw new InvalidParameterException("Sample size must be nonnegative: " + sampleSize);
        int count = Math.min(sampleSize, paths.size());
        SortedMap<String, ActiveAreaVote> tally = new TreeMap<>();
        for (int i = 0; i < count; i++) {
            Path path = paths.get(random.nextInt(paths.size()));
            ActiveArea area = observe(path);
            ActiveAreaVote vote = tally.get(area.toKey());
            if (vote == null)
                tally.put(area.toKey(), new ActiveAreaVote(area));
            else
                vote.increment();
        }

        ActiveAreaVote winner = null;
        for (ActiveAreaVote vote : tally.values()) {
            if (winner == null || vote.getCount() > winner.getCount())
                winner = vote;
        }

        ConsensusResult result = new ConsensusResult(winner, tally, count);
        loggers.log(Loggers.LOG_INFO, "Dimensions with the highest count %s: %d of %d checked",
            winner != null ? winner.area.toKey() : "none", winner != null ? winner.getCount() : 0, count);
        return result;
    }
}
