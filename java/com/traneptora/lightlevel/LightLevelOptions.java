package com.traneptora.lightlevel;

import com.traneptora.lightlevel.color.ColorSpace;
import com.traneptora.lightlevel.color.RangePolicy;
import com.traneptora.lightlevel.io.Loggers;

public class LightLevelOptions {

    public static final int DEFAULT_THREADS = 4;
    public static final int DEFAULT_SAMPLE_SIZE = 10;

    public static final int UNSET = -1;

    public boolean debug = false;
    public int verbosity = Loggers.LOG_BASE;
    public boolean assumeYes = false;

    public RangePolicy range = RangePolicy.FULL;
    public ColorSpace colorSpace = ColorSpace.BT2020;

    public int yOffset = UNSET;
    public int yLength = UNSET;

    public int threads = DEFAULT_THREADS;
    public int sampleSize = DEFAULT_SAMPLE_SIZE;

    public String input = null;
    public String logList = null;
    public String fileList = null;
    public String processedFiles = null;
    public String resultFile = null;

    public LightLevelOptions() {

    }

    public LightLevelOptions(LightLevelOptions options) {
        this.debug = options.debug;
        this.verbosity = options.verbosity;
        this.assumeYes = options.assumeYes;
        this.range = options.range;
        this.colorSpace = options.colorSpace;
        this.yOffset = options.yOffset;
        this.yLength = options.yLength;
        this.threads = options.threads;
        this.sampleSize = options.sampleSize;

        this.input = options.input;
        this.logList = options.logList;
        this.fileList = options.fileList;
        this.processedFiles = options.processedFiles;
        this.resultFile = options.resultFile;
    }

    /**
     * @return true if the caller pinned the active area, so no consensus scan is needed
     */
    public boolean hasExplicitRegion() {
        return yOffset != UNSET || yLength != UNSET;
    }
}
