package com.traneptora.lightlevel.analysis;

import java.io.IOException;
import java.nio.file.Path;

import com.traneptora.lightlevel.color.ColorSpace;
import com.traneptora.lightlevel.color.LuminanceTable;
import com.traneptora.lightlevel.io.FrameDecoder;
import com.traneptora.lightlevel.io.Loggers;
import com.traneptora.lightlevel.util.PixelBuffer;
import com.traneptora.lightlevel.util.Region;

/**
 * Computes maxFALL and maxCLL of a single frame.
 * <p>
 * Each pixel contributes the brightest of its three channels, after the PQ
 * lookup. maxFALL is the mean of that value over the region, and maxCLL is
 * its peak, both scaled to nits.
 */
public final class FrameAnalyzer {

    public static final double PEAK_NITS = 10000D;

    private FrameAnalyzer() {

    }

    /**
     * @param buffer the decoded frame, or null if decoding failed
     * @param region rows to measure; an empty band is an invalid region
     */
    public static FrameMetrics analyze(PixelBuffer buffer, Region region, ColorSpace colorSpace,
            LuminanceTable table) {
        if (buffer == null)
            return FrameMetrics.CANNOT_OPEN;
        if (region.rowCount == 0 || !region.fitsWithin(buffer.height))
            return FrameMetrics.INVALID_REGION;

        int rowOffset = region.rowOffset;
        int rowCount = region.rowCount;
        long pixelCount = (long)buffer.width * rowCount;
        if (pixelCount == 0)
            return FrameMetrics.INVALID_REGION;

        double sumMax = 0D;
        double sumLuma = 0D;
        float peak = 0f;
        for (int y = rowOffset; y < rowOffset + rowCount; y++) {
            int start = buffer.rowStart(y);
            int end = start + buffer.getRowStride();
            for (int i = start; i < end; i += PixelBuffer.CHANNELS) {
                float red = table.get(buffer.getSample(i));
                float green = table.get(buffer.getSample(i + 1));
                float blue = table.get(buffer.getSample(i + 2));
                float max = Math.max(Math.max(red, green), blue);
                sumMax += max;
                sumLuma += colorSpace.luma(red, green, blue);
                if (max > peak)
                    peak = max;
            }
        }

        return FrameMetrics.of(PEAK_NITS * (sumMax / pixelCount), PEAK_NITS * peak,
            PEAK_NITS * (sumLuma / pixelCount));
    }

    /**
     * Decodes and analyzes one file. Decoding failures become
     * {@link FrameMetrics#CANNOT_OPEN} rather than exceptions.
     */
    public static FrameMetrics analyze(FrameDecoder decoder, Path path, Region region,
            ColorSpace colorSpace, LuminanceTable table, Loggers loggers) {
        PixelBuffer buffer;
        try {
            buffer = decoder.decode(path);
        } catch (IOException ex) {
            loggers.log(Loggers.LOG_BASE, "Unable to open %s: %s", path, ex.getMessage());
            return FrameMetrics.CANNOT_OPEN;
        }
        FrameMetrics metrics = analyze(buffer, region, colorSpace, table);
        if (metrics.status == FrameMetrics.Status.INVALID_REGION) {
            loggers.log(Loggers.LOG_BASE, "Invalid active area for %s: %s does not fit in height %d",
                path, region, buffer.height);
        } else {
            loggers.log(Loggers.LOG_VERBOSE, "%s: %s", path, metrics);
        }
        return metrics;
    }
}
