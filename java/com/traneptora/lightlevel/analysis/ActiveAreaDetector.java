package com.traneptora.lightlevel.analysis;

import com.traneptora.lightlevel.util.PixelBuffer;

/**
 * Guesses the letterbox bars of a frame from rows with no variation.
 * <p>
 * A row is flat when every sample in it, across all channels, has the same
 * value. The active band starts at the first row that is not flat and ends
 * at the first flat row after that. A single flat row inside the picture cuts
 * the band short, so one frame's answer is only a vote.
 */
public final class ActiveAreaDetector {

    private ActiveAreaDetector() {

    }

    public static boolean isFlatRow(PixelBuffer buffer, int y) {
        int start = buffer.rowStart(y);
        int end = start + buffer.getRowStride();
        if (start == end)
            return true;
        int first = buffer.getSample(start);
        for (int i = start + 1; i < end; i++) {
            if (buffer.getSample(i) != first)
                return false;
        }
        return true;
    }

    /**
     * @return the active band, or {@link ActiveArea#INVALID} if no band is
     *         closed off by a flat row below it
     */
    public static ActiveArea detect(PixelBuffer buffer) {
        int rowStart = -1;
        int rowEnd = -1;
        for (int y = 0; y < buffer.height; y++) {
            boolean flat = isFlatRow(buffer, y);
            if (rowStart == -1) {
                if (!flat)
                    rowStart = y;
            } else if (flat) {
                rowEnd = y;
                break;
            }
        }
        if (rowEnd <= rowStart)
            return ActiveArea.INVALID;
        return new ActiveArea(rowStart, rowEnd - rowStart);
    }
}
