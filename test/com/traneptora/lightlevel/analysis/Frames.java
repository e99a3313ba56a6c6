package com.traneptora.lightlevel.analysis;

import com.traneptora.lightlevel.util.PixelBuffer;

/**
 * Synthetic frames for analysis tests.
 */
final class Frames {

    private Frames() {

    }

    /**
     * Each row is either flat at {@code base} or a ramp starting at {@code base}.
     */
    static PixelBuffer rows(int width, int base, boolean... varied) {
        int height = varied.length;
        short[] samples = new short[width * height * PixelBuffer.CHANNELS];
        int i = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                for (int c = 0; c < PixelBuffer.CHANNELS; c++)
                    samples[i++] = (short)(varied[y] ? base + x * 3 + c : base);
            }
        }
        return new PixelBuffer(width, height, samples);
    }

    /**
     * A frame with flat bars of {@code bar} rows above and below a varied band.
     */
    static PixelBuffer letterboxed(int width, int bar, int active) {
        boolean[] varied = new boolean[bar * 2 + active];
        for (int y = bar; y < bar + active; y++)
            varied[y] = true;
        return rows(width, 1000, varied);
    }

    static PixelBuffer pixels(int width, int height, int[][] rgb) {
        short[] samples = new short[width * height * PixelBuffer.CHANNELS];
        for (int p = 0; p < rgb.length; p++) {
            for (int c = 0; c < PixelBuffer.CHANNELS; c++)
                samples[p * PixelBuffer.CHANNELS + c] = (short)rgb[p][c];
        }
        return new PixelBuffer(width, height, samples);
    }
}
