package com.traneptora.lightlevel.util;

import java.util.Arrays;

/**
 * Interleaved RGB samples, unsigned 16-bit, stored row-major.
 * Sample {@code c} of pixel {@code (x, y)} lives at {@code (y * width + x) * 3 + c}.
 */
public class PixelBuffer {

    public static final int CHANNELS = 3;
    public static final int MAX_VALUE = 0xFFFF;

    public final int width;
    public final int height;

    private final short[] samples;

    /**
     * Copies {@code samples}, so later writes to the array do not show through.
     */
    public PixelBuffer(int width, int height, short[] samples) {
        this(width, height, samples, true);
    }

    /**
     * @param copyData if false the buffer takes ownership of {@code samples},
     *        and the caller must not write to the array afterwards
     */
    public PixelBuffer(int width, int height, short[] samples, boolean copyData) {
        if (height < 0 || height > (1 << 30) || width < 0 || width > (1 << 30))
            throw new IllegalArgumentException(String.format("Invalid size: %dx%d", width, height));
        if (samples == null || (long)samples.length != (long)width * height * CHANNELS)
            throw new IllegalArgumentException(String.format("Expected %d samples for %dx%d, found %s",
                (long)width * height * CHANNELS, width, height, samples == null ? "null" : samples.length));
        this.width = width;
        this.height = height;
        this.samples = copyData ? samples.clone() : samples;
    }

    public static PixelBuffer filled(int width, int height, int value) {
        short[] samples = new short[width * height * CHANNELS];
        Arrays.fill(samples, (short)value);
        return new PixelBuffer(width, height, samples, false);
    }

    public int getSample(int x, int y, int c) {
        return samples[(y * width + x) * CHANNELS + c] & 0xFFFF;
    }

    /**
     * @return the sample at a raw interleaved index
     */
    public int getSample(int index) {
        return samples[index] & 0xFFFF;
    }

    /**
     * @return the raw interleaved index of the first sample in row {@code y}
     */
    public int rowStart(int y) {
        return y * width * CHANNELS;
    }

    public int getRowStride() {
        return width * CHANNELS;
    }

    public int getSampleCount() {
        return samples.length;
    }

    @Override
    public String toString() {
        return String.format("PixelBuffer(w=%d, h=%d)", width, height);
    }
}
