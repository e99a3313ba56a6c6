package com.traneptora.lightlevel.color;

import com.traneptora.lightlevel.InvalidParameterException;

/**
 * Normalized PQ luminance for every 16-bit code value, for one black level and range.
 * Instances are immutable and safe to share between threads.
 */
public final class LuminanceTable {

    public static final int SIZE = 1 << 16;

    private final float[] table;
    public final double black;
    public final double range;

    private LuminanceTable(float[] table, double black, double range) {
        this.table = table;
        this.black = black;
        this.range = range;
    }

    public static LuminanceTable forRange(RangePolicy policy) {
        return build(policy.black, policy.range);
    }

    public static LuminanceTable build(double black, double range) {
        return build(TransferFunction.TF_PQ, black, range);
    }

    /**
     * @throws InvalidParameterException if the range is not positive, or if
     *         any code value maps to a NaN or infinite luminance
     */
    public static LuminanceTable build(TransferFunction tf, double black, double range) {
        if (!(range > 0D) || Double.isInfinite(range) || Double.isNaN(black) || Double.isInfinite(black))
            throw new InvalidParameterException(String.format("Invalid black level and range: %s, %s", black, range));
        float[] table = new float[SIZE];
        for (int i = 0; i < SIZE; i++) {
            float value = (float)tf.toLinear((i - black) / range);
            if (Float.isNaN(value) || Float.isInfinite(value))
                throw new InvalidParameterException(String.format(
                    "Code value %d has no luminance with black level %s and range %s", i, black, range));
            table[i] = value;
        }
        return new LuminanceTable(table, black, range);
    }

    public float get(int sample) {
        return table[sample];
    }

    @Override
    public String toString() {
        return String.format("LuminanceTable(black=%s, range=%s)", black, range);
    }
}
