package com.traneptora.lightlevel.color;

/**
 * Maps a normalized code value to normalized linear light.
 */
@FunctionalInterface
public interface TransferFunction {

    /**
     * SMPTE ST 2084 with a 10000 nit reference. Output 1.0 is 10000 nits.
     * Non-positive input is black. Input high enough to make the denominator
     * non-positive yields NaN.
     */
    public static TransferFunction TF_PQ = new TransferFunction() {
        @Override
        public double toLinear(double f) {
            if (!(f > 0D))
                return 0D;
            double d = Math.pow(f, 0.012683313515655965121D);
            double numerator = Math.max(d - 0.8359375D, 0D);
            double denominator = 18.8515625D - 18.6875D * d;
            if (denominator <= 0D)
                return Double.NaN;
            return Math.pow(numerator / denominator, 1D / 0.1593017578D);
        }

        @Override
        public String toString() {
            return "PQ";
        }
    };

    public double toLinear(double input);
}
