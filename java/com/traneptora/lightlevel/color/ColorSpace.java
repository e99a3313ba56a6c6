package com.traneptora.lightlevel.color;

/**
 * Color primaries of the mastered frames, and their luma coefficients.
 */
public enum ColorSpace {
    BT2020("2020", 0.2627D, 0.6780D, 0.0593D),
    P3D65("P3", 0.228975D, 0.691739D, 0.0792869D);

    public final String flagName;
    public final double kr;
    public final double kg;
    public final double kb;

    private ColorSpace(String flagName, double kr, double kg, double kb) {
        this.flagName = flagName;
        this.kr = kr;
        this.kg = kg;
        this.kb = kb;
    }

    public double luma(double r, double g, double b) {
        return kr * r + kg * g + kb * b;
    }

    /**
     * @return the matching color space, or null if the name is not recognized
     */
    public static ColorSpace fromFlagName(String name) {
        for (ColorSpace cs : values()) {
            if (cs.flagName.equalsIgnoreCase(name))
                return cs;
        }
        return null;
    }
}
