package com.traneptora.lightlevel.color;

/**
 * Signal range of the 16-bit code values.
 */
public enum RangePolicy {
    FULL("FULL", 0, 65535),
    /* 64 << 6 to 940 << 6 */
    LEGAL("LEGAL", 4096, 60160 - 4096);

    public final String flagName;
    public final int black;
    public final int range;

    private RangePolicy(String flagName, int black, int range) {
        this.flagName = flagName;
        this.black = black;
        this.range = range;
    }

    /**
     * @return the matching range, or null if the name is not recognized
     */
    public static RangePolicy fromFlagName(String name) {
        for (RangePolicy policy : values()) {
            if (policy.flagName.equalsIgnoreCase(name))
                return policy;
        }
        return null;
    }
}
