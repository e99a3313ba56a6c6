package com.traneptora.lightlevel.analysis;

import java.util.Objects;

/**
 * Light levels of one frame in nits, or the reason there are none.
 */
public final class FrameMetrics {

    public static enum Status {
        OK,
        CANNOT_OPEN,
        INVALID_REGION,
    }

    public static final FrameMetrics CANNOT_OPEN = new FrameMetrics(Status.CANNOT_OPEN, -1D, -1D, Double.NaN);
    public static final FrameMetrics INVALID_REGION = new FrameMetrics(Status.INVALID_REGION, -2D, -2D, Double.NaN);

    public final Status status;
    public final double maxFALL;
    public final double maxCLL;
    /* weighted luma average in nits, diagnostic only */
    public final double meanLuma;

    private FrameMetrics(Status status, double maxFALL, double maxCLL, double meanLuma) {
        this.status = status;
        this.maxFALL = maxFALL;
        this.maxCLL = maxCLL;
        this.meanLuma = meanLuma;
    }

    public static FrameMetrics of(double maxFALL, double maxCLL, double meanLuma) {
        return new FrameMetrics(Status.OK, maxFALL, maxCLL, meanLuma);
    }

    public boolean isValid() {
        return status == Status.OK;
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, maxFALL, maxCLL);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        FrameMetrics other = (FrameMetrics) obj;
        return status == other.status
            && Double.compare(maxFALL, other.maxFALL) == 0
            && Double.compare(maxCLL, other.maxCLL) == 0;
    }

    @Override
    public String toString() {
        if (status != Status.OK)
            return String.format("FrameMetrics(%s)", status);
        return String.format("FrameMetrics(maxFALL=%f, maxCLL=%f)", maxFALL, maxCLL);
    }
}
