package com.traneptora.lightlevel.analysis;

import java.util.Objects;

import com.traneptora.lightlevel.util.Region;

/**
 * One frame's guess at the picture band between letterbox bars.
 */
public final class ActiveArea {

    public static final ActiveArea INVALID = new ActiveArea(-1, -1);
    /* recorded for a sampled file that could not be opened */
    public static final ActiveArea UNREADABLE = new ActiveArea(0, 0);

    public final int rowOffset;
    public final int rowCount;

    public ActiveArea(int rowOffset, int rowCount) {
        this.rowOffset = rowOffset;
        this.rowCount = rowCount;
    }

    public boolean isValid() {
        return rowOffset >= 0 && rowCount > 0;
    }

    /**
     * @return the tally key, {@code "rowOffset,rowCount"}
     */
    public String toKey() {
        return rowOffset + "," + rowCount;
    }

    public Region toRegion() {
        if (!isValid())
            throw new IllegalStateException("Not a usable region: " + toKey());
        return new Region(rowOffset, rowCount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowOffset, rowCount);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        ActiveArea other = (ActiveArea) obj;
        return rowOffset == other.rowOffset && rowCount == other.rowCount;
    }

    @Override
    public String toString() {
        return String.format("ActiveArea(%s)", toKey());
    }
}
