package com.traneptora.lightlevel.util;

import java.util.Objects;

/**
 * A full-width horizontal band of a frame.
 */
public class Region {
    public final int rowOffset;
    public final int rowCount;

    public Region(int rowOffset, int rowCount) {
        if (rowOffset < 0 || rowCount < 0)
            throw new IllegalArgumentException(String.format("Negative region: %d+%d", rowOffset, rowCount));
        this.rowOffset = rowOffset;
        this.rowCount = rowCount;
    }

    public Region(Region r) {
        this(r.rowOffset, r.rowCount);
    }

    public int computeEndRow() {
        return rowOffset + rowCount;
    }

    public boolean fitsWithin(int height) {
        return (long)rowOffset + rowCount <= height;
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
        Region other = (Region) obj;
        return rowOffset == other.rowOffset && rowCount == other.rowCount;
    }

    @Override
    public String toString() {
        return String.format("Region(y=%d, h=%d)", rowOffset, rowCount);
    }
}
