package com.traneptora.lightlevel.analysis;

public final class ActiveAreaVote {
    public final ActiveArea area;
    private int count;

    public ActiveAreaVote(ActiveArea area) {
        this.area = area;
        this.count = 1;
    }

    void increment() {
        count++;
    }

    public int getCount() {
        return count;
    }

    @Override
    public String toString() {
        return String.format("%s: %d", area.toKey(), count);
    }
}
