package com.traneptora.lightlevel.analysis;

import java.util.Collections;
import java.util.SortedMap;

import com.traneptora.lightlevel.util.Region;

/**
 * Outcome of an active area vote. The tally is keyed by {@link ActiveArea#toKey()}.
 */
public final class ConsensusResult {

    public final ActiveAreaVote winner;
    public final SortedMap<String, ActiveAreaVote> tally;
    public final int filesChecked;

    ConsensusResult(ActiveAreaVote winner, SortedMap<String, ActiveAreaVote> tally, int filesChecked) {
        this.winner = winner;
        this.tally = Collections.unmodifiableSortedMap(tally);
        this.filesChecked = filesChecked;
    }

    public boolean isDisagreement() {
        return tally.size() > 1;
    }

    /**
     * @return the winning band, or null if nothing was sampled or the winner
     *         is not a usable region
     */
    public Region getRegion() {
        if (winner == null || !winner.area.isValid())
            return null;
        return winner.area.toRegion();
    }

    @Override
    public String toString() {
        return String.format("ConsensusResult(winner=%s, tally=%s, checked=%d)", winner, tally.values(), filesChecked);
    }
}
