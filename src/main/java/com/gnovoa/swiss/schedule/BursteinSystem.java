package com.gnovoa.swiss.schedule;

import com.gnovoa.swiss.model.Player;
import com.gnovoa.swiss.model.Tournament;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Burstein system: players ordered by accelerated score, then Sonneborn-Berger, Buchholz and
 * median, then rank. The bye goes to the lowest player who never got a full point without
 * playing, and is settled before the groups are paired.
 */
public final class BursteinSystem extends ScoreGroupPairingSystem {

    private static final Logger log = LoggerFactory.getLogger(BursteinSystem.class);

    private final TiebreakCalculator tiebreaks;

    public BursteinSystem(ColorAllocator colors, TiebreakCalculator tiebreaks) {
        super(colors);
        this.tiebreaks = tiebreaks;
    }

    @Override
    public PairingSystemType type() {
        return PairingSystemType.BURSTEIN;
    }

    @Override
    protected List<Player> order(Tournament tournament, List<Player> pool) {
        Map<Integer, TiebreakScores> scores = tiebreaks.compute(tournament, pool);
        if (log.isDebugEnabled()) {
            scores.forEach((id, tb) -> log.debug("Player {} tiebreaks {}", id, tb));
        }

        Comparator<Player> comparator = Comparator
                .comparingInt((Player p) -> p.scoreWithAcceleration(tournament)).reversed()
                .thenComparing(Comparator.comparingDouble((Player p) -> scores.get(p.id()).sonnebornBerger()).reversed())
                .thenComparing(Comparator.comparingInt((Player p) -> scores.get(p.id()).buchholz()).reversed())
                .thenComparing(Comparator.comparingInt((Player p) -> scores.get(p.id()).median()).reversed())
                .thenComparingInt(Player::rankIndex);
        return pool.stream().sorted(comparator).toList();
    }

    @Override
    protected Player preselectBye(Tournament tournament, List<Player> ordered) {
        for (int i = ordered.size() - 1; i >= 0; i--) {
            if (!ordered.get(i).hadUnplayedWin()) return ordered.get(i);
        }
        return ordered.get(ordered.size() - 1);
    }
}
