package com.gnovoa.swiss.schedule;

import com.gnovoa.swiss.model.Player;
import com.gnovoa.swiss.model.Tournament;

import java.util.Comparator;
import java.util.List;

/**
 * FIDE Dutch system: players sorted by accelerated score and rank, score groups split by
 * rating into a top and a bottom half.
 */
public final class DutchSystem extends ScoreGroupPairingSystem {

    public DutchSystem(ColorAllocator colors) {
        super(colors);
    }

    @Override
    public PairingSystemType type() {
        return PairingSystemType.DUTCH;
    }

    @Override
    protected List<Player> order(Tournament tournament, List<Player> pool) {
        return pool.stream()
                .sorted(Comparator.comparingInt((Player p) -> p.scoreWithAcceleration(tournament)).reversed()
                        .thenComparingInt(Player::rankIndex))
                .toList();
    }

    @Override
    protected List<Player> arrangeGroup(Tournament tournament, List<Player> group) {
        return group.stream()
                .sorted(Comparator.comparingInt(Player::rating).reversed()
                        .thenComparingInt(Player::rankIndex))
                .toList();
    }
}
