package com.gnovoa.swiss.trf;

import com.gnovoa.swiss.model.Player;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Standings order: unaccelerated score descending, then rating descending. */
public final class RankCalculator {

    public static final Comparator<Player> STANDINGS = Comparator
            .comparingInt(Player::scoreWithoutAcceleration).reversed()
            .thenComparing(Comparator.comparingInt(Player::rating).reversed());

    /** @return 0-based rank by player id; equal players keep their input order. */
    public Map<Integer, Integer> computeRanks(Collection<Player> players) {
        List<Player> sorted = new ArrayList<>(players);
        sorted.sort(STANDINGS);
        Map<Integer, Integer> ranks = new LinkedHashMap<>();
        for (int i = 0; i < sorted.size(); i++) ranks.put(sorted.get(i).id(), i);
        return ranks;
    }
}
