package com.gnovoa.swiss.schedule;

import com.gnovoa.swiss.exception.UnsatisfiablePairingException;
import com.gnovoa.swiss.matching.MatchingComputer;
import com.gnovoa.swiss.model.ByeType;
import com.gnovoa.swiss.model.Pairing;
import com.gnovoa.swiss.model.Player;
import com.gnovoa.swiss.model.Tournament;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Score-group pairing shared by the Dutch and Burstein systems.
 *
 * <p>Per round:
 * <ul>
 *   <li>Players with a requested bye for the round leave the pool and get a half-point bye</li>
 *   <li>The remaining pool is certified with the {@link MatchingComputer}: compatible players
 *       plus one bye vertex for an odd count must admit a perfect matching</li>
 *   <li>Groups of equal accelerated score are paired top half against bottom half, with a
 *       swap search inside the halves; an odd group floats its lowest player down and only
 *       the last group hands out the single bye</li>
 *   <li>If the group pass gets stuck, or its bye would go to a player who already had one
 *       while someone else in the pool never did, the certified matching is used instead</li>
 * </ul>
 *
 * <p>Subclasses decide the order of the pool, the order inside a group and may pick the
 * bye recipient before grouping.
 */
public abstract class ScoreGroupPairingSystem implements PairingSystem {

    private static final Logger log = LoggerFactory.getLogger(ScoreGroupPairingSystem.class);

    protected final ColorAllocator colors;

    protected ScoreGroupPairingSystem(ColorAllocator colors) {
        this.colors = colors;
    }

    /** Pool order, strongest claim to a high board first. */
    protected abstract List<Player> order(Tournament tournament, List<Player> pool);

    /** Order used to split a score group into halves. Defaults to the pool order. */
    protected List<Player> arrangeGroup(Tournament tournament, List<Player> group) {
        return group;
    }

    /** Bye recipient chosen before grouping, or null to pick it in the last odd group. */
    protected Player preselectBye(Tournament tournament, List<Player> ordered) {
        return null;
    }

    @Override
    public final List<Pairing> computeMatching(Tournament tournament) {
        int round = tournament.nextRound();

        List<Pairing> requestedByes = new ArrayList<>();
        List<Player> pool = new ArrayList<>();
        for (Player p : tournament.activePlayers()) {
            if (p.hasIntentionalByeIn(round)) requestedByes.add(Pairing.bye(p.id(), ByeType.HALF_POINT_BYE));
            else pool.add(p);
        }

        List<Pairing> pairings = new ArrayList<>();
        if (!pool.isEmpty()) {
            List<Player> ordered = order(tournament, pool);
            int[] certified = certify(tournament, ordered);

            List<Pairing> grouped = pairScoreGroups(tournament, ordered);
            if (grouped != null) {
                pairings.addAll(grouped);
            } else {
                log.info("Round {}: score-group pass got stuck, using the certified matching for {} players",
                        round, ordered.size());
                pairings.addAll(fromMatching(tournament, ordered, certified));
            }
        }
        pairings.addAll(requestedByes);

        log.info("Round {} paired with {}: {} boards, {} requested byes",
                round, type().code(), pairings.size() - requestedByes.size(), requestedByes.size());
        return pairings;
    }

    // ---- certification ----

    /**
     * Maximum-weight perfect matching over the pool (plus a bye vertex for an odd pool).
     * Weights prefer equal scores, then the top-half/bottom-half distance inside a group;
     * bye edges prefer low scores and low positions.
     *
     * @return partner index per pool position; index {@code ordered.size()} is the bye vertex
     */
    private int[] certify(Tournament tournament, List<Player> ordered) {
        int n = ordered.size();
        boolean odd = n % 2 == 1;
        MatchingComputer computer = new MatchingComputer(odd ? n + 1 : n);

        int[] scores = new int[n];
        Map<Integer, Integer> groupSizes = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            scores[i] = ordered.get(i).scoreWithAcceleration(tournament);
            groupSizes.merge(scores[i], 1, Integer::sum);
        }
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (int s : scores) {
            min = Math.min(min, s);
            max = Math.max(max, s);
        }

        long scale = n + 1L;
        long base = (max - min + 1L) * scale + n + 1L;

        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (!Compatibility.isCompatible(ordered.get(i), ordered.get(j), tournament)) continue;
                long ideal = groupSizes.get(scores[i]) / 2;
                long distancePenalty = Math.abs((j - i) - ideal);
                computer.setEdgeWeight(i, j, base - Math.abs(scores[i] - scores[j]) * scale - Math.min(distancePenalty, n));
            }
        }

        if (odd) {
            List<Integer> eligible = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                if (isByeEligible(ordered.get(i), tournament)) eligible.add(i);
            }
            if (eligible.isEmpty()) {
                for (int i = 0; i < n; i++) eligible.add(i);
            }
            for (int i : eligible) {
                computer.setEdgeWeight(i, n, base - (scores[i] - min) * scale - (n - 1L - i));
            }
        }

        computer.computeMatching();
        if (!computer.isComplete()) {
            throw new UnsatisfiablePairingException(tournament.nextRound(), n);
        }
        return computer.getMatching();
    }

    private List<Pairing> fromMatching(Tournament tournament, List<Player> ordered, int[] matching) {
        int n = ordered.size();
        List<Pairing> pairings = new ArrayList<>();
        Pairing bye = null;
        for (int i = 0; i < n; i++) {
            int partner = matching[i];
            if (partner == n) bye = byePairing(tournament, ordered.get(i));
            else if (partner > i) pairings.add(colors.allocate(ordered.get(i), ordered.get(partner), tournament));
        }
        if (bye != null) pairings.add(bye);
        return pairings;
    }

    // ---- score groups ----

    /** @return pairings, or null when some player found no compatible partner in its group. */
    private List<Pairing> pairScoreGroups(Tournament tournament, List<Player> ordered) {
        List<Player> remaining = new ArrayList<>(ordered);
        Player byeRecipient = null;
        if (remaining.size() % 2 == 1) {
            byeRecipient = preselectBye(tournament, remaining);
            if (byeRecipient != null) remaining.remove(byeRecipient);
        }

        List<List<Player>> groups = scoreGroups(tournament, remaining);
        List<Pairing> pairings = new ArrayList<>();
        Player floater = null;
        for (int g = 0; g < groups.size(); g++) {
            List<Player> group = new ArrayList<>();
            if (floater != null) group.add(floater);
            group.addAll(groups.get(g));
            floater = null;

            if (group.size() % 2 == 1) {
                if (g < groups.size() - 1) {
                    floater = group.remove(group.size() - 1);
                } else {
                    byeRecipient = selectGroupBye(tournament, group);
                    group.remove(byeRecipient);
                }
            }

            List<Pairing> groupPairings = pairGroup(tournament, arrangeGroup(tournament, group));
            if (groupPairings == null) {
                log.debug("Group {} of {} players could not be completed", g + 1, group.size());
                return null;
            }
            pairings.addAll(groupPairings);
        }

        if (byeRecipient != null) {
            if (!isByeEligible(byeRecipient, tournament) && ordered.stream().anyMatch(p -> isByeEligible(p, tournament))) {
                log.debug("Player {} cannot take another bye while others have had none", byeRecipient.id());
                return null;
            }
            pairings.add(byePairing(tournament, byeRecipient));
        }
        return pairings;
    }

    private List<List<Player>> scoreGroups(Tournament tournament, List<Player> players) {
        Map<Integer, List<Player>> byScore = new LinkedHashMap<>();
        for (Player p : players) {
            byScore.computeIfAbsent(p.scoreWithAcceleration(tournament), k -> new ArrayList<>()).add(p);
        }
        List<Integer> keys = new ArrayList<>(byScore.keySet());
        keys.sort(Comparator.reverseOrder());
        List<List<Player>> groups = new ArrayList<>();
        for (int key : keys) groups.add(byScore.get(key));
        return groups;
    }

    /**
     * Top half against bottom half. A top player whose natural opponent is taken or
     * incompatible tries the rest of the bottom half, then the rest of the top half; bottom
     * players left over are paired among themselves.
     */
    private List<Pairing> pairGroup(Tournament tournament, List<Player> group) {
        int size = group.size();
        int half = size / 2;
        BitSet used = new BitSet(size);
        List<Pairing> pairings = new ArrayList<>();

        for (int i = 0; i < half; i++) {
            if (used.get(i)) continue;
            int partner = -1;
            if (!used.get(half + i) && Compatibility.isCompatible(group.get(i), group.get(half + i), tournament)) {
                partner = half + i;
            }
            if (partner == -1) partner = firstCompatible(tournament, group, used, i, half, size);
            if (partner == -1) partner = firstCompatible(tournament, group, used, i, i + 1, half);
            if (partner == -1) return null;

            used.set(i);
            used.set(partner);
            pairings.add(colors.allocate(group.get(i), group.get(partner), tournament));
        }

        for (int j = half; j < size; j++) {
            if (used.get(j)) continue;
            int partner = firstCompatible(tournament, group, used, j, j + 1, size);
            if (partner == -1) return null;
            used.set(j);
            used.set(partner);
            pairings.add(colors.allocate(group.get(j), group.get(partner), tournament));
        }
        return pairings;
    }

    private int firstCompatible(Tournament tournament, List<Player> group, BitSet used, int self, int from, int to) {
        for (int k = from; k < to; k++) {
            if (k == self || used.get(k)) continue;
            if (Compatibility.isCompatible(group.get(self), group.get(k), tournament)) return k;
        }
        return -1;
    }

    // ---- byes ----

    /**
     * Half-point-bye candidates first, then full-bye candidates, then anyone; inside a tier
     * the lowest {@link Player#byePriority()} wins. A pick from the last tier only stands when
     * nobody in the pool may take a bye.
     */
    protected Player selectGroupBye(Tournament tournament, List<Player> group) {
        Comparator<Player> byPriority = Comparator.comparingInt(Player::byePriority);
        return group.stream()
                .filter(p -> p.isEligibleForHalfPointBye(tournament))
                .min(byPriority)
                .or(() -> group.stream().filter(p -> p.isEligibleForBye(tournament)).min(byPriority))
                .orElseGet(() -> group.stream().min(byPriority).orElseThrow());
    }

    protected Pairing byePairing(Tournament tournament, Player player) {
        ByeType type = player.isEligibleForHalfPointBye(tournament) ? ByeType.HALF_POINT_BYE : ByeType.BYE;
        return Pairing.bye(player.id(), type);
    }

    private static boolean isByeEligible(Player p, Tournament tournament) {
        return p.isEligibleForBye(tournament) || p.isEligibleForHalfPointBye(tournament);
    }
}
