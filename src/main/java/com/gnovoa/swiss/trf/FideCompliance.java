package com.gnovoa.swiss.trf;

import com.gnovoa.swiss.model.Match;
import com.gnovoa.swiss.model.Pairing;
import com.gnovoa.swiss.model.Player;
import com.gnovoa.swiss.model.Tournament;
import com.gnovoa.swiss.schedule.ColorAllocator;
import com.gnovoa.swiss.schedule.Compatibility;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks generated boards against the FIDE rules the engine enforces.
 */
public final class FideCompliance {

    public enum ViolationType {
        /** The two players already met. */
        REPEAT_PAIRING,
        /** Both players must get the same colour. */
        COLOR_VIOLATION,
        /** A player appears on more than one board. */
        DUPLICATE_PLAYER
    }

    public record Violation(ViolationType type, int playerId, Integer opponentId) {}

    private final ColorAllocator colors;

    public FideCompliance(ColorAllocator colors) {
        this.colors = colors;
    }

    public List<ViolationType> checkPair(Player a, Player b, Tournament tournament) {
        List<ViolationType> violations = new ArrayList<>();
        if (havePlayedBefore(a, b)) violations.add(ViolationType.REPEAT_PAIRING);
        if (Compatibility.hasColorConflict(a, b, tournament)) violations.add(ViolationType.COLOR_VIOLATION);
        return violations;
    }

    /** Every violation of a whole round; empty when the round is clean. */
    public List<Violation> checkRound(Tournament tournament, List<Pairing> pairings) {
        List<Violation> violations = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (Pairing p : pairings) {
            if (!seen.add(p.whiteId())) violations.add(new Violation(ViolationType.DUPLICATE_PLAYER, p.whiteId(), null));
            if (p.isBye()) continue;
            if (!seen.add(p.blackId())) violations.add(new Violation(ViolationType.DUPLICATE_PLAYER, p.blackId(), null));

            Player white = tournament.player(p.whiteId());
            Player black = tournament.player(p.blackId());
            for (ViolationType type : checkPair(white, black, tournament)) {
                violations.add(new Violation(type, white.id(), black.id()));
            }
        }
        return violations;
    }

    /** Same colour rule as the pairing systems use. */
    public Player assignWhite(Player a, Player b, Tournament tournament) {
        return colors.white(a, b, tournament);
    }

    static boolean havePlayedBefore(Player a, Player b) {
        for (Match m : a.matches()) {
            if (m.opponent() == b.id() && !m.isByeFor(a.id())) return true;
        }
        return false;
    }
}
