package com.gnovoa.swiss.schedule;

import com.gnovoa.swiss.model.Color;
import com.gnovoa.swiss.model.Player;
import com.gnovoa.swiss.model.Tournament;

/**
 * Hard constraints for putting two players on the same board.
 */
public final class Compatibility {

    private Compatibility() {}

    /**
     * Two players may meet unless either forbids the other (earlier game, {@code XXF}) or both
     * hold the same absolute colour preference outside the last round and below the
     * top-score threshold.
     */
    public static boolean isCompatible(Player a, Player b, Tournament tournament) {
        if (a.id() == b.id()) return false;
        if (a.isForbidden(b.id()) || b.isForbidden(a.id())) return false;
        return !hasColorConflict(a, b, tournament);
    }

    /** @return true when both players must have the same colour and no exemption applies. */
    public static boolean hasColorConflict(Player a, Player b, Tournament tournament) {
        if (!sameAbsolutePreference(a, b)) return false;
        if (tournament.isLastRound()) return false;
        int threshold = tournament.topScoreThreshold();
        return a.scoreWithoutAcceleration() <= threshold && b.scoreWithoutAcceleration() <= threshold;
    }

    public static boolean sameAbsolutePreference(Player a, Player b) {
        return a.absoluteColorPreference()
                && b.absoluteColorPreference()
                && a.colorPreference() != Color.NONE
                && a.colorPreference() == b.colorPreference();
    }
}
