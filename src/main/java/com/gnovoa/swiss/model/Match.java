package com.gnovoa.swiss.model;

/**
 * One round of a player's history.
 *
 * <p>For byes and sat-out rounds {@code opponent} is the owner's own id. {@code gameWasPlayed}
 * is false for every bye and forfeit; {@code participatedInPairing} is false only when the
 * player was not part of the round's pairing at all (absent, requested bye).
 */
public record Match(
        int opponent,
        Color color,
        MatchScore matchScore,
        boolean gameWasPlayed,
        boolean participatedInPairing
) {

    public Match {
        if (color == null) color = Color.NONE;
        if (matchScore == null) throw new IllegalArgumentException("matchScore is required");
    }

    public static Match played(int opponent, Color color, MatchScore score) {
        return new Match(opponent, color, score, true, true);
    }

    public static Match forfeit(int opponent, Color color, MatchScore score) {
        return new Match(opponent, color, score, false, true);
    }

    /** Bye handed out by the pairing program: WIN for a full bye, DRAW for a half-point bye. */
    public static Match pairingAllocatedBye(int self, MatchScore score) {
        return new Match(self, Color.NONE, score, false, true);
    }

    /** Round the player was not paired in (absence, requested bye). */
    public static Match unpaired(int self, MatchScore score) {
        return new Match(self, Color.NONE, score, false, false);
    }

    /** @return true when this round has no real opponent for {@code playerId}. */
    public boolean isByeFor(int playerId) {
        return opponent == playerId;
    }
}
