package com.gnovoa.swiss.trf;

import com.gnovoa.swiss.model.Color;
import com.gnovoa.swiss.model.Match;
import com.gnovoa.swiss.model.MatchScore;

import java.util.Optional;

/**
 * Result symbol of one round block.
 *
 * <p>Games against a real opponent use {@code 1 = 0} when played and {@code + - D} when not.
 * Rounds without an opponent are written against {@code 0000}: {@code U} for a
 * pairing-allocated full bye, {@code H} for a half-point bye, {@code F Z} for full and zero
 * point rounds outside the pairing. {@code H} reads back as a half-point bye that took part
 * in the pairing, the way stored half-point byes are rebuilt.
 */
public enum GameCode {
    WIN('1', true),
    DRAW('=', true),
    LOSS('0', true),
    FORFEIT_WIN('+', true),
    FORFEIT_LOSS('-', true),
    UNPLAYED_DRAW('D', true),
    PAIRING_ALLOCATED_BYE('U', false),
    FULL_POINT_BYE('F', false),
    HALF_POINT_BYE('H', false),
    ZERO_POINT_BYE('Z', false);

    private final char symbol;
    private final boolean againstOpponent;

    GameCode(char symbol, boolean againstOpponent) {
        this.symbol = symbol;
        this.againstOpponent = againstOpponent;
    }

    public char symbol() {
        return symbol;
    }

    public boolean againstOpponent() {
        return againstOpponent;
    }

    public static Optional<GameCode> fromSymbol(char symbol) {
        for (GameCode code : values()) {
            if (code.symbol == symbol) return Optional.of(code);
        }
        return Optional.empty();
    }

    /** Code for round {@code match} of player {@code ownerId}. */
    public static GameCode of(Match match, int ownerId) {
        if (match.isByeFor(ownerId)) {
            if (match.participatedInPairing() && match.matchScore() == MatchScore.WIN) return PAIRING_ALLOCATED_BYE;
            return switch (match.matchScore()) {
                case WIN -> FULL_POINT_BYE;
                case DRAW -> HALF_POINT_BYE;
                case LOSS -> ZERO_POINT_BYE;
            };
        }
        if (match.gameWasPlayed()) {
            return switch (match.matchScore()) {
                case WIN -> WIN;
                case DRAW -> DRAW;
                case LOSS -> LOSS;
            };
        }
        return switch (match.matchScore()) {
            case WIN -> FORFEIT_WIN;
            case DRAW -> UNPLAYED_DRAW;
            case LOSS -> FORFEIT_LOSS;
        };
    }

    /**
     * Rebuilds the round. {@code opponent} and {@code color} are ignored for bye codes.
     */
    public Match toMatch(int ownerId, int opponent, Color color) {
        return switch (this) {
            case WIN -> Match.played(opponent, color, MatchScore.WIN);
            case DRAW -> Match.played(opponent, color, MatchScore.DRAW);
            case LOSS -> Match.played(opponent, color, MatchScore.LOSS);
            case FORFEIT_WIN -> Match.forfeit(opponent, color, MatchScore.WIN);
            case FORFEIT_LOSS -> Match.forfeit(opponent, color, MatchScore.LOSS);
            case UNPLAYED_DRAW -> Match.forfeit(opponent, color, MatchScore.DRAW);
            case PAIRING_ALLOCATED_BYE -> Match.pairingAllocatedBye(ownerId, MatchScore.WIN);
            case FULL_POINT_BYE -> Match.unpaired(ownerId, MatchScore.WIN);
            case HALF_POINT_BYE -> Match.pairingAllocatedBye(ownerId, MatchScore.DRAW);
            case ZERO_POINT_BYE -> Match.unpaired(ownerId, MatchScore.LOSS);
        };
    }
}
