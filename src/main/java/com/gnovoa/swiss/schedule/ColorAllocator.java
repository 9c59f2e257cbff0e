package com.gnovoa.swiss.schedule;

import com.gnovoa.swiss.model.Color;
import com.gnovoa.swiss.model.Pairing;
import com.gnovoa.swiss.model.Player;
import com.gnovoa.swiss.model.Tournament;

import java.util.List;

/**
 * Decides who plays white on a board.
 *
 * <p>Rules, first decisive one wins:
 * <ol>
 *   <li>the player with fewer whites than blacks (lower balance) gets white</li>
 *   <li>nobody gets the same colour a third time in a row</li>
 *   <li>the higher ranked player gets the colour due to that player (preference, else the
 *       tournament's initial colour)</li>
 *   <li>the lower id gets white</li>
 * </ol>
 */
public final class ColorAllocator {

    public Pairing allocate(Player a, Player b, Tournament tournament) {
        Player white = white(a, b, tournament);
        Player black = white == a ? b : a;
        return Pairing.game(white.id(), black.id());
    }

    public Player white(Player a, Player b, Tournament tournament) {
        int balanceA = a.colorBalance();
        int balanceB = b.colorBalance();
        if (balanceA != balanceB) return balanceA < balanceB ? a : b;

        Color streakA = streakCorrection(a);
        Color streakB = streakCorrection(b);
        if (streakA != Color.NONE && streakA != streakB) return streakA == Color.WHITE ? a : b;
        if (streakB != Color.NONE && streakB != streakA) return streakB == Color.WHITE ? b : a;

        if (a.rankIndex() != b.rankIndex()) {
            Player higher = a.rankIndex() < b.rankIndex() ? a : b;
            Player lower = higher == a ? b : a;
            Color due = higher.colorPreference() != Color.NONE ? higher.colorPreference() : tournament.initialColor();
            return due == Color.WHITE ? higher : lower;
        }

        return a.id() < b.id() ? a : b;
    }

    /** Colour forced by two equal colours in the last two played games, NONE otherwise. */
    static Color streakCorrection(Player p) {
        List<Color> lastTwo = p.lastPlayedColors(2);
        if (lastTwo.size() < 2 || lastTwo.get(0) != lastTwo.get(1)) return Color.NONE;
        return lastTwo.get(0).invert();
    }
}
