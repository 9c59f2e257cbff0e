package com.gnovoa.swiss.trf;

import com.gnovoa.swiss.model.Pairing;
import com.gnovoa.swiss.model.Player;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a round the way JaVaFo prints it.
 */
public final class PairingOutputFormatter {

    /** Number of boards, then {@code white black} per board; a bye is {@code id 0}. */
    public String format(List<Pairing> pairings) {
        List<String> lines = new ArrayList<>();
        lines.add(Integer.toString(pairings.size()));
        for (Pairing p : pairings) {
            lines.add(p.whiteId() + " " + (p.isBye() ? 0 : p.blackId()));
        }
        return String.join("\n", lines);
    }

    /** Check-list: one line per player with the opponent and colour of the new round. */
    public String formatChecklist(List<Player> players, List<Pairing> pairings) {
        List<String> lines = new ArrayList<>();
        lines.add("CHECK-LIST");
        lines.add("==========");
        lines.add("");
        for (int i = 0; i < players.size(); i++) {
            Player player = players.get(i);
            lines.add((i + 1) + ". " + player.name() + " (" + player.rating() + ") - " + describe(player.id(), pairings));
        }
        return String.join("\n", lines);
    }

    private static String describe(int playerId, List<Pairing> pairings) {
        for (Pairing p : pairings) {
            if (!p.involves(playerId)) continue;
            if (p.isBye()) return "BYE";
            return p.whiteId() == playerId ? p.blackId() + "W" : p.whiteId() + "B";
        }
        return "";
    }
}
