package com.gnovoa.swiss.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of one section at pairing time: played rounds, scoring table and roster.
 *
 * <p>Built fresh from externally supplied history for each request, never persisted.
 */
public final class Tournament {

    private final int playedRounds;
    private final int expectedRounds;
    private final PointTable points;
    private final Color initialColor;

    private final Map<Integer, Player> players = new LinkedHashMap<>();

    public Tournament(int playedRounds, int expectedRounds, PointTable points, Color initialColor) {
        if (playedRounds < 0) throw new IllegalArgumentException("playedRounds must not be negative");
        this.playedRounds = playedRounds;
        this.expectedRounds = expectedRounds;
        this.points = points == null ? PointTable.DEFAULT : points;
        this.initialColor = initialColor == null || initialColor == Color.NONE ? Color.WHITE : initialColor;
    }

    public int playedRounds() { return playedRounds; }
    public int expectedRounds() { return expectedRounds; }
    public PointTable points() { return points; }
    public Color initialColor() { return initialColor; }

    /** @return round number that is about to be paired. */
    public int nextRound() {
        return playedRounds + 1;
    }

    public Player addPlayer(Player player) {
        if (players.putIfAbsent(player.id(), player) != null) {
            throw new IllegalArgumentException("Duplicate player id " + player.id());
        }
        return player;
    }

    public Collection<Player> players() {
        return Collections.unmodifiableCollection(players.values());
    }

    public boolean hasPlayer(int id) {
        return players.containsKey(id);
    }

    /**
     * @throws IllegalArgumentException if no player has this id
     */
    public Player player(int id) {
        Player p = players.get(id);
        if (p == null) throw new IllegalArgumentException("Unknown player " + id);
        return p;
    }

    /**
     * Players taking part in the next round: valid, and without a history entry for it yet
     * (absent players carry an extra unpaired round and drop out here).
     */
    public List<Player> activePlayers() {
        List<Player> active = new ArrayList<>();
        for (Player p : players.values()) {
            if (p.isValid() && p.matches().size() <= playedRounds) active.add(p);
        }
        return active;
    }

    /**
     * Points (tenths) that {@code match} is worth to {@code player}.
     *
     * <p>Losses split into played loss, forfeit loss and zero-point bye; a win against
     * oneself that was part of the pairing is a pairing-allocated bye.
     */
    public int getPoints(Player player, Match match) {
        return switch (match.matchScore()) {
            case LOSS -> match.participatedInPairing()
                    ? (match.gameWasPlayed() ? points.loss() : points.forfeitLoss())
                    : points.zeroPointBye();
            case WIN -> match.isByeFor(player.id()) && match.participatedInPairing()
                    ? points.pairingAllocatedBye()
                    : points.win();
            case DRAW -> points.draw();
        };
    }

    /** Sets each player's plain score to the sum of its history under this point table. */
    public void recomputeScores() {
        for (Player p : players.values()) {
            int total = 0;
            for (Match m : p.matches()) total += getPoints(p, m);
            p.setScoreWithoutAcceleration(total);
        }
    }

    /** Refreshes colour and bye bookkeeping of every player. */
    public void updatePlayerData() {
        for (Player p : players.values()) {
            p.updateColorPreferences();
            p.updateByeTracking();
        }
    }

    public boolean isLastRound() {
        return expectedRounds > 0 && playedRounds >= expectedRounds - 1;
    }

    /**
     * Score (tenths) above which a player counts as a top scorer for the absolute colour rule:
     * half of the maximum achievable so far.
     */
    public int topScoreThreshold() {
        return playedRounds * Math.max(points.win(), points.draw()) / 2;
    }
}
