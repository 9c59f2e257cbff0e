package com.gnovoa.swiss.schedule;

import com.gnovoa.swiss.model.Match;
import com.gnovoa.swiss.model.MatchScore;
import com.gnovoa.swiss.model.Player;
import com.gnovoa.swiss.model.PointTable;
import com.gnovoa.swiss.model.Tournament;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Opponent-based tiebreaks used to order players before a Burstein round.
 *
 * <p>Rounds without a real opponent count against a virtual opponent whose score depends on
 * how the round was scored (see {@link #virtualOpponentScore}).
 */
public final class TiebreakCalculator {

    public Map<Integer, TiebreakScores> compute(Tournament tournament, List<Player> players) {
        Map<Integer, TiebreakScores> scores = new LinkedHashMap<>();
        for (Player p : players) scores.put(p.id(), compute(tournament, p));
        return scores;
    }

    public TiebreakScores compute(Tournament tournament, Player player) {
        return new TiebreakScores(
                adjustedScore(tournament, player),
                sonnebornBerger(tournament, player),
                buchholz(tournament, player),
                median(tournament, player));
    }

    /** Score with every unplayed round counted as a draw, plus the current acceleration. */
    public int adjustedScore(Tournament tournament, Player player) {
        int score = player.acceleration(tournament);
        for (Match m : player.matches()) {
            score += m.gameWasPlayed() ? tournament.getPoints(player, m) : tournament.points().draw();
        }
        return score;
    }

    public double sonnebornBerger(Tournament tournament, Player player) {
        double total = 0;
        for (Match m : player.matches()) {
            Integer opponentScore = opponentScore(tournament, player, m);
            if (opponentScore == null) continue;
            if (m.matchScore() == MatchScore.WIN) total += opponentScore;
            else if (m.matchScore() == MatchScore.DRAW) total += opponentScore * 0.5;
        }
        return total;
    }

    public int buchholz(Tournament tournament, Player player) {
        int total = 0;
        for (int score : opponentScores(tournament, player)) total += score;
        return total;
    }

    public int median(Tournament tournament, Player player) {
        if (tournament.playedRounds() <= 2) return 0;

        List<Integer> scores = opponentScores(tournament, player);
        if (scores.size() <= 2) return 0;
        Collections.sort(scores);
        int total = 0;
        for (int score : scores.subList(1, scores.size() - 1)) total += score;
        return total;
    }

    /**
     * Score credited for a round without a real game: a lost round counts as meeting a winner,
     * a drawn one as meeting a drawer, a pairing-allocated bye as the better of the win and
     * draw values and anything else as the forfeit-loss value.
     */
    public int virtualOpponentScore(Tournament tournament, Player player, Match match) {
        PointTable points = tournament.points();
        if (match.matchScore() == MatchScore.LOSS) return points.win();
        if (match.matchScore() == MatchScore.DRAW) return points.draw();
        if (match.isByeFor(player.id()) && match.participatedInPairing()) {
            if (points.pairingAllocatedBye() < points.win()) {
                return points.pairingAllocatedBye() < points.draw() ? points.win() : points.draw();
            }
            return points.win();
        }
        return points.forfeitLoss();
    }

    private List<Integer> opponentScores(Tournament tournament, Player player) {
        List<Integer> scores = new ArrayList<>();
        for (Match m : player.matches()) {
            Integer score = opponentScore(tournament, player, m);
            if (score != null) scores.add(score);
        }
        return scores;
    }

    /** @return null when a played game references a player outside the snapshot. */
    private Integer opponentScore(Tournament tournament, Player player, Match match) {
        if (!match.gameWasPlayed()) return virtualOpponentScore(tournament, player, match);
        if (!tournament.hasPlayer(match.opponent())) return null;
        return adjustedScore(tournament, tournament.player(match.opponent()));
    }
}
