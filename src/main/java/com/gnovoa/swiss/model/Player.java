package com.gnovoa.swiss.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Roster entry of a section together with everything the pairing systems derive from its
 * history.
 *
 * <p>This class owns:
 * <ul>
 *   <li>Identity (start number, name, rating) and the round-indexed {@link Match} history</li>
 *   <li>Colour bookkeeping: imbalance, preference and repeated-colour streak</li>
 *   <li>Bye bookkeeping: counters, rounds and requested-bye rounds</li>
 * </ul>
 *
 * <p>Instances are rebuilt for every pairing request and are never shared between requests.
 * Derived fields are only valid after {@link #updateColorPreferences()} and
 * {@link #updateByeTracking()} ran (see {@link Tournament#updatePlayerData()}).
 */
public final class Player {

    private final int id;
    private final String name;
    private final int rating;

    private final List<Match> matches = new ArrayList<>();

    /** Acceleration in tenths, indexed by 0-based round. */
    private final List<Integer> accelerations = new ArrayList<>();

    private final Set<Integer> forbiddenPairs = new LinkedHashSet<>();
    private final Set<Integer> intentionalByeRounds = new TreeSet<>();

    private int rankIndex;
    private int scoreWithoutAcceleration;
    private boolean valid = true;

    private int colorImbalance;
    private Color colorPreference = Color.NONE;
    private Color repeatedColor = Color.NONE;
    private boolean strongColorPreference;

    private int byeCount;
    private int halfPointByeCount;
    private int fullByeCount;
    private final List<Integer> byeRounds = new ArrayList<>();

    public Player(int id, String name, int rating) {
        if (id <= 0) throw new IllegalArgumentException("Player id must be positive, got " + id);
        if (rating < 0) throw new IllegalArgumentException("Rating must not be negative for player " + id);
        this.id = id;
        this.name = name == null ? "" : name;
        this.rating = rating;
    }

    public int id() { return id; }
    public String name() { return name; }
    public int rating() { return rating; }

    public List<Match> matches() { return Collections.unmodifiableList(matches); }
    public List<Integer> accelerations() { return Collections.unmodifiableList(accelerations); }
    public Set<Integer> forbiddenPairs() { return Collections.unmodifiableSet(forbiddenPairs); }
    public Set<Integer> intentionalByeRounds() { return Collections.unmodifiableSet(intentionalByeRounds); }

    public int rankIndex() { return rankIndex; }
    public int scoreWithoutAcceleration() { return scoreWithoutAcceleration; }
    public boolean isValid() { return valid; }

    public int colorImbalance() { return colorImbalance; }
    public Color colorPreference() { return colorPreference; }
    public Color repeatedColor() { return repeatedColor; }
    public boolean strongColorPreference() { return strongColorPreference; }

    public int byeCount() { return byeCount; }
    public int halfPointByeCount() { return halfPointByeCount; }
    public int fullByeCount() { return fullByeCount; }
    public List<Integer> byeRounds() { return Collections.unmodifiableList(byeRounds); }

    public void addMatch(Match match) {
        matches.add(match);
    }

    public void setAccelerations(List<Integer> values) {
        accelerations.clear();
        accelerations.addAll(values);
    }

    public void forbid(int opponentId) {
        if (opponentId != id) forbiddenPairs.add(opponentId);
    }

    public boolean isForbidden(int opponentId) {
        return forbiddenPairs.contains(opponentId);
    }

    public void addIntentionalByeRound(int round) {
        intentionalByeRounds.add(round);
    }

    public boolean hasIntentionalByeIn(int round) {
        return intentionalByeRounds.contains(round);
    }

    public void setRankIndex(int rankIndex) {
        this.rankIndex = rankIndex;
    }

    public void setScoreWithoutAcceleration(int tenths) {
        this.scoreWithoutAcceleration = tenths;
    }

    public void setValid(boolean valid) {
        this.valid = valid;
    }

    /**
     * Acceleration bonus for a 0-based round index, 0 when the table is shorter.
     */
    public int acceleration(int roundIndex) {
        return roundIndex < 0 || roundIndex >= accelerations.size() ? 0 : accelerations.get(roundIndex);
    }

    /** @return acceleration for the round about to be paired. */
    public int acceleration(Tournament tournament) {
        return acceleration(tournament.playedRounds());
    }

    public int scoreWithAcceleration(Tournament tournament) {
        return scoreWithAcceleration(tournament, 0);
    }

    /**
     * Cumulative score plus the acceleration of the targeted round.
     *
     * <p>With {@code roundsBack > 0} the score is rolled back by removing the points of the
     * last {@code roundsBack} rounds, and the acceleration of that earlier round is applied.
     *
     * @throws IllegalStateException if the acceleration table holds a negative bonus, which
     *     would put the accelerated score under the plain score
     */
    public int scoreWithAcceleration(Tournament tournament, int roundsBack) {
        if (roundsBack < 0) throw new IllegalArgumentException("roundsBack must not be negative");

        int score = scoreWithoutAcceleration;
        int roundIndex = tournament.playedRounds();
        for (int back = roundsBack; back > 0; back--) {
            roundIndex--;
            if (roundIndex >= 0 && roundIndex < matches.size()) {
                score -= tournament.getPoints(this, matches.get(roundIndex));
            }
        }

        int result = score + acceleration(roundIndex);
        if (result < score) {
            throw new IllegalStateException("Accelerated score of player " + id + " fell below its plain score in round "
                    + (roundIndex + 1) + "; acceleration table is corrupt");
        }
        return result;
    }

    /** @return whites minus blacks over played games. */
    public int colorBalance() {
        int balance = 0;
        for (Match m : matches) {
            if (!m.gameWasPlayed()) continue;
            if (m.color() == Color.WHITE) balance++;
            else if (m.color() == Color.BLACK) balance--;
        }
        return balance;
    }

    /** @return colours of the last {@code count} played games, oldest first. */
    public List<Color> lastPlayedColors(int count) {
        List<Color> colors = new ArrayList<>();
        for (Match m : matches) {
            if (m.gameWasPlayed() && m.color() != Color.NONE) colors.add(m.color());
        }
        return colors.subList(Math.max(0, colors.size() - count), colors.size());
    }

    public boolean absoluteColorImbalance() {
        return colorImbalance > 1;
    }

    /**
     * Absolute preferences (imbalance above one, or the same colour twice in a row) can only
     * be overridden in the last round or among top scorers.
     */
    public boolean absoluteColorPreference() {
        return absoluteColorImbalance() || repeatedColor != Color.NONE;
    }

    /**
     * Recomputes imbalance, preference and streak from played games.
     *
     * <p>Rule order: imbalance above one asks for the lower colour; otherwise a streak of two
     * asks for the other colour; otherwise an imbalance of one asks for the lower colour;
     * otherwise the player alternates from the last game, or has no preference.
     */
    public void updateColorPreferences() {
        if (!valid) return;

        int gamesAsWhite = 0;
        int gamesAsBlack = 0;
        int consecutiveCount = 0;
        Color lastColor = Color.NONE;

        for (Match m : matches) {
            if (!m.gameWasPlayed() || m.color() == Color.NONE) continue;
            if (m.color() == Color.WHITE) gamesAsWhite++;
            else gamesAsBlack++;

            consecutiveCount = (consecutiveCount == 0 || m.color() != lastColor) ? 1 : consecutiveCount + 1;
            lastColor = m.color();
        }

        Color lowerColor = gamesAsWhite > gamesAsBlack ? Color.BLACK : Color.WHITE;
        colorImbalance = Math.abs(gamesAsWhite - gamesAsBlack);

        if (colorImbalance > 1) colorPreference = lowerColor;
        else if (consecutiveCount > 1) colorPreference = lastColor.invert();
        else if (colorImbalance > 0) colorPreference = lowerColor;
        else if (consecutiveCount > 0) colorPreference = lastColor.invert();
        else colorPreference = Color.NONE;

        repeatedColor = consecutiveCount > 1 ? lastColor : Color.NONE;
        strongColorPreference = !absoluteColorPreference() && colorImbalance != 0;
    }

    /**
     * Recounts byes: unplayed rounds against oneself that were part of the pairing.
     */
    public void updateByeTracking() {
        if (!valid) return;

        byeCount = 0;
        halfPointByeCount = 0;
        fullByeCount = 0;
        byeRounds.clear();

        for (int i = 0; i < matches.size(); i++) {
            Match m = matches.get(i);
            if (m.gameWasPlayed() || !m.participatedInPairing() || !m.isByeFor(id)) continue;

            byeCount++;
            byeRounds.add(i + 1);
            if (m.matchScore() == MatchScore.WIN) fullByeCount++;
            else if (m.matchScore() == MatchScore.DRAW) halfPointByeCount++;
        }
    }

    /**
     * A player who never had a bye may receive a full pairing-allocated bye, unless a bye was
     * requested for the round being paired.
     */
    public boolean isEligibleForBye(Tournament tournament) {
        return byeCount == 0 && !hasIntentionalByeIn(tournament.playedRounds() + 1);
    }

    /** Exactly one full bye so far and no half-point bye. */
    public boolean isEligibleForHalfPointBye(Tournament tournament) {
        return fullByeCount == 1 && halfPointByeCount == 0 && !hasIntentionalByeIn(tournament.playedRounds() + 1);
    }

    /** Lower is picked first: every earlier bye weighs 1000, rating breaks ties. */
    public int byePriority() {
        return byeCount * 1000 + rating;
    }

    /** @return true if any unplayed round was scored as a full bye. */
    public boolean hadUnplayedWin() {
        for (Match m : matches) {
            if (!m.gameWasPlayed() && m.participatedInPairing() && m.matchScore() == MatchScore.WIN) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "Player[" + id + " " + name + " (" + rating + ")]";
    }
}
