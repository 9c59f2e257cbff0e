package com.gnovoa.swiss.runner;

import com.gnovoa.swiss.exception.FormatLimitException;
import com.gnovoa.swiss.exception.MalformedHistoryException;
import com.gnovoa.swiss.model.ByeType;
import com.gnovoa.swiss.model.Color;
import com.gnovoa.swiss.model.Match;
import com.gnovoa.swiss.model.MatchScore;
import com.gnovoa.swiss.model.Player;
import com.gnovoa.swiss.model.PointTable;
import com.gnovoa.swiss.model.Tournament;
import com.gnovoa.swiss.rosters.IntentionalByeRounds;
import com.gnovoa.swiss.rosters.PairingRow;
import com.gnovoa.swiss.rosters.PlayerRow;
import com.gnovoa.swiss.trf.RankCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds a {@link Tournament} from store rows.
 *
 * <p>Start numbers follow rating order. Every player gets one entry per played round: stored
 * boards are decoded from their result code, rounds without a stored board become unpaired
 * zero-point rounds. Opponents become forbidden, scores are recomputed with the requested
 * point table and rank indices follow the standings.
 */
public final class HistoryReconstructor {

    private static final Logger log = LoggerFactory.getLogger(HistoryReconstructor.class);

    static final int MAX_START_NUMBER = 9999;
    static final int MAX_RATING = 9999;

    private final IntentionalByeRounds byeRounds;
    private final RankCalculator ranks;

    public HistoryReconstructor(IntentionalByeRounds byeRounds, RankCalculator ranks) {
        this.byeRounds = byeRounds;
        this.ranks = ranks;
    }

    /**
     * @param round round about to be paired; only history of earlier rounds is used
     * @throws MalformedHistoryException for unknown players, unknown result codes or a player
     *     seated twice in one round
     * @throws FormatLimitException for more than 9999 players or a rating above 9999
     */
    public ReconstructedSection reconstruct(List<PlayerRow> roster, List<PairingRow> history, int round,
                                            int expectedRounds, PointTable points, Color initialColor) {
        int playedRounds = round - 1;
        Tournament tournament = new Tournament(playedRounds, expectedRounds, points, initialColor);

        List<PlayerRow> ordered = new ArrayList<>(roster);
        ordered.sort(Comparator.comparingInt(PlayerRow::ratingOrZero).reversed());
        if (ordered.size() > MAX_START_NUMBER) {
            throw new FormatLimitException("player count", ordered.size(), MAX_START_NUMBER,
                    "Start numbers above 9999 cannot be represented");
        }

        Map<String, Integer> startNumbers = new HashMap<>();
        Map<Integer, String> storeIds = new HashMap<>();
        Map<Integer, Match[]> rounds = new HashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            PlayerRow row = ordered.get(i);
            int startNumber = i + 1;
            if (row.ratingOrZero() < 0) {
                throw new MalformedHistoryException(row.id(), "Player " + row.id() + " has negative rating " + row.rating());
            }
            if (row.ratingOrZero() > MAX_RATING) {
                throw new FormatLimitException("rating of player " + row.id(), row.ratingOrZero(), MAX_RATING,
                        "Ratings above 9999 cannot be represented");
            }
            if (startNumbers.putIfAbsent(row.id(), startNumber) != null) {
                throw new MalformedHistoryException(row.id(), "Player " + row.id() + " is listed twice");
            }
            storeIds.put(startNumber, row.id());

            Player player = tournament.addPlayer(new Player(startNumber, row.name(), row.ratingOrZero()));
            try {
                byeRounds.normalize(row.intentionalByeRounds()).forEach(player::addIntentionalByeRound);
            } catch (IllegalArgumentException e) {
                throw new MalformedHistoryException(row.id(), "Player " + row.id() + ": " + e.getMessage());
            }
            rounds.put(startNumber, new Match[playedRounds]);
        }

        for (PairingRow row : history) {
            if (row.round() >= round) continue;
            if (row.round() < 1) {
                throw new MalformedHistoryException(row.whitePlayerId(), "Pairing with invalid round " + row.round());
            }
            if (row.isBye()) applyBye(row, startNumbers, rounds);
            else applyGame(row, startNumbers, rounds);
        }

        for (Player player : tournament.players()) {
            Match[] slots = rounds.get(player.id());
            for (int r = 0; r < playedRounds; r++) {
                Match m = slots[r] != null ? slots[r] : Match.unpaired(player.id(), MatchScore.LOSS);
                player.addMatch(m);
                if (!m.isByeFor(player.id())) player.forbid(m.opponent());
            }
        }

        tournament.recomputeScores();
        ranks.computeRanks(tournament.players()).forEach((id, rank) -> tournament.player(id).setRankIndex(rank));
        tournament.updatePlayerData();

        log.debug("Reconstructed {} players over {} rounds from {} stored boards",
                ordered.size(), playedRounds, history.size());
        return new ReconstructedSection(tournament, startNumbers, storeIds);
    }

    private void applyBye(PairingRow row, Map<String, Integer> startNumbers, Map<Integer, Match[]> rounds) {
        int self = startNumber(row.whitePlayerId(), startNumbers);
        Match match;
        if (row.byeType() != null && !row.byeType().isBlank()) {
            ByeType type;
            try {
                type = ByeType.fromCode(row.byeType());
            } catch (IllegalArgumentException e) {
                throw new MalformedHistoryException(row.whitePlayerId(), "Unknown bye type " + row.byeType());
            }
            match = switch (type) {
                case BYE -> Match.pairingAllocatedBye(self, MatchScore.WIN);
                case HALF_POINT_BYE -> Match.pairingAllocatedBye(self, MatchScore.DRAW);
                case UNPAIRED -> Match.unpaired(self, MatchScore.LOSS);
            };
        } else {
            String result = row.result() == null ? "" : row.result().trim();
            match = switch (result) {
                case "1-0", "1-0F" -> Match.pairingAllocatedBye(self, MatchScore.WIN);
                case "1/2-1/2", "1/2-1/2F" -> Match.pairingAllocatedBye(self, MatchScore.DRAW);
                case "", "0-1", "0-1F" -> Match.unpaired(self, MatchScore.LOSS);
                default -> throw new MalformedHistoryException(row.whitePlayerId(), "Unknown result code " + row.result());
            };
        }
        place(row.whitePlayerId(), self, row.round(), match, rounds);
    }

    private void applyGame(PairingRow row, Map<String, Integer> startNumbers, Map<Integer, Match[]> rounds) {
        int white = startNumber(row.whitePlayerId(), startNumbers);
        int black = startNumber(row.blackPlayerId(), startNumbers);

        String result = row.result() == null ? "" : row.result().trim();
        MatchScore whiteScore;
        boolean played;
        switch (result) {
            case "1-0" -> { whiteScore = MatchScore.WIN; played = true; }
            case "0-1" -> { whiteScore = MatchScore.LOSS; played = true; }
            case "1/2-1/2" -> { whiteScore = MatchScore.DRAW; played = true; }
            case "1-0F" -> { whiteScore = MatchScore.WIN; played = false; }
            case "0-1F" -> { whiteScore = MatchScore.LOSS; played = false; }
            case "1/2-1/2F" -> { whiteScore = MatchScore.DRAW; played = false; }
            case "" -> { whiteScore = null; played = false; }
            default -> throw new MalformedHistoryException(row.whitePlayerId(), "Unknown result code " + row.result());
        }

        Match whiteMatch;
        Match blackMatch;
        if (whiteScore == null) {
            // Not reported: counts as an unplayed loss for both.
            whiteMatch = new Match(black, Color.WHITE, MatchScore.LOSS, false, true);
            blackMatch = new Match(white, Color.BLACK, MatchScore.LOSS, false, true);
        } else {
            whiteMatch = new Match(black, Color.WHITE, whiteScore, played, true);
            blackMatch = new Match(white, Color.BLACK, whiteScore.invert(), played, true);
        }
        place(row.whitePlayerId(), white, row.round(), whiteMatch, rounds);
        place(row.blackPlayerId(), black, row.round(), blackMatch, rounds);
    }

    private static int startNumber(String storeId, Map<String, Integer> startNumbers) {
        Integer n = startNumbers.get(storeId);
        if (n == null) {
            throw new MalformedHistoryException(storeId, "Pairing references player " + storeId + " who is not on the roster");
        }
        return n;
    }

    private static void place(String storeId, int startNumber, int round, Match match, Map<Integer, Match[]> rounds) {
        Match[] slots = rounds.get(startNumber);
        if (slots[round - 1] != null) {
            throw new MalformedHistoryException(storeId, "Player " + storeId + " has two boards in round " + round);
        }
        slots[round - 1] = match;
    }
}
