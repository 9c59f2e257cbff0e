package com.gnovoa.swiss.trf;

import com.gnovoa.swiss.model.Color;
import com.gnovoa.swiss.model.Match;
import com.gnovoa.swiss.model.MatchScore;
import com.gnovoa.swiss.model.Player;
import com.gnovoa.swiss.model.PointTable;
import com.gnovoa.swiss.model.Tournament;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Immutable content of a TRF16 file.
 *
 * @param seedLine text of the {@code 012} line, null when absent
 * @param players player lines in file order
 * @param scoring {@code XXS} table
 * @param extensions every other extension line
 */
public record TrfDocument(String seedLine, List<TrfPlayer> players, ScoringSystem scoring, TrfExtensions extensions) {

    private static final Logger log = LoggerFactory.getLogger(TrfDocument.class);

    public TrfDocument {
        players = List.copyOf(players);
        if (scoring == null) scoring = ScoringSystem.defaultSystem();
        if (extensions == null) extensions = TrfExtensions.NONE;
    }

    /** Rounds already played: the longest history in the file. */
    public int playedRounds() {
        int rounds = 0;
        for (TrfPlayer p : players) rounds = Math.max(rounds, p.matches().size());
        return rounds;
    }

    /**
     * {@code XXS} table with the {@code BBx} overrides applied on top. Without {@code BBU}
     * the pairing-allocated bye is worth a win.
     */
    public PointTable pointTable() {
        PointTable table = scoring.toPointTable();
        Map<PointOverride, Integer> overrides = extensions.pointOverrides();
        for (Map.Entry<PointOverride, Integer> e : overrides.entrySet()) {
            table = e.getKey().apply(table, e.getValue());
        }
        if (overrides.containsKey(PointOverride.BBW) && !overrides.containsKey(PointOverride.BBU)) {
            table = table.withPairingAllocatedBye(table.win());
        }
        return table;
    }

    /**
     * Rebuilds the entity model for pairing the next round.
     *
     * <p>Forbidden pairs come from earlier opponents and {@code XXF}; players listed in
     * {@code XXZ} get an extra unpaired round so they are left out of the next pairing.
     */
    public Tournament toTournament() {
        int played = playedRounds();
        int expected = extensions.totalRounds() != null ? extensions.totalRounds() : played;
        Color initial = extensions.startsWithBlack() ? Color.BLACK : Color.WHITE;
        Tournament tournament = new Tournament(played, expected, pointTable(), initial);

        for (TrfPlayer entry : players) {
            Player player = tournament.addPlayer(new Player(entry.id(), entry.name(), entry.rating()));
            for (Match m : entry.matches()) {
                player.addMatch(m);
                if (!m.isByeFor(entry.id())) player.forbid(m.opponent());
            }
            player.setRankIndex(Math.max(0, entry.rank() - 1));
            List<Integer> acceleration = extensions.accelerations().get(entry.id());
            if (acceleration != null) player.setAccelerations(acceleration);
        }

        for (List<Integer> group : extensions.forbiddenGroups()) {
            for (int a : group) {
                for (int b : group) {
                    if (a != b && tournament.hasPlayer(a)) tournament.player(a).forbid(b);
                }
            }
        }

        tournament.recomputeScores();
        for (TrfPlayer entry : players) {
            int computed = tournament.player(entry.id()).scoreWithoutAcceleration();
            if (computed != entry.points()) {
                log.warn("Player {} has {} points in the file but {} from its results",
                        entry.id(), entry.points() / 10.0, computed / 10.0);
            }
        }

        for (int absent : extensions.absentPlayers()) {
            if (!tournament.hasPlayer(absent)) {
                log.warn("XXZ lists unknown player {}", absent);
                continue;
            }
            Player player = tournament.player(absent);
            while (player.matches().size() < played) player.addMatch(Match.unpaired(absent, MatchScore.LOSS));
            player.addMatch(Match.unpaired(absent, MatchScore.LOSS));
        }

        tournament.updatePlayerData();
        return tournament;
    }
}
