package com.gnovoa.swiss.rosters;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link PairingStore} kept in memory, filled programmatically or from JSON snapshots of the
 * form {@code {"players": [...], "pairings": [...]}}.
 */
public final class InMemoryPairingStore implements PairingStore {

    /** JSON shape of one tournament snapshot. */
    public record Snapshot(
            @JsonProperty("players") List<PlayerRow> players,
            @JsonProperty("pairings") List<PairingRow> pairings
    ) {
        public Snapshot {
            players = players == null ? List.of() : List.copyOf(players);
            pairings = pairings == null ? List.of() : List.copyOf(pairings);
        }
    }

    private final ObjectMapper mapper;
    private final Map<String, List<PlayerRow>> players = new ConcurrentHashMap<>();
    private final Map<String, List<PairingRow>> pairings = new ConcurrentHashMap<>();

    public InMemoryPairingStore(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Replaces everything stored for the tournament with the snapshot.
     *
     * @throws IllegalStateException if the stream is not a valid snapshot
     */
    public void load(String tournamentId, InputStream json) {
        try {
            Snapshot snapshot = mapper.readValue(json, Snapshot.class);
            players.put(tournamentId, new ArrayList<>(snapshot.players()));
            pairings.put(tournamentId, new ArrayList<>(snapshot.pairings()));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load snapshot for tournament " + tournamentId, e);
        }
    }

    public void addPlayer(String tournamentId, PlayerRow row) {
        players.computeIfAbsent(tournamentId, k -> new ArrayList<>()).add(row);
    }

    public void addPairing(String tournamentId, PairingRow row) {
        pairings.computeIfAbsent(tournamentId, k -> new ArrayList<>()).add(row);
    }

    @Override
    public List<PlayerRow> activePlayers(String tournamentId, String section) {
        return players.getOrDefault(tournamentId, List.of()).stream()
                .filter(PlayerRow::isActive)
                .filter(p -> section == null || p.section() == null || section.equals(p.section()))
                .toList();
    }

    @Override
    public List<PairingRow> pairingsBefore(String tournamentId, int round, String section) {
        return pairings.getOrDefault(tournamentId, List.of()).stream()
                .filter(p -> p.round() < round)
                .filter(p -> section == null || p.section() == null || Objects.equals(section, p.section()))
                .sorted(Comparator.comparingInt(PairingRow::round)
                        .thenComparingInt(p -> p.board() == null ? Integer.MAX_VALUE : p.board()))
                .toList();
    }
}
