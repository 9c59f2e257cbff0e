package com.gnovoa.swiss.runner;

import com.gnovoa.swiss.rosters.StoredPairing;
import com.gnovoa.swiss.schedule.PairingSystemType;

import java.util.List;

/**
 * Result of a pairing request: either every board of the round or a failure, never a part.
 */
public record PairingOutcome(
        boolean success,
        List<StoredPairing> pairings,
        String trfSnapshot,
        String trfPairings,
        Metadata metadata,
        ErrorKind errorKind,
        String errorMessage
) {

    public enum ErrorKind {
        UNSATISFIABLE_PAIRING,
        FORMAT_LIMIT,
        MALFORMED_HISTORY,
        INVALID_REQUEST
    }

    public record Metadata(
            String tournamentId,
            int round,
            String section,
            PairingSystemType system,
            int activePlayers,
            int byes
    ) {}

    public PairingOutcome {
        pairings = pairings == null ? List.of() : List.copyOf(pairings);
    }

    public static PairingOutcome success(List<StoredPairing> pairings, String trfSnapshot, String trfPairings, Metadata metadata) {
        return new PairingOutcome(true, pairings, trfSnapshot, trfPairings, metadata, null, null);
    }

    public static PairingOutcome failure(ErrorKind kind, String message, Metadata metadata) {
        return new PairingOutcome(false, List.of(), null, null, metadata, kind, message);
    }
}
