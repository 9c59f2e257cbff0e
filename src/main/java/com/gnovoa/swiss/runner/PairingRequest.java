package com.gnovoa.swiss.runner;

import com.gnovoa.swiss.model.PointTable;
import com.gnovoa.swiss.schedule.PairingSystemType;

/**
 * One call of {@link PairingRunner#generatePairings}. Null fields fall back to
 * {@link PairingProperties}.
 *
 * @param round round to pair, 1-based
 * @param includeTrf also render the TRF snapshot and the JaVaFo pairing block
 */
public record PairingRequest(
        String tournamentId,
        int round,
        String section,
        PairingSystemType system,
        PointTable points,
        Integer expectedRounds,
        boolean includeTrf
) {

    public static PairingRequest of(String tournamentId, int round) {
        return new PairingRequest(tournamentId, round, null, null, null, null, false);
    }

    public PairingRequest withSystem(PairingSystemType type) {
        return new PairingRequest(tournamentId, round, section, type, points, expectedRounds, includeTrf);
    }

    public PairingRequest withPoints(PointTable table) {
        return new PairingRequest(tournamentId, round, section, system, table, expectedRounds, includeTrf);
    }

    public PairingRequest withSection(String name) {
        return new PairingRequest(tournamentId, round, name, system, points, expectedRounds, includeTrf);
    }

    public PairingRequest withExpectedRounds(int rounds) {
        return new PairingRequest(tournamentId, round, section, system, points, rounds, includeTrf);
    }

    public PairingRequest withTrf() {
        return new PairingRequest(tournamentId, round, section, system, points, expectedRounds, true);
    }
}
