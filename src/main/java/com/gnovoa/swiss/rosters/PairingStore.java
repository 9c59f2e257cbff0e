package com.gnovoa.swiss.rosters;

import java.util.List;

/**
 * Read side of the external tournament store.
 *
 * <p>Callers serialise pairing generation per tournament and round; the engine never writes
 * through this interface.
 */
public interface PairingStore {

    /** Active players of a section; all sections when {@code section} is null. */
    List<PlayerRow> activePlayers(String tournamentId, String section);

    /** Every stored board of rounds strictly before {@code round}, ordered by round and board. */
    List<PairingRow> pairingsBefore(String tournamentId, int round, String section);
}
