package com.gnovoa.swiss.schedule;

import com.gnovoa.swiss.model.Pairing;
import com.gnovoa.swiss.model.Tournament;

import java.util.List;

/**
 * Produces the pairings of the next round of a tournament snapshot.
 *
 * <p>Implementations are stateless; all state lives in the {@link Tournament} passed in.
 * Returned pairings carry no board number or section yet.
 */
public interface PairingSystem {

    PairingSystemType type();

    /**
     * @throws com.gnovoa.swiss.exception.UnsatisfiablePairingException when the active players
     *     cannot all be paired (plus one bye for an odd count)
     */
    List<Pairing> computeMatching(Tournament tournament);
}
