package com.gnovoa.swiss.exception;

/**
 * Thrown when the compatibility graph of a round, bye vertex included, has no perfect
 * matching. Retrying without relaxing constraints cannot succeed.
 */
public class UnsatisfiablePairingException extends PairingEngineException {
    private final int round;
    private final int playerCount;

    public UnsatisfiablePairingException(int round, int playerCount) {
        super(String.format("No valid pairing exists for round %d with %d active players", round, playerCount));
        this.round = round;
        this.playerCount = playerCount;
    }

    public int getRound() {
        return round;
    }

    public int getPlayerCount() {
        return playerCount;
    }
}
