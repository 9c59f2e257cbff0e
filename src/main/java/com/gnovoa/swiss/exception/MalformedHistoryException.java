package com.gnovoa.swiss.exception;

/**
 * Thrown when stored history cannot be reconstructed, e.g. a pairing references a player
 * that is not on the roster, or carries an unknown result code.
 */
public class MalformedHistoryException extends PairingEngineException {
    private final String playerId;

    public MalformedHistoryException(String playerId, String message) {
        super(message);
        this.playerId = playerId;
    }

    public String getPlayerId() {
        return playerId;
    }
}
