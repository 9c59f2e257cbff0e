package com.gnovoa.swiss.model;

/**
 * One board of a generated round.
 *
 * @param whiteId white player (the bye recipient for byes)
 * @param blackId black player, null for byes
 * @param byeType bye subtype, null for a game
 * @param board 1-based board number, 0 until the orchestrator numbers the round
 * @param section section tag, null until the orchestrator assigns one
 */
public record Pairing(int whiteId, Integer blackId, ByeType byeType, int board, String section) {

    public static Pairing game(int whiteId, int blackId) {
        return new Pairing(whiteId, blackId, null, 0, null);
    }

    public static Pairing bye(int playerId, ByeType type) {
        return new Pairing(playerId, null, type, 0, null);
    }

    public boolean isBye() {
        return blackId == null;
    }

    public boolean involves(int playerId) {
        return whiteId == playerId || (blackId != null && blackId == playerId);
    }

    public Pairing onBoard(int board, String section) {
        return new Pairing(whiteId, blackId, byeType, board, section);
    }
}
