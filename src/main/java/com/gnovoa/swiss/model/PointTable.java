package com.gnovoa.swiss.model;

/**
 * Six-way scoring table, all values in tenths of a point.
 */
public record PointTable(
        int win,
        int draw,
        int loss,
        int zeroPointBye,
        int forfeitLoss,
        int pairingAllocatedBye
) {

    public static final PointTable DEFAULT = new PointTable(10, 5, 0, 0, 0, 10);

    public PointTable {
        if (win < 0 || draw < 0 || loss < 0 || zeroPointBye < 0 || forfeitLoss < 0 || pairingAllocatedBye < 0) {
            throw new IllegalArgumentException("Point values must not be negative");
        }
    }

    public boolean isDefault() {
        return DEFAULT.equals(this);
    }

    public PointTable withWin(int value) {
        return new PointTable(value, draw, loss, zeroPointBye, forfeitLoss, pairingAllocatedBye);
    }

    public PointTable withDraw(int value) {
        return new PointTable(win, value, loss, zeroPointBye, forfeitLoss, pairingAllocatedBye);
    }

    public PointTable withLoss(int value) {
        return new PointTable(win, draw, value, zeroPointBye, forfeitLoss, pairingAllocatedBye);
    }

    public PointTable withZeroPointBye(int value) {
        return new PointTable(win, draw, loss, value, forfeitLoss, pairingAllocatedBye);
    }

    public PointTable withForfeitLoss(int value) {
        return new PointTable(win, draw, loss, zeroPointBye, value, pairingAllocatedBye);
    }

    public PointTable withPairingAllocatedBye(int value) {
        return new PointTable(win, draw, loss, zeroPointBye, forfeitLoss, value);
    }
}
