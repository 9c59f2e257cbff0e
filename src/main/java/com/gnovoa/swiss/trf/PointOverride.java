package com.gnovoa.swiss.trf;

import com.gnovoa.swiss.model.PointTable;

import java.util.function.BiFunction;
import java.util.function.ToIntFunction;

/**
 * {@code BBx} lines: one entry of the engine's point table written in tenths.
 */
public enum PointOverride {
    BBW(PointTable::win, PointTable::withWin),
    BBD(PointTable::draw, PointTable::withDraw),
    BBL(PointTable::loss, PointTable::withLoss),
    BBZ(PointTable::zeroPointBye, PointTable::withZeroPointBye),
    BBF(PointTable::forfeitLoss, PointTable::withForfeitLoss),
    BBU(PointTable::pairingAllocatedBye, PointTable::withPairingAllocatedBye);

    private final ToIntFunction<PointTable> getter;
    private final BiFunction<PointTable, Integer, PointTable> setter;

    PointOverride(ToIntFunction<PointTable> getter, BiFunction<PointTable, Integer, PointTable> setter) {
        this.getter = getter;
        this.setter = setter;
    }

    public int valueOf(PointTable table) {
        return getter.applyAsInt(table);
    }

    public PointTable apply(PointTable table, int tenths) {
        return setter.apply(table, tenths);
    }

    public static boolean isOverrideLine(String line) {
        if (line.length() < 3) return false;
        for (PointOverride o : values()) {
            if (line.startsWith(o.name())) return true;
        }
        return false;
    }
}
