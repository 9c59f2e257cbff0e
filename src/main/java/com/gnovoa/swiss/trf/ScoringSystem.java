package com.gnovoa.swiss.trf;

import com.gnovoa.swiss.model.PointTable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable table of the fourteen {@link ScoringCode} values, in tenths.
 */
public final class ScoringSystem {

    private static final ScoringSystem DEFAULT = new ScoringSystem(defaults());

    private final Map<ScoringCode, Integer> tenths;

    private ScoringSystem(Map<ScoringCode, Integer> tenths) {
        this.tenths = Collections.unmodifiableMap(new EnumMap<>(tenths));
    }

    public static ScoringSystem defaultSystem() {
        return DEFAULT;
    }

    private static Map<ScoringCode, Integer> defaults() {
        Map<ScoringCode, Integer> values = new EnumMap<>(ScoringCode.class);
        for (ScoringCode code : ScoringCode.values()) values.put(code, code.defaultTenths());
        return values;
    }

    public int tenths(ScoringCode code) {
        return tenths.get(code);
    }

    public Map<ScoringCode, Integer> asMap() {
        return tenths;
    }

    /** @return copy with {@code code} (and every code it encompasses) set to {@code value}. */
    public ScoringSystem with(ScoringCode code, int value) {
        if (value < 0) throw new IllegalArgumentException("Negative points for " + code);
        Map<ScoringCode, Integer> values = new EnumMap<>(tenths);
        values.put(code, value);
        for (ScoringCode covered : code.encompassed()) values.put(covered, value);
        return new ScoringSystem(values);
    }

    public boolean isDefault() {
        return equals(DEFAULT);
    }

    /** Six-way engine table: win, draw, loss (with white), zero-point bye, forfeit loss, PAB. */
    public PointTable toPointTable() {
        return new PointTable(
                tenths(ScoringCode.W),
                tenths(ScoringCode.D),
                tenths(ScoringCode.WL),
                tenths(ScoringCode.ZPB),
                tenths(ScoringCode.FL),
                tenths(ScoringCode.PAB));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ScoringSystem other && tenths.equals(other.tenths);
    }

    @Override
    public int hashCode() {
        return tenths.hashCode();
    }

    @Override
    public String toString() {
        return "ScoringSystem" + tenths;
    }
}
