package com.gnovoa.swiss.trf;

import java.util.EnumSet;
import java.util.Set;

/**
 * Point codes of the {@code XXS} extension, with their FIDE default in tenths.
 *
 * <p>{@link #W} and {@link #D} are shortcuts: setting them also sets the codes they cover.
 */
public enum ScoringCode {
    WW(10, "win with white"),
    BW(10, "win with black"),
    WD(5, "draw with white"),
    BD(5, "draw with black"),
    WL(0, "loss with white"),
    BL(0, "loss with black"),
    ZPB(0, "zero-point bye"),
    HPB(5, "half-point bye"),
    FPB(10, "full-point bye"),
    PAB(10, "pairing-allocated bye"),
    FW(10, "forfeit win"),
    FL(0, "forfeit loss"),
    W(10, "any win"),
    D(5, "any draw");

    private final int defaultTenths;
    private final String description;

    ScoringCode(int defaultTenths, String description) {
        this.defaultTenths = defaultTenths;
        this.description = description;
    }

    public int defaultTenths() {
        return defaultTenths;
    }

    public String description() {
        return description;
    }

    /** Codes updated together with this one. */
    public Set<ScoringCode> encompassed() {
        return switch (this) {
            case W -> EnumSet.of(WW, BW, FW, FPB);
            case D -> EnumSet.of(WD, BD, HPB);
            default -> EnumSet.noneOf(ScoringCode.class);
        };
    }
}
