package com.gnovoa.swiss.schedule;

import java.util.Arrays;

/** Pairing algorithms the engine can run. */
public enum PairingSystemType {
    DUTCH("dutch"),
    BURSTEIN("burstein");

    private final String code;

    PairingSystemType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static PairingSystemType fromCode(String code) {
        if (code == null || code.isBlank()) return DUTCH;
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(code.trim()) || t.name().equalsIgnoreCase(code.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown pairing system " + code));
    }
}
