package com.gnovoa.swiss.model;

import java.util.Arrays;

/**
 * Kind of board without an opponent, as stored next to a pairing record.
 *
 * <p>{@link #BYE} is a full pairing-allocated bye, {@link #HALF_POINT_BYE} covers both the
 * second pairing-allocated bye of a player and requested byes, {@link #UNPAIRED} is a player
 * who sat the round out for no points.
 */
public enum ByeType {
    BYE("bye"),
    HALF_POINT_BYE("half_point_bye"),
    UNPAIRED("unpaired");

    private final String code;

    ByeType(String code) {
        this.code = code;
    }

    /** @return store representation ({@code bye}, {@code half_point_bye}, {@code unpaired}). */
    public String code() {
        return code;
    }

    public static ByeType fromCode(String code) {
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(code.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown bye type " + code));
    }
}
