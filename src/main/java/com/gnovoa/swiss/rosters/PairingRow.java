package com.gnovoa.swiss.rosters;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Stored board of an earlier round.
 *
 * @param blackPlayerId null for a bye row
 * @param result {@code 1-0}, {@code 0-1}, {@code 1/2-1/2}, the same with an {@code F} suffix
 *     for forfeits, or null while unreported
 * @param byeType {@code bye}, {@code half_point_bye} or {@code unpaired} on bye rows
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PairingRow(
        @JsonProperty("white_player_id") String whitePlayerId,
        @JsonProperty("black_player_id") String blackPlayerId,
        @JsonProperty("result") String result,
        @JsonProperty("round") int round,
        @JsonProperty("section") String section,
        @JsonProperty("board") Integer board,
        @JsonProperty("bye_type") String byeType
) {

    public boolean isBye() {
        return blackPlayerId == null;
    }
}
