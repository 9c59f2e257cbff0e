package com.gnovoa.swiss.rosters;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Pairing record handed back to the store, keyed by store ids. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoredPairing(
        @JsonProperty("white_player_id") String whitePlayerId,
        @JsonProperty("black_player_id") String blackPlayerId,
        @JsonProperty("is_bye") boolean isBye,
        @JsonProperty("bye_type") String byeType,
        @JsonProperty("board") int board,
        @JsonProperty("section") String section
) {}
