package com.gnovoa.swiss.rosters;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Player row as the store returns it.
 *
 * @param intentionalByeRounds raw value: array, number, JSON string or comma-separated
 *     string; see {@link IntentionalByeRounds}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlayerRow(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("rating") Integer rating,
        @JsonProperty("status") String status,
        @JsonProperty("section") String section,
        @JsonProperty("intentional_bye_rounds") JsonNode intentionalByeRounds
) {

    public static final String ACTIVE = "active";

    public boolean isActive() {
        return status == null || ACTIVE.equalsIgnoreCase(status);
    }

    public int ratingOrZero() {
        return rating == null ? 0 : rating;
    }
}
