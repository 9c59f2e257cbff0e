package com.gnovoa.swiss.trf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JaVaFo extension lines of a TRF file, parsed once.
 *
 * @param totalRounds {@code XXR}, null when absent
 * @param absentPlayers {@code XXZ} ids, not paired in the next round
 * @param forbiddenGroups {@code XXF} lines; every two ids of one line must not meet
 * @param accelerations {@code XXA} bonus per round in tenths, by player id
 * @param checklist {@code XXC} free text
 * @param buildNumber {@code XXB}, null when absent
 * @param releaseNumber {@code XXV} free text
 * @param pointOverrides {@code BBx} values in tenths
 */
public record TrfExtensions(
        Integer totalRounds,
        List<Integer> absentPlayers,
        List<List<Integer>> forbiddenGroups,
        Map<Integer, List<Integer>> accelerations,
        String checklist,
        Integer buildNumber,
        String releaseNumber,
        Map<PointOverride, Integer> pointOverrides
) {

    public static final TrfExtensions NONE = builder().build();

    public TrfExtensions {
        absentPlayers = List.copyOf(absentPlayers);
        List<List<Integer>> groups = new ArrayList<>();
        for (List<Integer> g : forbiddenGroups) groups.add(List.copyOf(g));
        forbiddenGroups = Collections.unmodifiableList(groups);
        Map<Integer, List<Integer>> acc = new LinkedHashMap<>();
        accelerations.forEach((id, values) -> acc.put(id, List.copyOf(values)));
        accelerations = Collections.unmodifiableMap(acc);
        pointOverrides = pointOverrides.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(pointOverrides));
    }

    public boolean isAbsent(int playerId) {
        return absentPlayers.contains(playerId);
    }

    /** {@code XXC} asks for black on the top board of round one. */
    public boolean startsWithBlack() {
        return checklist != null && checklist.toLowerCase().contains("black1");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Integer totalRounds;
        private final List<Integer> absentPlayers = new ArrayList<>();
        private final List<List<Integer>> forbiddenGroups = new ArrayList<>();
        private final Map<Integer, List<Integer>> accelerations = new LinkedHashMap<>();
        private String checklist;
        private Integer buildNumber;
        private String releaseNumber;
        private final Map<PointOverride, Integer> pointOverrides = new EnumMap<>(PointOverride.class);

        public Builder totalRounds(Integer rounds) {
            this.totalRounds = rounds;
            return this;
        }

        public Builder absent(int playerId) {
            absentPlayers.add(playerId);
            return this;
        }

        public Builder forbid(List<Integer> ids) {
            forbiddenGroups.add(ids);
            return this;
        }

        public Builder acceleration(int playerId, List<Integer> tenthsPerRound) {
            accelerations.put(playerId, tenthsPerRound);
            return this;
        }

        public Builder checklist(String text) {
            this.checklist = text;
            return this;
        }

        public Builder buildNumber(Integer number) {
            this.buildNumber = number;
            return this;
        }

        public Builder releaseNumber(String text) {
            this.releaseNumber = text;
            return this;
        }

        public Builder override(PointOverride override, int tenths) {
            pointOverrides.put(override, tenths);
            return this;
        }

        public TrfExtensions build() {
            return new TrfExtensions(totalRounds, absentPlayers, forbiddenGroups, accelerations,
                    checklist, buildNumber, releaseNumber, pointOverrides);
        }
    }
}
