package com.gnovoa.swiss.trf;

import com.gnovoa.swiss.model.Match;

import java.util.List;

/**
 * One parsed {@code 001} line.
 *
 * @param points points as written in the file, in tenths
 * @param rank 1-based rank as written in the file
 */
public record TrfPlayer(int id, String name, int rating, int points, int rank, List<Match> matches) {

    public TrfPlayer {
        matches = List.copyOf(matches);
    }
}
