package com.gnovoa.swiss.schedule;

/**
 * Tiebreak values of one player, in tenths of a point.
 *
 * @param adjustedScore score with unplayed rounds counted as draws, acceleration included
 * @param sonnebornBerger opponents' adjusted scores weighted by the result against them
 * @param buchholz sum of opponents' adjusted scores
 * @param median Buchholz without the best and the worst opponent, 0 up to round two
 */
public record TiebreakScores(int adjustedScore, double sonnebornBerger, int buchholz, int median) {}
