package com.example.video_grid.selector;

/**
 * Candidate index paired with its average distinctness against its comparison partners.
 *
 * @param index candidate position in chronological order.
 * @param score average composite difference, higher is more distinct.
 */
public record ScoredFrame(int index, double score) {
}
