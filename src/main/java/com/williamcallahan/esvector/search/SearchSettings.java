package com.williamcallahan.esvector.search;

/**
 * Tuning for nearest-neighbour and rank-fusion requests.
 *
 * @param numCandidatesFactor multiplier applied to {@code k} to size the candidate pool per shard
 * @param rankWindowSize minimum number of results each retriever contributes to fusion
 * @param rankConstant reciprocal-rank-fusion constant
 */
public record SearchSettings(int numCandidatesFactor, int rankWindowSize, int rankConstant) {

    public static final int DEFAULT_NUM_CANDIDATES_FACTOR = 2;
    public static final int DEFAULT_RANK_WINDOW_SIZE = 10;
    public static final int DEFAULT_RANK_CONSTANT = 60;

    public SearchSettings {
        if (numCandidatesFactor < 1) {
            throw new IllegalArgumentException("numCandidatesFactor must be at least 1");
        }
        if (rankWindowSize < 1) {
            throw new IllegalArgumentException("rankWindowSize must be at least 1");
        }
        if (rankConstant < 1) {
            throw new IllegalArgumentException("rankConstant must be at least 1");
        }
    }

    public static SearchSettings defaults() {
        return new SearchSettings(DEFAULT_NUM_CANDIDATES_FACTOR, DEFAULT_RANK_WINDOW_SIZE, DEFAULT_RANK_CONSTANT);
    }
}
