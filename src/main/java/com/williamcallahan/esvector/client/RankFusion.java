package com.williamcallahan.esvector.client;

/**
 * Reciprocal-rank-fusion parameters of a hybrid request.
 *
 * @param rankWindowSize number of results each retriever contributes
 * @param rankConstant fusion constant
 */
public record RankFusion(int rankWindowSize, int rankConstant) {}
