package com.flamingo.ai.memoryengine.domain.model;

/**
 * A near-duplicate candidate.
 *
 * @param recordId identifier of the similar record
 * @param similarity cosine similarity to the probe embedding
 */
public record SimilarityMatch(String recordId, double similarity) {}
