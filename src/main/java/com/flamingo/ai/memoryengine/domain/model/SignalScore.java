package com.flamingo.ai.memoryengine.domain.model;

/**
 * What one retrieval signal said about one candidate.
 *
 * @param rank 1-based rank within the signal after filtering
 * @param rawScore score reported by the signal
 * @param normalizedScore min-max normalized score within the signal, in [0, 1]
 * @param contribution weighted reciprocal-rank contribution to the fused score
 */
public record SignalScore(int rank, double rawScore, double normalizedScore, double contribution) {}
