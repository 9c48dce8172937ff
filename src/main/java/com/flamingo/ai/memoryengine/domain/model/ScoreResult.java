package com.flamingo.ai.memoryengine.domain.model;

/**
 * Scores computed for one record at one instant.
 *
 * @param importance effective importance, clamped to [0, 1]
 * @param decayWeight time-decayed retention weight, >= 0
 */
public record ScoreResult(double importance, double decayWeight) {}
