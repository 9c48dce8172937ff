package com.flamingo.ai.memoryengine.domain.model;

/**
 * A record reached by graph traversal.
 *
 * @param recordId record mentioned by a visited entity
 * @param hops distance from the nearest seed entity (0 when a seed mentions the record directly)
 * @param score proximity score, decreasing with hop count
 */
public record GraphHit(String recordId, int hops, double score) {}
