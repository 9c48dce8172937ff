package com.flamingo.ai.memoryengine.domain.model;

/**
 * A record returned by a store ranking query together with its raw signal score.
 *
 * @param record the matching record
 * @param score raw score reported by the index (cosine similarity, BM25, graph proximity)
 */
public record ScoredRecord(MemoryRecord record, double score) {}
