package com.flamingo.ai.memoryengine.domain.model;

/**
 * Outcome of resolving two near-duplicate records.
 *
 * @param survivor the merged record to write back under the survivor identifier
 * @param discardedId identifier to delete and tombstone to the survivor
 */
public record MergePlan(MemoryRecord survivor, String discardedId) {}
