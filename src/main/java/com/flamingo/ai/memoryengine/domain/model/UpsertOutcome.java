package com.flamingo.ai.memoryengine.domain.model;

/**
 * Result of the idempotent upsert keyed by {@code (owner, contentHash)}.
 *
 * @param recordId identifier of the stored record
 * @param created true when this call inserted the record, false when it counted an access
 * @param accessCount access count after the upsert
 */
public record UpsertOutcome(String recordId, boolean created, long accessCount) {}
