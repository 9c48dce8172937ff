package com.flamingo.ai.memoryengine.elasticsearch;

import java.time.Instant;

/**
 * Tombstone left behind by a merge.
 *
 * @param discardedId identifier of the merged-away record
 * @param survivorId identifier it now resolves to
 * @param createdAt when the merge happened
 */
record MemoryAlias(String discardedId, String survivorId, Instant createdAt) {}
