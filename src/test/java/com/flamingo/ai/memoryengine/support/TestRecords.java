package com.flamingo.ai.memoryengine.support;

import com.flamingo.ai.memoryengine.domain.enums.MemoryTier;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.service.dedup.ContentHasher;
import java.time.Instant;

/** Builders for records in a consistent, valid state. */
public final class TestRecords {

  private TestRecords() {}

  /** A WORKING record owned by {@code owner}, created and last touched at {@code at}. */
  public static MemoryRecord.MemoryRecordBuilder working(String owner, String content, Instant at) {
    String hash = ContentHasher.sha256Hex(content);
    return MemoryRecord.builder()
        .id(ContentHasher.recordId(owner, hash))
        .owner(owner)
        .content(content)
        .contentHash(hash)
        .tier(MemoryTier.WORKING)
        .baseImportance(0.5)
        .importance(0.5)
        .decayWeight(0.5)
        .accessCount(1)
        .createdAt(at)
        .lastAccessedAt(at)
        .lastModifiedAt(at)
        .tierEnteredAt(at);
  }

  /** A record with a fixed identifier, for ranking tests where ids matter. */
  public static MemoryRecord withId(String id, double importance, Instant lastAccessedAt) {
    return working("alice", "memory " + id, Instant.EPOCH)
        .id(id)
        .importance(importance)
        .lastAccessedAt(lastAccessedAt)
        .build();
  }
}
