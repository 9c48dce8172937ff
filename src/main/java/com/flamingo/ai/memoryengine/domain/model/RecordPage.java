package com.flamingo.ai.memoryengine.domain.model;

import java.util.List;

/**
 * One page of a cursor scan over a tier.
 *
 * @param records records on this page, ordered by identifier
 * @param nextCursor cursor to resume after this page, or null when the tier is exhausted
 */
public record RecordPage(List<MemoryRecord> records, String nextCursor) {

  public boolean isLast() {
    return nextCursor == null;
  }
}
