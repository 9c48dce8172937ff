package com.flamingo.ai.memoryengine.domain.model;

import com.flamingo.ai.memoryengine.domain.enums.MemoryTier;
import java.time.Instant;
import java.util.Set;
import lombok.Builder;

/**
 * Caller filters applied to every candidate set before fusion. A candidate that does not match is
 * excluded outright; filters never change scores.
 *
 * @param owner required owner, or null for any owner
 * @param tiers allowed tiers, or null/empty for all tiers
 * @param tags tags the record must all carry, or null/empty
 * @param createdAfter inclusive lower bound on creation time, or null
 * @param createdBefore exclusive upper bound on creation time, or null
 * @param includeArchived whether archived records may be returned
 */
@Builder(toBuilder = true)
public record SearchFilters(
    String owner,
    Set<MemoryTier> tiers,
    Set<String> tags,
    Instant createdAfter,
    Instant createdBefore,
    boolean includeArchived) {

  public static SearchFilters forOwner(String owner) {
    return SearchFilters.builder().owner(owner).build();
  }

  public static SearchFilters none() {
    return SearchFilters.builder().build();
  }

  /** Whether {@code record} passes every filter. */
  public boolean matches(MemoryRecord record) {
    if (record == null) {
      return false;
    }
    if (owner != null && !owner.equals(record.getOwner())) {
      return false;
    }
    if (!includeArchived && record.isArchived()) {
      return false;
    }
    if (tiers != null && !tiers.isEmpty() && !tiers.contains(record.getTier())) {
      return false;
    }
    if (tags != null && !tags.isEmpty()) {
      if (record.getTags() == null || !record.getTags().containsAll(tags)) {
        return false;
      }
    }
    Instant createdAt = record.getCreatedAt();
    if (createdAfter != null && (createdAt == null || createdAt.isBefore(createdAfter))) {
      return false;
    }
    if (createdBefore != null && (createdAt == null || !createdAt.isBefore(createdBefore))) {
      return false;
    }
    return true;
  }
}
