package com.flamingo.ai.memoryengine.domain.model;

import com.flamingo.ai.memoryengine.domain.enums.MemoryTier;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A unit of remembered content.
 *
 * <p>The identifier is derived from {@code (owner, contentHash)} at creation and never changes.
 * Importance and decay weight are kept inside their bounds by the scoring engine; tier only moves
 * forward. Tags and metadata use sorted collections so that merged records serialize identically
 * regardless of merge order.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MemoryRecord {

  private String id;

  /** Owner/subject the memory belongs to. */
  private String owner;

  private String content;

  /** SHA-256 of the UTF-8 content bytes, lowercase hex. */
  private String contentHash;

  /** Short LLM summary of long content, filled in by consolidation. */
  private String summary;

  /** Semantic embedding; null until enrichment has run. */
  private float[] embedding;

  private MemoryTier tier;

  /** Importance assigned at ingest (0.0 to 1.0); input to decay. */
  private double baseImportance;

  /** Effective importance (0.0 to 1.0) after access reinforcement. */
  private double importance;

  /** Time-decayed retention weight, always >= 0. */
  private double decayWeight;

  private long accessCount;

  private Instant createdAt;

  private Instant lastAccessedAt;

  private Instant lastModifiedAt;

  /** When the record entered its current tier; drives dwell-time gating. */
  private Instant tierEnteredAt;

  private boolean archived;

  private Instant archivedAt;

  @Builder.Default private SortedSet<String> tags = new TreeSet<>();

  @Builder.Default private Map<String, String> metadata = new TreeMap<>();

  /** Whether the record has an embedding attached. */
  public boolean hasEmbedding() {
    return embedding != null && embedding.length > 0;
  }

  /** Name of the first score or counter that holds no usable number, if any. */
  public Optional<String> malformedNumericField() {
    if (Double.isNaN(baseImportance)) {
      return Optional.of("baseImportance");
    }
    if (Double.isNaN(importance)) {
      return Optional.of("importance");
    }
    if (Double.isNaN(decayWeight)) {
      return Optional.of("decayWeight");
    }
    return accessCount < 0 ? Optional.of("accessCount") : Optional.empty();
  }

  /** Copy that shares no mutable state with this record. */
  public MemoryRecord copy() {
    return toBuilder()
        .embedding(embedding != null ? embedding.clone() : null)
        .tags(tags != null ? new TreeSet<>(tags) : new TreeSet<>())
        .metadata(metadata != null ? new TreeMap<>(metadata) : new TreeMap<>())
        .build();
  }

  /**
   * Returns this record after the same content was ingested again: one more access, timestamps
   * refreshed, the incoming tags and unseen metadata keys added, and the record reactivated if it
   * was archived. Tier, scores and creation time are kept.
   */
  public MemoryRecord reingested(MemoryRecord incoming, Instant now) {
    MemoryRecord updated = copy();
    updated.setAccessCount(accessCount + 1);
    updated.setLastAccessedAt(now);
    updated.setLastModifiedAt(now);
    if (incoming.getTags() != null) {
      updated.getTags().addAll(incoming.getTags());
    }
    if (incoming.getMetadata() != null) {
      incoming.getMetadata().forEach(updated.getMetadata()::putIfAbsent);
    }
    updated.setArchived(false);
    updated.setArchivedAt(null);
    return updated;
  }
}
