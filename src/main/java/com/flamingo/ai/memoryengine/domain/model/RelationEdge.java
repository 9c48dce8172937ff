package com.flamingo.ai.memoryengine.domain.model;

import java.time.Instant;
import lombok.Builder;

/**
 * Typed, weighted, bi-temporal edge in the owner's knowledge graph.
 *
 * @param id edge identifier
 * @param owner owner the edge belongs to
 * @param sourceId source node identifier
 * @param targetId target node identifier (an entity, or a record for {@link #MENTIONS})
 * @param relationType relation label
 * @param weight edge weight (0.0 to 1.0)
 * @param validFrom when the fact started being true
 * @param validTo when the fact stopped being true, or null if still true
 * @param recordedAt when the fact was written
 */
@Builder
public record RelationEdge(
    String id,
    String owner,
    String sourceId,
    String targetId,
    String relationType,
    double weight,
    Instant validFrom,
    Instant validTo,
    Instant recordedAt) {

  /** Entity to record edge. */
  public static final String MENTIONS = "MENTIONS";

  /** Entity to entity edge for entities mentioned by the same record. */
  public static final String CO_OCCURS = "CO_OCCURS";

  /** Whether the edge is valid at {@code instant}. */
  public boolean isActiveAt(Instant instant) {
    return (validFrom == null || !instant.isBefore(validFrom))
        && (validTo == null || instant.isBefore(validTo));
  }
}
