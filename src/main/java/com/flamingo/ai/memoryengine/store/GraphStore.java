package com.flamingo.ai.memoryengine.store;

import com.flamingo.ai.memoryengine.domain.model.GraphHit;
import com.flamingo.ai.memoryengine.domain.model.RelationEdge;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/** Entity/relation graph of the data store. */
public interface GraphStore {

  /**
   * Records that {@code recordId} mentions {@code entityNames}: upserts one node per entity, one
   * {@code MENTIONS} edge per entity and {@code CO_OCCURS} edges between every pair of entities.
   */
  void linkMentions(String recordId, String owner, Collection<String> entityNames, Instant now);

  void putRelation(RelationEdge edge);

  /** Moves the {@code MENTIONS} edges of a discarded record onto its survivor. */
  void relinkRecord(String owner, String fromRecordId, String toRecordId, Instant now);

  /**
   * Breadth-first expansion from the entities named in {@code seeds} over edges active at {@code
   * asOf}. Stops after {@code maxDepth} hops or once {@code limit} records are reached; each hop
   * expands at most {@code maxFrontier} entity nodes.
   *
   * @return records mentioned by visited entities, nearest first
   */
  List<GraphHit> traverse(
      Set<String> seeds,
      String owner,
      int maxDepth,
      int maxFrontier,
      int limit,
      Instant asOf);
}
