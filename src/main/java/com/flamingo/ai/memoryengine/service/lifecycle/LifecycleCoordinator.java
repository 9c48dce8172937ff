package com.flamingo.ai.memoryengine.service.lifecycle;

import com.flamingo.ai.memoryengine.domain.model.IngestRequest;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.domain.model.SearchFilters;
import com.flamingo.ai.memoryengine.domain.model.SearchRequest;
import com.flamingo.ai.memoryengine.domain.model.SearchResult;
import com.flamingo.ai.memoryengine.domain.model.UpsertOutcome;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Facade over the memory lifecycle. Every mutation of a record goes through this interface, so the
 * upsert, merge and tombstone invariants have exactly one owner.
 *
 * <p>Writes to one record are serialized per identifier and committed with compare-and-set, so
 * reads may run concurrently and never observe a half-written record.
 */
public interface LifecycleCoordinator {

  /**
   * Stores a memory, or counts an access on the record that already holds the same content for the
   * same owner. Returns without waiting for embedding or entity extraction, which run in the
   * background.
   *
   * @param request content, owner and optional tags, metadata and importance
   * @return the record identifier and whether this call created it
   * @throws com.flamingo.ai.memoryengine.exception.ValidationException if the input is malformed
   */
  UpsertOutcome ingest(IngestRequest request);

  /**
   * Stores a memory with default importance.
   *
   * @param content the memory text
   * @param owner the owner/subject identifier
   * @param tags free-form tags, may be null
   * @return the record identifier
   */
  String ingest(String content, String owner, Set<String> tags);

  /**
   * Gets a record by identifier. Identifiers of merged-away records resolve to their survivor.
   *
   * @param recordId the record ID
   * @return the record
   * @throws com.flamingo.ai.memoryengine.exception.MemoryNotFoundException if unknown
   * @throws com.flamingo.ai.memoryengine.exception.CorruptedStateException if the stored record
   *     violates a timestamp or hash invariant
   */
  MemoryRecord get(String recordId);

  /** Follows merge tombstones from {@code recordId} to the live identifier. */
  String resolveId(String recordId);

  /**
   * Moves a record to the next tier.
   *
   * @param recordId the record ID
   * @return the promoted record
   * @throws com.flamingo.ai.memoryengine.exception.InvalidRecordStateException if the record is
   *     archived, already in the last tier, or not eligible yet
   */
  MemoryRecord promote(String recordId);

  /**
   * Archives a record regardless of its scores. Archiving an archived record is a no-op.
   *
   * @param recordId the record ID
   * @return the archived record
   */
  MemoryRecord archive(String recordId);

  /**
   * Hybrid search; counts an access on every returned record when touch-on-read is enabled.
   *
   * @param request query, filters, limit, token budget and deadline
   * @return ranked candidates, flagged partial if a signal failed
   */
  SearchResult search(SearchRequest request);

  SearchResult search(String query, SearchFilters filters, int limit);

  // Background operations used by enrichment and consolidation.

  /** Recomputes importance and decay weight; returns the record as stored afterwards. */
  MemoryRecord rescore(String recordId, Instant now);

  /** Promotes the record if the scoring rules allow it. */
  boolean promoteIfEligible(String recordId, Instant now);

  /** Archives the record if it decayed below the floor and was not accessed recently. */
  boolean archiveIfEligible(String recordId, Instant now);

  /**
   * Merges two near-duplicate records: the survivor absorbs the other, the other is tombstoned to
   * the survivor and deleted.
   *
   * @return the survivor identifier, or empty if either record is gone, archived or was written
   *     concurrently
   */
  Optional<String> merge(String firstId, String secondId);

  /**
   * Attaches an embedding computed from the record's content.
   *
   * @throws com.flamingo.ai.memoryengine.exception.DimensionMismatchException if the vector does
   *     not have the store-wide dimensionality
   */
  void attachEmbedding(String recordId, float[] embedding);

  /** Attaches a summary unless the record already has one. */
  boolean attachSummary(String recordId, String summary);

  /**
   * Replaces a group of similar records with one LONG_TERM record holding {@code summary}; the
   * members are archived and point at the new record through their metadata.
   *
   * @return identifier of the consolidated record, or empty if fewer than two members are active
   */
  Optional<String> consolidateGroup(List<String> recordIds, String summary);

  /** Counts one access on each record; unknown identifiers are skipped. */
  void recordAccess(Collection<String> recordIds);
}
