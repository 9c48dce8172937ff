package com.flamingo.ai.memoryengine.store;

import com.flamingo.ai.memoryengine.domain.enums.MemoryTier;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.domain.model.RecordPage;
import com.flamingo.ai.memoryengine.domain.model.ScoredRecord;
import com.flamingo.ai.memoryengine.domain.model.SearchFilters;
import com.flamingo.ai.memoryengine.domain.model.UpsertOutcome;
import com.flamingo.ai.memoryengine.domain.model.VersionedRecord;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Logical operations the engine issues against the document, vector and keyword indexes of the
 * data store. Every implementation must provide atomic create-if-absent and compare-and-set
 * writes; in-process locks alone cannot span several engine instances.
 *
 * <p>Failures are reported as {@link
 * com.flamingo.ai.memoryengine.exception.UpstreamUnavailableException}. No method may turn a
 * failure into an empty result.
 */
public interface MemoryStore {

  /**
   * Inserts {@code candidate} if no record with the same identifier exists, otherwise counts an
   * access on the existing record: increments the access count, sets last-accessed and
   * last-modified to {@code now}, adds the candidate's tags and clears the archived flag.
   *
   * <p>The identifier is derived from {@code (owner, contentHash)}, so concurrent calls with the
   * same content converge to one record whose access count reflects every call.
   */
  UpsertOutcome upsertByContentKey(MemoryRecord candidate, Instant now);

  Optional<VersionedRecord> findById(String id);

  /** Multi-get; unknown identifiers are omitted, order is not significant. */
  List<MemoryRecord> findAllById(Collection<String> ids);

  /**
   * Replaces the record read as {@code expected} with {@code updated} if nobody has written it
   * since.
   *
   * @return false on a version conflict, in which case nothing was written
   */
  boolean compareAndSet(VersionedRecord expected, MemoryRecord updated);

  /** Deletes a record; deleting an unknown identifier is a no-op. */
  void delete(String id);

  /**
   * Returns the next page of non-archived records of a tier, ordered by identifier.
   *
   * @param cursor identifier after which to resume, or null to start at the beginning
   */
  RecordPage scan(MemoryTier tier, String cursor, int pageSize);

  /** Nearest neighbours of {@code embedding}, best first, restricted by {@code filters}. */
  List<ScoredRecord> vectorTopK(float[] embedding, SearchFilters filters, int k);

  /** Full-text matches of {@code query}, best first, restricted by {@code filters}. */
  List<ScoredRecord> keywordTopK(String query, SearchFilters filters, int k);

  /** Stores the tombstone {@code discardedId -> survivorId}. */
  void putAlias(String discardedId, String survivorId);

  /** Returns the survivor a discarded identifier was tombstoned to, if any. */
  Optional<String> findAlias(String id);
}
