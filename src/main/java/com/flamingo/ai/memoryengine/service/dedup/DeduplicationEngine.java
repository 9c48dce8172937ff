package com.flamingo.ai.memoryengine.service.dedup;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.domain.model.MergePlan;
import com.flamingo.ai.memoryengine.domain.model.ScoredRecord;
import com.flamingo.ai.memoryengine.domain.model.SearchFilters;
import com.flamingo.ai.memoryengine.domain.model.SimilarityMatch;
import com.flamingo.ai.memoryengine.exception.CorruptedStateException;
import com.flamingo.ai.memoryengine.exception.ValidationException;
import com.flamingo.ai.memoryengine.store.MemoryStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Exact and near-duplicate detection plus the deterministic merge policy.
 *
 * <p>The exact path is a key lookup: the record identifier is derived from {@code (owner,
 * contentHash)}, so there is no separate hash index to keep consistent. The semantic path runs in
 * background consolidation only.
 */
@Component
@Slf4j
public class DeduplicationEngine {

  /** Upper bound on alias hops; a longer chain can only be a cycle or corruption. */
  static final int MAX_ALIAS_HOPS = 32;

  private static final Comparator<SimilarityMatch> BY_SIMILARITY =
      Comparator.comparingDouble(SimilarityMatch::similarity)
          .reversed()
          .thenComparing(SimilarityMatch::recordId);

  /** Survivor first: higher importance, more accesses, older, smaller identifier. */
  private static final Comparator<MemoryRecord> SURVIVOR_ORDER =
      Comparator.comparingDouble(MemoryRecord::getImportance)
          .reversed()
          .thenComparing(Comparator.comparingLong(MemoryRecord::getAccessCount).reversed())
          .thenComparing(
              MemoryRecord::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
          .thenComparing(MemoryRecord::getId);

  private final MemoryStore memoryStore;
  private final MemoryEngineConfig.Dedup dedup;

  public DeduplicationEngine(MemoryStore memoryStore, MemoryEngineConfig config) {
    this.memoryStore = memoryStore;
    this.dedup = config.getDedup();
  }

  /**
   * Looks up the record that already holds {@code contentHash} for {@code owner}, following merge
   * tombstones.
   *
   * @return the live record identifier, or empty if the content was never stored
   */
  public Optional<String> findExactDuplicate(String owner, String contentHash) {
    String resolved = resolveAlias(ContentHasher.recordId(owner, contentHash));
    return memoryStore.findById(resolved).map(versioned -> versioned.record().getId());
  }

  /**
   * Follows tombstones from {@code id} to the live survivor. Identifiers without a tombstone
   * resolve to themselves.
   *
   * @throws CorruptedStateException if the alias chain loops
   */
  public String resolveAlias(String id) {
    Set<String> seen = new LinkedHashSet<>();
    String current = id;
    while (seen.add(current)) {
      if (seen.size() > MAX_ALIAS_HOPS) {
        throw new CorruptedStateException(id, "alias chain longer than " + MAX_ALIAS_HOPS);
      }
      Optional<String> next = memoryStore.findAlias(current);
      if (next.isEmpty()) {
        return current;
      }
      current = next.get();
    }
    throw new CorruptedStateException(id, "alias cycle " + seen + " -> " + current);
  }

  /** Near duplicates of {@code probe} among the owner's active records, excluding itself. */
  public List<SimilarityMatch> findSemanticDuplicates(MemoryRecord probe, double threshold) {
    if (!probe.hasEmbedding()) {
      return List.of();
    }
    return findSemanticDuplicates(probe.getEmbedding(), probe.getOwner(), threshold, probe.getId());
  }

  /**
   * Records whose cosine similarity to {@code embedding} is at least {@code threshold}, most
   * similar first, ties by identifier. Similarity is recomputed locally from the stored vectors so
   * the threshold does not depend on how the index reports scores.
   *
   * @param excludeId identifier to leave out, may be null
   * @throws com.flamingo.ai.memoryengine.exception.DimensionMismatchException if a stored
   *     embedding differs in length from {@code embedding}
   */
  public List<SimilarityMatch> findSemanticDuplicates(
      float[] embedding, String owner, double threshold, String excludeId) {
    List<ScoredRecord> neighbours =
        memoryStore.vectorTopK(
            embedding, SearchFilters.forOwner(owner), dedup.getCandidateLimit() + 1);
    List<SimilarityMatch> matches = new ArrayList<>();
    for (ScoredRecord neighbour : neighbours) {
      MemoryRecord candidate = neighbour.record();
      if (candidate.getId().equals(excludeId) || !candidate.hasEmbedding()) {
        continue;
      }
      double similarity = VectorMath.cosine(embedding, candidate.getEmbedding());
      if (similarity >= threshold) {
        matches.add(new SimilarityMatch(candidate.getId(), similarity));
      }
    }
    matches.sort(BY_SIMILARITY);
    return matches;
  }

  /**
   * Resolves two near-duplicates. The survivor keeps its identifier, content and scores; it gains
   * the other's tags, the other's metadata keys it does not have, the summed access count, the
   * later last-access time and the more advanced tier.
   */
  public MergePlan planMerge(MemoryRecord a, MemoryRecord b, Instant now) {
    if (a.getId().equals(b.getId())) {
      throw new ValidationException("recordId", "cannot merge a record with itself: " + a.getId());
    }
    if (!a.getOwner().equals(b.getOwner())) {
      throw new ValidationException("owner", "cannot merge records of different owners");
    }
    MemoryRecord survivor = SURVIVOR_ORDER.compare(a, b) <= 0 ? a : b;
    MemoryRecord discarded = survivor == a ? b : a;

    MemoryRecord merged = survivor.copy();
    merged.getTags().addAll(discarded.getTags());
    discarded.getMetadata().forEach(merged.getMetadata()::putIfAbsent);
    merged.setAccessCount(survivor.getAccessCount() + discarded.getAccessCount());
    merged.setLastAccessedAt(latest(survivor.getLastAccessedAt(), discarded.getLastAccessedAt()));
    merged.setLastModifiedAt(now);
    if (merged.getSummary() == null) {
      merged.setSummary(discarded.getSummary());
    }
    if (!merged.hasEmbedding() && discarded.hasEmbedding()) {
      merged.setEmbedding(discarded.getEmbedding().clone());
    }
    if (survivor.getTier().precedes(discarded.getTier())) {
      merged.setTier(discarded.getTier());
      merged.setTierEnteredAt(discarded.getTierEnteredAt());
    }
    log.debug("Merge plan: {} survives, {} discarded", survivor.getId(), discarded.getId());
    return new MergePlan(merged, discarded.getId());
  }

  private static Instant latest(Instant a, Instant b) {
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    return a.isAfter(b) ? a : b;
  }
}
