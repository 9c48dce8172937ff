package com.flamingo.ai.memoryengine.service.lifecycle;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.enums.MemoryTier;
import com.flamingo.ai.memoryengine.domain.model.IngestRequest;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.domain.model.MergePlan;
import com.flamingo.ai.memoryengine.domain.model.ScoreResult;
import com.flamingo.ai.memoryengine.domain.model.SearchFilters;
import com.flamingo.ai.memoryengine.domain.model.SearchRequest;
import com.flamingo.ai.memoryengine.domain.model.SearchResult;
import com.flamingo.ai.memoryengine.domain.model.UpsertOutcome;
import com.flamingo.ai.memoryengine.domain.model.VersionedRecord;
import com.flamingo.ai.memoryengine.event.MemoryIngestedEvent;
import com.flamingo.ai.memoryengine.event.TierFillThresholdEvent;
import com.flamingo.ai.memoryengine.exception.CorruptedStateException;
import com.flamingo.ai.memoryengine.exception.DimensionMismatchException;
import com.flamingo.ai.memoryengine.exception.InvalidRecordStateException;
import com.flamingo.ai.memoryengine.exception.MemoryEngineException;
import com.flamingo.ai.memoryengine.exception.MemoryNotFoundException;
import com.flamingo.ai.memoryengine.exception.UpstreamUnavailableException;
import com.flamingo.ai.memoryengine.exception.ValidationException;
import com.flamingo.ai.memoryengine.service.dedup.ContentHasher;
import com.flamingo.ai.memoryengine.service.dedup.DeduplicationEngine;
import com.flamingo.ai.memoryengine.service.retrieval.HybridRetriever;
import com.flamingo.ai.memoryengine.service.scoring.ScoringEngine;
import com.flamingo.ai.memoryengine.store.GraphStore;
import com.flamingo.ai.memoryengine.store.MemoryStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/** Implementation of {@link LifecycleCoordinator}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LifecycleCoordinatorImpl implements LifecycleCoordinator {

  /** Compare-and-set attempts per mutation before giving up on a contended record. */
  static final int MAX_CAS_ATTEMPTS = 8;

  static final String CONSOLIDATED_FROM = "consolidatedFrom";
  static final String CONSOLIDATED_INTO = "consolidatedInto";

  private final MemoryStore memoryStore;
  private final GraphStore graphStore;
  private final ScoringEngine scoringEngine;
  private final DeduplicationEngine deduplicationEngine;
  private final HybridRetriever hybridRetriever;
  private final RecordLockRegistry recordLocks;
  private final MemoryEngineConfig config;
  private final ApplicationEventPublisher eventPublisher;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  private final AtomicLong workingCreatedSinceTrigger = new AtomicLong();

  @Override
  @Timed(value = "memory.ingest", description = "Time to ingest a memory")
  public UpsertOutcome ingest(IngestRequest request) {
    validate(request);
    Instant now = clock.instant();
    MemoryRecord candidate = newWorkingRecord(request, now);
    String id = candidate.getId();

    // the lock of id is released before any survivor lock is taken; merge orders its pair
    UpsertOutcome upserted =
        recordLocks.withLock(
            id,
            () ->
                deduplicationEngine.resolveAlias(id).equals(id)
                    ? memoryStore.upsertByContentKey(candidate, now)
                    : null);
    UpsertOutcome outcome = upserted != null ? upserted : reingestIntoSurvivor(candidate, now);

    if (outcome.created()) {
      meterRegistry.counter("memory.ingest.count", "outcome", "created").increment();
      log.debug("Created memory {} for owner {}", outcome.recordId(), candidate.getOwner());
      eventPublisher.publishEvent(
          new MemoryIngestedEvent(
              outcome.recordId(), candidate.getOwner(), candidate.getContent()));
      countWorkingCreation();
    } else {
      meterRegistry.counter("memory.ingest.count", "outcome", "deduplicated").increment();
      log.debug(
          "Ingest of existing content counted on {} (accessCount={})",
          outcome.recordId(),
          outcome.accessCount());
    }
    return outcome;
  }

  /** Content that was merged away counts its access on the survivor its alias chain ends at. */
  private UpsertOutcome reingestIntoSurvivor(MemoryRecord candidate, Instant now) {
    String id = candidate.getId();
    for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
      String target = deduplicationEngine.resolveAlias(id);
      try {
        MemoryRecord survivor =
            mutate(target, current -> current.reingested(candidate, now)).record();
        return new UpsertOutcome(target, false, survivor.getAccessCount());
      } catch (MemoryNotFoundException e) {
        // survivor merged away in the meantime; follow the new alias
        log.debug("Survivor {} of {} disappeared (attempt {})", target, id, attempt);
      }
    }
    throw new CorruptedStateException(id, "alias chain does not end at a stored record");
  }

  @Override
  public String ingest(String content, String owner, Set<String> tags) {
    return ingest(IngestRequest.of(content, owner, tags)).recordId();
  }

  @Override
  public MemoryRecord get(String recordId) {
    String resolved = resolveId(recordId);
    MemoryRecord record =
        memoryStore
            .findById(resolved)
            .map(VersionedRecord::record)
            .orElseThrow(() -> new MemoryNotFoundException(recordId));
    verifyIntegrity(record);
    return record;
  }

  @Override
  public String resolveId(String recordId) {
    requireId(recordId);
    return deduplicationEngine.resolveAlias(recordId);
  }

  @Override
  public MemoryRecord promote(String recordId) {
    String resolved = resolveId(recordId);
    Instant now = clock.instant();
    MemoryRecord promoted =
        mutate(
                resolved,
                current -> {
                  if (current.isArchived()) {
                    throw new InvalidRecordStateException(
                        resolved, "archived records never promote");
                  }
                  MemoryTier next =
                      current
                          .getTier()
                          .next()
                          .orElseThrow(
                              () ->
                                  new InvalidRecordStateException(
                                      resolved, "already in the last tier " + current.getTier()));
                  if (!scoringEngine.shouldPromote(current, now)) {
                    throw new InvalidRecordStateException(
                        resolved,
                        "not eligible for promotion out of "
                            + current.getTier()
                            + " (dwell time or thresholds not met)");
                  }
                  return promoted(current, next, now);
                })
            .record();
    logPromotion(promoted);
    return promoted;
  }

  @Override
  public MemoryRecord archive(String recordId) {
    String resolved = resolveId(recordId);
    Instant now = clock.instant();
    Mutation mutation =
        mutate(resolved, current -> current.isArchived() ? null : archived(current, now));
    if (mutation.changed()) {
      meterRegistry.counter("memory.archived", "trigger", "explicit").increment();
      log.info("Archived memory {} on request", resolved);
    }
    return mutation.record();
  }

  @Override
  public SearchResult search(SearchRequest request) {
    SearchResult result = hybridRetriever.search(request);
    if (config.getRetrieval().isTouchOnRead() && !result.candidates().isEmpty()) {
      try {
        recordAccess(result.recordIds());
      } catch (MemoryEngineException e) {
        log.warn("Failed to record access for search results: {}", e.getMessage());
      }
    }
    return result;
  }

  @Override
  public SearchResult search(String query, SearchFilters filters, int limit) {
    return search(SearchRequest.of(query, filters, limit));
  }

  @Override
  public MemoryRecord rescore(String recordId, Instant now) {
    return mutate(
            recordId,
            current -> {
              ScoreResult score = scoringEngine.score(current, now);
              if (score.importance() == current.getImportance()
                  && score.decayWeight() == current.getDecayWeight()) {
                return null;
              }
              current.setImportance(score.importance());
              current.setDecayWeight(score.decayWeight());
              current.setLastModifiedAt(now);
              return current;
            })
        .record();
  }

  @Override
  public boolean promoteIfEligible(String recordId, Instant now) {
    Mutation mutation =
        mutate(
            recordId,
            current ->
                scoringEngine.shouldPromote(current, now)
                    ? promoted(current, current.getTier().next().orElseThrow(), now)
                    : null);
    if (mutation.changed()) {
      logPromotion(mutation.record());
    }
    return mutation.changed();
  }

  @Override
  public boolean archiveIfEligible(String recordId, Instant now) {
    Mutation mutation =
        mutate(
            recordId,
            current -> scoringEngine.shouldArchive(current, now) ? archived(current, now) : null);
    if (mutation.changed()) {
      meterRegistry.counter("memory.archived", "trigger", "decay").increment();
      log.info(
          "Archived memory {} (decayWeight={}, importance={})",
          recordId,
          String.format("%.4f", mutation.record().getDecayWeight()),
          String.format("%.2f", mutation.record().getImportance()));
    }
    return mutation.changed();
  }

  @Override
  @Timed(value = "memory.merge", description = "Time to merge two near-duplicate memories")
  public Optional<String> merge(String firstId, String secondId) {
    requireId(firstId);
    requireId(secondId);
    if (firstId.equals(secondId)) {
      throw new ValidationException("recordId", "cannot merge a record with itself: " + firstId);
    }
    Instant now = clock.instant();
    return recordLocks.withLocks(
        firstId,
        secondId,
        () -> {
          Optional<VersionedRecord> first = memoryStore.findById(firstId);
          Optional<VersionedRecord> second = memoryStore.findById(secondId);
          if (first.isEmpty() || second.isEmpty()) {
            log.debug("Skipping merge of {} and {}: one of them is gone", firstId, secondId);
            return Optional.empty();
          }
          if (first.get().record().isArchived() || second.get().record().isArchived()) {
            log.debug("Skipping merge of {} and {}: archived", firstId, secondId);
            return Optional.empty();
          }
          MergePlan plan =
              deduplicationEngine.planMerge(first.get().record(), second.get().record(), now);
          MemoryRecord survivor = plan.survivor();
          VersionedRecord survivorVersion =
              survivor.getId().equals(firstId) ? first.get() : second.get();
          if (!memoryStore.compareAndSet(survivorVersion, survivor)) {
            log.debug("Skipping merge into {}: written concurrently", survivor.getId());
            return Optional.empty();
          }
          // tombstone before delete so the discarded id always resolves
          memoryStore.putAlias(plan.discardedId(), survivor.getId());
          try {
            graphStore.relinkRecord(
                survivor.getOwner(), plan.discardedId(), survivor.getId(), now);
          } catch (MemoryEngineException e) {
            log.warn(
                "Failed to move graph mentions from {} to {}: {}",
                plan.discardedId(),
                survivor.getId(),
                e.getMessage());
          }
          memoryStore.delete(plan.discardedId());
          meterRegistry.counter("memory.merged").increment();
          log.info(
              "Merged memory {} into {} (tags={}, accessCount={})",
              plan.discardedId(),
              survivor.getId(),
              survivor.getTags().size(),
              survivor.getAccessCount());
          return Optional.of(survivor.getId());
        });
  }

  @Override
  public void attachEmbedding(String recordId, float[] embedding) {
    int expected = config.getEmbedding().getDimensions();
    if (embedding == null || embedding.length != expected) {
      throw new DimensionMismatchException(expected, embedding == null ? 0 : embedding.length);
    }
    String resolved = resolveId(recordId);
    Instant now = clock.instant();
    mutate(
        resolved,
        current -> {
          // a survivor keeps its own embedding; only a missing one is taken over
          if (!resolved.equals(recordId) && current.hasEmbedding()) {
            return null;
          }
          current.setEmbedding(embedding.clone());
          current.setLastModifiedAt(now);
          return current;
        });
  }

  @Override
  public boolean attachSummary(String recordId, String summary) {
    if (summary == null || summary.isBlank()) {
      throw new ValidationException("summary", "must not be blank");
    }
    Instant now = clock.instant();
    return mutate(
            recordId,
            current -> {
              if (current.getSummary() != null) {
                return null;
              }
              current.setSummary(summary.trim());
              current.setLastModifiedAt(now);
              return current;
            })
        .changed();
  }

  @Override
  public Optional<String> consolidateGroup(List<String> recordIds, String summary) {
    if (recordIds == null || recordIds.size() < 2) {
      throw new ValidationException("recordIds", "a group needs at least two records");
    }
    if (summary == null || summary.isBlank()) {
      throw new ValidationException("summary", "must not be blank");
    }
    List<MemoryRecord> members =
        memoryStore.findAllById(new TreeSet<>(recordIds)).stream()
            .filter(record -> !record.isArchived())
            .toList();
    if (members.size() < 2) {
      log.debug("Skipping group consolidation: only {} active member(s)", members.size());
      return Optional.empty();
    }
    String owner = members.get(0).getOwner();
    if (members.stream().anyMatch(record -> !owner.equals(record.getOwner()))) {
      throw new ValidationException("recordIds", "group members must share one owner");
    }

    Instant now = clock.instant();
    MemoryRecord consolidated = consolidatedRecord(owner, summary.trim(), members, now);
    UpsertOutcome outcome =
        recordLocks.withLock(
            consolidated.getId(), () -> memoryStore.upsertByContentKey(consolidated, now));
    if (outcome.created()) {
      eventPublisher.publishEvent(
          new MemoryIngestedEvent(outcome.recordId(), owner, consolidated.getContent()));
    }

    int archived = 0;
    for (MemoryRecord member : members) {
      try {
        Mutation mutation =
            mutate(
                member.getId(),
                current -> {
                  if (current.isArchived()) {
                    return null;
                  }
                  MemoryRecord updated = archived(current, now);
                  updated.getMetadata().put(CONSOLIDATED_INTO, outcome.recordId());
                  return updated;
                });
        if (mutation.changed()) {
          archived++;
        }
      } catch (MemoryNotFoundException e) {
        log.debug("Group member {} disappeared before archival", member.getId());
      }
    }
    meterRegistry.counter("memory.grouped").increment();
    log.info(
        "Consolidated {} memories of owner {} into {} ({} archived)",
        members.size(),
        owner,
        outcome.recordId(),
        archived);
    return Optional.of(outcome.recordId());
  }

  @Override
  public void recordAccess(Collection<String> recordIds) {
    Instant now = clock.instant();
    for (String recordId : recordIds) {
      try {
        mutate(
            recordId,
            current -> {
              current.setAccessCount(current.getAccessCount() + 1);
              current.setLastAccessedAt(now);
              current.setImportance(
                  scoringEngine.effectiveImportance(
                      current.getBaseImportance(), current.getAccessCount()));
              return current;
            });
      } catch (MemoryNotFoundException e) {
        log.debug("Skipping access on {}: record is gone", recordId);
      } catch (CorruptedStateException e) {
        log.warn("Skipping access on {}: {}", recordId, e.getMessage());
      }
    }
  }

  /**
   * Read-modify-write of one record under its lock, committed with compare-and-set. {@code change}
   * receives a private copy and returns the record to write, or null to leave the record as is.
   * Corrupted records are reported, never rewritten.
   * A version conflict (a writer in another process) re-reads and re-applies the change.
   */
  private Mutation mutate(String recordId, UnaryOperator<MemoryRecord> change) {
    return recordLocks.withLock(
        recordId,
        () -> {
          for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            VersionedRecord current =
                memoryStore
                    .findById(recordId)
                    .orElseThrow(() -> new MemoryNotFoundException(recordId));
            verifyIntegrity(current.record());
            MemoryRecord updated = change.apply(current.record().copy());
            if (updated == null) {
              return new Mutation(current.record(), false);
            }
            if (memoryStore.compareAndSet(current, updated)) {
              return new Mutation(updated, true);
            }
            log.debug("Version conflict on {} (attempt {})", recordId, attempt);
          }
          throw new UpstreamUnavailableException(
              "memoryStore",
              "record " + recordId + " still contended after " + MAX_CAS_ATTEMPTS + " attempts");
        });
  }

  private record Mutation(MemoryRecord record, boolean changed) {}

  private MemoryRecord newWorkingRecord(IngestRequest request, Instant now) {
    String contentHash = ContentHasher.sha256Hex(request.content());
    double baseImportance =
        request.importance() != null
            ? request.importance()
            : config.getIngest().getDefaultImportance();
    MemoryRecord record =
        MemoryRecord.builder()
            .id(ContentHasher.recordId(request.owner(), contentHash))
            .owner(request.owner())
            .content(request.content())
            .contentHash(contentHash)
            .tier(MemoryTier.WORKING)
            .baseImportance(baseImportance)
            .accessCount(1)
            .createdAt(now)
            .lastAccessedAt(now)
            .lastModifiedAt(now)
            .tierEnteredAt(now)
            .tags(request.tags() != null ? new TreeSet<>(request.tags()) : new TreeSet<>())
            .metadata(
                request.metadata() != null ? new TreeMap<>(request.metadata()) : new TreeMap<>())
            .build();
    return withScores(record, now);
  }

  private MemoryRecord consolidatedRecord(
      String owner, String summary, List<MemoryRecord> members, Instant now) {
    String contentHash = ContentHasher.sha256Hex(summary);
    TreeSet<String> tags = new TreeSet<>();
    Map<String, String> metadata = new TreeMap<>();
    List<String> memberIds = new ArrayList<>();
    for (MemoryRecord member : members) {
      tags.addAll(member.getTags());
      member.getMetadata().forEach(metadata::putIfAbsent);
      memberIds.add(member.getId());
    }
    metadata.remove(CONSOLIDATED_INTO);
    metadata.put(CONSOLIDATED_FROM, String.join(",", new TreeSet<>(memberIds)));
    MemoryRecord record =
        MemoryRecord.builder()
            .id(ContentHasher.recordId(owner, contentHash))
            .owner(owner)
            .content(summary)
            .contentHash(contentHash)
            .summary(summary)
            .tier(MemoryTier.LONG_TERM)
            .baseImportance(
                members.stream().mapToDouble(MemoryRecord::getBaseImportance).max().orElse(0.0))
            .accessCount(members.stream().mapToLong(MemoryRecord::getAccessCount).sum())
            .createdAt(now)
            .lastAccessedAt(now)
            .lastModifiedAt(now)
            .tierEnteredAt(now)
            .tags(tags)
            .metadata(metadata)
            .build();
    return withScores(record, now);
  }

  private MemoryRecord promoted(MemoryRecord record, MemoryTier next, Instant now) {
    record.setTier(next);
    record.setTierEnteredAt(now);
    record.setLastModifiedAt(now);
    return withScores(record, now);
  }

  private static MemoryRecord archived(MemoryRecord record, Instant now) {
    record.setArchived(true);
    record.setArchivedAt(now);
    record.setLastModifiedAt(now);
    return record;
  }

  private MemoryRecord withScores(MemoryRecord record, Instant now) {
    ScoreResult score = scoringEngine.score(record, now);
    record.setImportance(score.importance());
    record.setDecayWeight(score.decayWeight());
    return record;
  }

  private void logPromotion(MemoryRecord record) {
    meterRegistry.counter("memory.promoted", "tier", record.getTier().name()).increment();
    log.info(
        "Promoted memory {} to {} (importance={}, accessCount={})",
        record.getId(),
        record.getTier(),
        String.format("%.2f", record.getImportance()),
        record.getAccessCount());
  }

  private void countWorkingCreation() {
    int threshold = config.getIngest().getFillTriggerThreshold();
    if (threshold <= 0) {
      return;
    }
    long created = workingCreatedSinceTrigger.incrementAndGet();
    if (created >= threshold && workingCreatedSinceTrigger.compareAndSet(created, 0)) {
      log.info("{} new WORKING memories since last fill trigger, requesting a tick", created);
      eventPublisher.publishEvent(new TierFillThresholdEvent(MemoryTier.WORKING, created));
    }
  }

  private void validate(IngestRequest request) {
    if (request == null) {
      throw new ValidationException("request", "must not be null");
    }
    if (request.content() == null || request.content().isBlank()) {
      throw new ValidationException("content", "must not be blank");
    }
    int maxLength = config.getIngest().getMaxContentLength();
    if (request.content().length() > maxLength) {
      throw new ValidationException(
          "content",
          "length " + request.content().length() + " exceeds maximum of " + maxLength);
    }
    if (request.owner() == null || request.owner().isBlank()) {
      throw new ValidationException("owner", "must not be blank");
    }
    if (request.importance() != null) {
      double importance = request.importance();
      if (Double.isNaN(importance) || importance < 0.0 || importance > 1.0) {
        throw new ValidationException("importance", "must be between 0.0 and 1.0");
      }
    }
    if (request.tags() != null
        && request.tags().stream().anyMatch(tag -> tag == null || tag.isBlank())) {
      throw new ValidationException("tags", "must not contain blank tags");
    }
  }

  private static void requireId(String recordId) {
    if (recordId == null || recordId.isBlank()) {
      throw new ValidationException("recordId", "must not be blank");
    }
  }

  /** Stored state is surfaced as corrupted rather than repaired. */
  private static void verifyIntegrity(MemoryRecord record) {
    if (record.getCreatedAt() == null
        || record.getLastAccessedAt() == null
        || record.getTierEnteredAt() == null) {
      throw new CorruptedStateException(record.getId(), "missing timestamp");
    }
    record
        .malformedNumericField()
        .ifPresent(
            field -> {
              throw new CorruptedStateException(record.getId(), "missing or malformed " + field);
            });
    if (record.getContent() == null
        || !ContentHasher.sha256Hex(record.getContent()).equals(record.getContentHash())) {
      throw new CorruptedStateException(record.getId(), "content does not match its hash");
    }
  }
}
