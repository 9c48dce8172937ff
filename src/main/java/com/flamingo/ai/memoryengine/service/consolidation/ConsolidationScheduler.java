package com.flamingo.ai.memoryengine.service.consolidation;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.entity.ConsolidationJob;
import com.flamingo.ai.memoryengine.domain.enums.ConsolidationTrigger;
import com.flamingo.ai.memoryengine.domain.enums.DeadLetterSubject;
import com.flamingo.ai.memoryengine.domain.enums.MemoryTier;
import com.flamingo.ai.memoryengine.domain.model.ConsolidationReport;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.domain.model.RecordPage;
import com.flamingo.ai.memoryengine.domain.model.SimilarityMatch;
import com.flamingo.ai.memoryengine.event.TierFillThresholdEvent;
import com.flamingo.ai.memoryengine.exception.MemoryNotFoundException;
import com.flamingo.ai.memoryengine.service.dedup.DeduplicationEngine;
import com.flamingo.ai.memoryengine.service.lifecycle.LifecycleCoordinator;
import com.flamingo.ai.memoryengine.service.lifecycle.MemoryEnrichmentService;
import com.flamingo.ai.memoryengine.service.llm.LanguageModelService;
import com.flamingo.ai.memoryengine.store.MemoryStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Background consolidation: re-scoring, archival, promotion, semantic merge, embedding backfill
 * and optional summarisation, tier by tier in bounded pages.
 *
 * <p>Each tier has one persisted job whose cursor advances after every page, so a crash resumes
 * mid-tier. A tick visits the tiers round-robin, one page per tier per round, until every job is
 * done or the page budget of the tick is spent; empty pages do not count against the budget.
 * Records of a page are processed concurrently, bounded by a fair semaphore; a failing record is
 * isolated, counted and dead-lettered once it exhausts its retry budget.
 *
 * <p>Only one tick runs at a time in this process. Scheduled and fill-threshold ticks are skipped
 * while another tick runs; a manual tick waits for it.
 */
@Service
@Slf4j
public class ConsolidationScheduler {

  private final MemoryStore memoryStore;
  private final LifecycleCoordinator lifecycleCoordinator;
  private final DeduplicationEngine deduplicationEngine;
  private final MemoryEnrichmentService enrichmentService;
  private final LanguageModelService languageModelService;
  private final GroupSummaryConsolidator groupSummaryConsolidator;
  private final ConsolidationJobService jobService;
  private final DeadLetterService deadLetterService;
  private final MemoryEngineConfig config;
  private final Executor consolidationExecutor;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  private final ReentrantLock tickLock = new ReentrantLock();
  private final Semaphore recordPermits;

  // guarded by tickLock
  private int ticks;

  public ConsolidationScheduler(
      MemoryStore memoryStore,
      LifecycleCoordinator lifecycleCoordinator,
      DeduplicationEngine deduplicationEngine,
      MemoryEnrichmentService enrichmentService,
      LanguageModelService languageModelService,
      GroupSummaryConsolidator groupSummaryConsolidator,
      ConsolidationJobService jobService,
      DeadLetterService deadLetterService,
      MemoryEngineConfig config,
      @Qualifier("consolidationExecutor") Executor consolidationExecutor,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.memoryStore = memoryStore;
    this.lifecycleCoordinator = lifecycleCoordinator;
    this.deduplicationEngine = deduplicationEngine;
    this.enrichmentService = enrichmentService;
    this.languageModelService = languageModelService;
    this.groupSummaryConsolidator = groupSummaryConsolidator;
    this.jobService = jobService;
    this.deadLetterService = deadLetterService;
    this.config = config;
    this.consolidationExecutor = consolidationExecutor;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.recordPermits = new Semaphore(config.getConsolidation().getMaxParallelism(), true);
  }

  @Scheduled(
      fixedDelayString = "${memory.consolidation.interval:PT10M}",
      initialDelayString = "${memory.consolidation.interval:PT10M}")
  public void scheduledTick() {
    if (!config.getConsolidation().isEnabled()) {
      return;
    }
    tryTick(ConsolidationTrigger.SCHEDULED);
  }

  /** Early tick requested by ingest when the WORKING tier filled up. */
  @Async("enrichmentExecutor")
  @EventListener
  public void onTierFillThreshold(TierFillThresholdEvent event) {
    if (!config.getConsolidation().isEnabled()) {
      return;
    }
    log.info("{} new memories in tier {}, running early tick", event.newRecords(), event.tier());
    tryTick(ConsolidationTrigger.FILL_THRESHOLD);
  }

  /**
   * Runs one consolidation tick and blocks until it finishes, waiting for a tick already in
   * progress first.
   */
  public ConsolidationReport runConsolidationTick() {
    tickLock.lock();
    try {
      return tick(ConsolidationTrigger.MANUAL);
    } finally {
      tickLock.unlock();
    }
  }

  private Optional<ConsolidationReport> tryTick(ConsolidationTrigger trigger) {
    if (!tickLock.tryLock()) {
      log.debug("Consolidation tick already running, skipping {} tick", trigger);
      return Optional.empty();
    }
    try {
      return Optional.of(tick(trigger));
    } catch (RuntimeException e) {
      log.error("Consolidation tick ({}) failed: {}", trigger, e.getMessage(), e);
      meterRegistry.counter("consolidation.tick.errors").increment();
      return Optional.empty();
    } finally {
      tickLock.unlock();
    }
  }

  private ConsolidationReport tick(ConsolidationTrigger trigger) {
    Timer.Sample sample = Timer.start(meterRegistry);
    MemoryEngineConfig.Consolidation settings = config.getConsolidation();
    Tally tally = new Tally();
    List<UUID> jobIds = new ArrayList<>();

    Map<MemoryTier, ConsolidationJob> active = new EnumMap<>(MemoryTier.class);
    for (MemoryTier tier : MemoryTier.values()) {
      jobService.open(tier, trigger).ifPresent(job -> active.put(tier, job));
    }
    active.values().forEach(job -> jobIds.add(job.getId()));

    List<MemoryTier> order = roundRobinOrder();
    int pages = 0;
    while (!active.isEmpty() && pages < settings.getMaxPagesPerTick()) {
      for (MemoryTier tier : order) {
        ConsolidationJob job = active.get(tier);
        if (job == null || pages >= settings.getMaxPagesPerTick()) {
          continue;
        }
        try {
          RecordPage page = memoryStore.scan(tier, job.getCursor(), settings.getBatchSize());
          if (!page.records().isEmpty()) {
            pages++;
          }
          PageResult result = processPage(page.records(), tally);
          if (tier == MemoryTier.SHORT_TERM && settings.getGrouping().isEnabled()) {
            tally.grouped.addAndGet(groupSummaryConsolidator.consolidate(page.records()));
          }
          String nextCursor = page.isLast() ? job.getCursor() : page.nextCursor();
          job = jobService.advance(job.getId(), nextCursor, result.processed(), result.failed());
          if (page.isLast()) {
            jobService.complete(job.getId());
            active.remove(tier);
          } else {
            active.put(tier, job);
          }
        } catch (RuntimeException e) {
          jobService.fail(job.getId(), e);
          active.remove(tier);
        }
      }
    }
    if (!active.isEmpty()) {
      log.info(
          "Page budget of {} spent, tiers {} resume next tick",
          settings.getMaxPagesPerTick(),
          active.keySet());
    }

    sample.stop(meterRegistry.timer("consolidation.tick", "trigger", trigger.name()));
    ConsolidationReport report = tally.toReport(jobIds, pages);
    publishMetrics(report);
    log.info(
        "Consolidation tick ({}) finished: pages={}, records={}, promoted={}, archived={}, "
            + "merged={}, failed={}, deadLettered={}",
        trigger,
        report.pagesProcessed(),
        report.recordsProcessed(),
        report.promoted(),
        report.archived(),
        report.merged(),
        report.failed(),
        report.deadLettered());
    return report;
  }

  /** Tiers in visiting order; each tick starts one tier later so a small page budget is shared. */
  private List<MemoryTier> roundRobinOrder() {
    MemoryTier[] tiers = MemoryTier.values();
    int offset = ticks++ % tiers.length;
    List<MemoryTier> order = new ArrayList<>(tiers.length);
    for (int i = 0; i < tiers.length; i++) {
      order.add(tiers[(offset + i) % tiers.length]);
    }
    return order;
  }

  /** Processes one page concurrently and waits for every record of it. */
  private PageResult processPage(List<MemoryRecord> records, Tally tally) {
    Instant now = clock.instant();
    AtomicInteger processed = new AtomicInteger();
    AtomicInteger failed = new AtomicInteger();
    List<CompletableFuture<Void>> futures = new ArrayList<>(records.size());
    for (MemoryRecord record : records) {
      try {
        recordPermits.acquire();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while waiting for a consolidation slot", e);
      }
      try {
        futures.add(
            CompletableFuture.runAsync(
                () -> {
                  try {
                    if (processRecord(record, now, tally)) {
                      processed.incrementAndGet();
                    } else {
                      failed.incrementAndGet();
                    }
                  } finally {
                    recordPermits.release();
                  }
                },
                consolidationExecutor));
      } catch (RejectedExecutionException e) {
        recordPermits.release();
        throw e;
      }
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
    return new PageResult(processed.get(), failed.get());
  }

  /**
   * Runs every consolidation step for one record. Failures are contained here.
   *
   * @return false if the record failed
   */
  private boolean processRecord(MemoryRecord record, Instant now, Tally tally) {
    String id = record.getId();
    if (deadLetterService.isDeadLettered(DeadLetterSubject.RECORD, id)) {
      log.debug("Skipping dead-lettered memory {}", id);
      return true;
    }
    try {
      tally.records.incrementAndGet();
      MemoryRecord current = lifecycleCoordinator.rescore(id, now);
      tally.rescored.incrementAndGet();
      if (lifecycleCoordinator.archiveIfEligible(id, now)) {
        tally.archived.incrementAndGet();
        deadLetterService.clear(DeadLetterSubject.RECORD, id);
        return true;
      }
      if (lifecycleCoordinator.promoteIfEligible(id, now)) {
        tally.promoted.incrementAndGet();
      }
      boolean survived = true;
      if (current.hasEmbedding()) {
        survived = mergeDuplicates(current, tally);
      } else {
        enrichmentService.enrich(id, current.getOwner(), current.getContent());
        tally.embeddingsBackfilled.incrementAndGet();
      }
      if (survived && needsSummary(current)) {
        String summary = languageModelService.summarize(List.of(current.getContent()));
        if (lifecycleCoordinator.attachSummary(id, summary)) {
          tally.summarized.incrementAndGet();
        }
      }
      deadLetterService.clear(DeadLetterSubject.RECORD, id);
      return true;
    } catch (MemoryNotFoundException e) {
      // merged away or deleted by a concurrent operation
      log.debug("Memory {} disappeared during consolidation", id);
      return true;
    } catch (RuntimeException e) {
      tally.failed.incrementAndGet();
      log.warn(
          "Consolidation of memory {} (tier={}, owner={}) failed: {}",
          id,
          record.getTier(),
          record.getOwner(),
          e.getMessage());
      if (deadLetterService.recordFailure(
          DeadLetterSubject.RECORD, id, e, config.getConsolidation().getRetryBudget())) {
        tally.deadLettered.incrementAndGet();
      }
      return false;
    }
  }

  /**
   * Merges {@code record} with its most similar near-duplicate, if any.
   *
   * @return false if {@code record} was the discarded side
   */
  private boolean mergeDuplicates(MemoryRecord record, Tally tally) {
    List<SimilarityMatch> duplicates =
        deduplicationEngine.findSemanticDuplicates(
            record, config.getDedup().getSimilarityThreshold());
    for (SimilarityMatch duplicate : duplicates) {
      Optional<String> survivor = lifecycleCoordinator.merge(record.getId(), duplicate.recordId());
      if (survivor.isPresent()) {
        tally.merged.incrementAndGet();
        return survivor.get().equals(record.getId());
      }
    }
    return true;
  }

  private boolean needsSummary(MemoryRecord record) {
    MemoryEngineConfig.Summary summary = config.getConsolidation().getSummary();
    return summary.isEnabled()
        && record.getSummary() == null
        && record.getContent().length() >= summary.getMinContentLength();
  }

  private void publishMetrics(ConsolidationReport report) {
    meterRegistry.counter("consolidation.records").increment(report.recordsProcessed());
    meterRegistry.counter("consolidation.rescored").increment(report.rescored());
    meterRegistry.counter("consolidation.promoted").increment(report.promoted());
    meterRegistry.counter("consolidation.archived").increment(report.archived());
    meterRegistry.counter("consolidation.merged").increment(report.merged());
    meterRegistry.counter("consolidation.summarized").increment(report.summarized());
    meterRegistry.counter("consolidation.grouped").increment(report.grouped());
    meterRegistry.counter("consolidation.failed").increment(report.failed());
  }

  private record PageResult(int processed, int failed) {}

  /** Counters shared by the workers of one tick. */
  private static final class Tally {
    private final AtomicInteger records = new AtomicInteger();
    private final AtomicInteger rescored = new AtomicInteger();
    private final AtomicInteger promoted = new AtomicInteger();
    private final AtomicInteger archived = new AtomicInteger();
    private final AtomicInteger merged = new AtomicInteger();
    private final AtomicInteger summarized = new AtomicInteger();
    private final AtomicInteger grouped = new AtomicInteger();
    private final AtomicInteger embeddingsBackfilled = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger deadLettered = new AtomicInteger();

    ConsolidationReport toReport(List<UUID> jobIds, int pages) {
      return ConsolidationReport.builder()
          .jobIds(List.copyOf(jobIds))
          .pagesProcessed(pages)
          .recordsProcessed(records.get())
          .rescored(rescored.get())
          .promoted(promoted.get())
          .archived(archived.get())
          .merged(merged.get())
          .summarized(summarized.get())
          .grouped(grouped.get())
          .embeddingsBackfilled(embeddingsBackfilled.get())
          .failed(failed.get())
          .deadLettered(deadLettered.get())
          .build();
    }
  }
}
