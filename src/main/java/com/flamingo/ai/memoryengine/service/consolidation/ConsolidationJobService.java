package com.flamingo.ai.memoryengine.service.consolidation;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.entity.ConsolidationJob;
import com.flamingo.ai.memoryengine.domain.enums.ConsolidationTrigger;
import com.flamingo.ai.memoryengine.domain.enums.DeadLetterSubject;
import com.flamingo.ai.memoryengine.domain.enums.JobStatus;
import com.flamingo.ai.memoryengine.domain.enums.MemoryTier;
import com.flamingo.ai.memoryengine.domain.repository.ConsolidationJobRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persistence of the per-tier job state machine PENDING, RUNNING, then DONE or FAILED. At most one
 * unfinished job exists per tier; it is resumed from its cursor until it completes or is
 * dead-lettered.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsolidationJobService {

  private static final EnumSet<JobStatus> RESUMABLE =
      EnumSet.of(JobStatus.PENDING, JobStatus.RUNNING, JobStatus.FAILED);

  private final ConsolidationJobRepository jobRepository;
  private final DeadLetterService deadLetterService;
  private final MemoryEngineConfig config;
  private final Clock clock;

  /**
   * Starts the job of {@code tier}: resumes its unfinished job, or creates a new one.
   *
   * @return the running job, or empty if the tier's unfinished job is dead-lettered
   */
  @Transactional
  public Optional<ConsolidationJob> open(MemoryTier tier, ConsolidationTrigger trigger) {
    Instant now = clock.instant();
    Optional<ConsolidationJob> unfinished =
        jobRepository.findFirstByTierAndStatusInOrderByCreatedAtDesc(tier, RESUMABLE);
    if (unfinished.isPresent()) {
      ConsolidationJob job = unfinished.get();
      if (deadLetterService.isDeadLettered(DeadLetterSubject.JOB, job.getId().toString())) {
        log.debug("Tier {} is blocked by dead-lettered job {}", tier, job.getId());
        return Optional.empty();
      }
      log.info(
          "Resuming {} consolidation job {} for tier {} at cursor {}",
          job.getStatus(),
          job.getId(),
          tier,
          job.getCursor());
      job.start(now);
      return Optional.of(jobRepository.save(job));
    }
    ConsolidationJob job =
        ConsolidationJob.builder().tier(tier).trigger(trigger).createdAt(now).build();
    job.start(now);
    job = jobRepository.save(job);
    log.debug("Started consolidation job {} for tier {} ({})", job.getId(), tier, trigger);
    return Optional.of(job);
  }

  /** Persists the cursor and counters after a page. */
  @Transactional
  public ConsolidationJob advance(UUID jobId, String nextCursor, int processed, int failed) {
    ConsolidationJob job = load(jobId);
    job.advance(nextCursor, processed, failed);
    return jobRepository.save(job);
  }

  @Transactional
  public ConsolidationJob complete(UUID jobId) {
    ConsolidationJob job = load(jobId);
    job.complete(clock.instant());
    log.info(
        "Consolidation job {} for tier {} done: processed={}, failed={}",
        jobId,
        job.getTier(),
        job.getProcessedCount(),
        job.getFailedCount());
    return jobRepository.save(job);
  }

  /**
   * Marks the job FAILED, keeping its cursor. After {@code consolidation.job-retry-budget} failed
   * runs the job is dead-lettered and its tier is skipped until the job is released.
   */
  @Transactional
  public ConsolidationJob fail(UUID jobId, Throwable error) {
    ConsolidationJob job = load(jobId);
    job.fail(error.getClass().getSimpleName() + ": " + error.getMessage(), clock.instant());
    log.error(
        "Consolidation job {} for tier {} failed at cursor {} (attempt {})",
        jobId,
        job.getTier(),
        job.getCursor(),
        job.getAttempts(),
        error);
    deadLetterService.recordFailure(
        DeadLetterSubject.JOB,
        jobId.toString(),
        error,
        config.getConsolidation().getJobRetryBudget());
    return jobRepository.save(job);
  }

  private ConsolidationJob load(UUID jobId) {
    return jobRepository
        .findById(jobId)
        .orElseThrow(() -> new IllegalStateException("Consolidation job not found: " + jobId));
  }
}
