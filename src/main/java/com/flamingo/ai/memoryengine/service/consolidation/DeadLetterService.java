package com.flamingo.ai.memoryengine.service.consolidation;

import com.flamingo.ai.memoryengine.domain.entity.DeadLetterEntry;
import com.flamingo.ai.memoryengine.domain.enums.DeadLetterSubject;
import com.flamingo.ai.memoryengine.domain.repository.DeadLetterRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Failure counting and the dead-letter set. Subjects that keep failing are parked here for manual
 * inspection instead of being retried on every tick.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeadLetterService {

  private final DeadLetterRepository deadLetterRepository;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /**
   * Counts a failure of {@code subjectId}.
   *
   * @return true if this failure moved the subject into the dead-letter set
   */
  @Transactional
  public boolean recordFailure(
      DeadLetterSubject subjectType, String subjectId, Throwable error, int retryBudget) {
    Instant now = clock.instant();
    DeadLetterEntry entry =
        deadLetterRepository
            .findBySubjectTypeAndSubjectId(subjectType, subjectId)
            .orElseGet(
                () ->
                    DeadLetterEntry.builder()
                        .subjectType(subjectType)
                        .subjectId(subjectId)
                        .firstFailedAt(now)
                        .build());
    boolean deadLettered = entry.recordFailure(describe(error), retryBudget, now);
    deadLetterRepository.save(entry);
    if (deadLettered) {
      meterRegistry
          .counter("consolidation.deadlettered", "subject", subjectType.name())
          .increment();
      log.error(
          "Dead-lettered {} {} after {} failures, last error: {}",
          subjectType,
          subjectId,
          entry.getFailureCount(),
          entry.getLastError());
    }
    return deadLettered;
  }

  @Transactional(readOnly = true)
  public boolean isDeadLettered(DeadLetterSubject subjectType, String subjectId) {
    return deadLetterRepository.existsBySubjectTypeAndSubjectIdAndDeadLetteredTrue(
        subjectType, subjectId);
  }

  /** Forgets earlier failures of a subject that has since succeeded. */
  @Transactional
  public void clear(DeadLetterSubject subjectType, String subjectId) {
    deadLetterRepository
        .findBySubjectTypeAndSubjectId(subjectType, subjectId)
        .filter(entry -> !entry.isDeadLettered())
        .ifPresent(deadLetterRepository::delete);
  }

  @Transactional(readOnly = true)
  public List<DeadLetterEntry> listDeadLettered() {
    return deadLetterRepository.findByDeadLetteredTrueOrderByDeadLetteredAtDesc();
  }

  /** Removes a subject from the dead-letter set so the next tick processes it again. */
  @Transactional
  public void release(DeadLetterSubject subjectType, String subjectId) {
    deadLetterRepository.deleteBySubjectTypeAndSubjectId(subjectType, subjectId);
    log.info("Released {} {} from the dead-letter set", subjectType, subjectId);
  }

  private static String describe(Throwable error) {
    return error.getClass().getSimpleName() + ": " + error.getMessage();
  }
}
