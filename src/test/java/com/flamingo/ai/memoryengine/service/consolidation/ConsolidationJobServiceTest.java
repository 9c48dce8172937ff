package com.flamingo.ai.memoryengine.service.consolidation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.entity.ConsolidationJob;
import com.flamingo.ai.memoryengine.domain.enums.ConsolidationTrigger;
import com.flamingo.ai.memoryengine.domain.enums.DeadLetterSubject;
import com.flamingo.ai.memoryengine.domain.enums.JobStatus;
import com.flamingo.ai.memoryengine.domain.enums.MemoryTier;
import com.flamingo.ai.memoryengine.domain.repository.ConsolidationJobRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ConsolidationJobServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Mock private ConsolidationJobRepository jobRepository;
  @Mock private DeadLetterService deadLetterService;

  private ConsolidationJobService jobService;

  @BeforeEach
  void setUp() {
    jobService =
        new ConsolidationJobService(
            jobRepository,
            deadLetterService,
            new MemoryEngineConfig(),
            Clock.fixed(NOW, ZoneOffset.UTC));
    when(jobRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));
  }

  private ConsolidationJob failedJob(String cursor) {
    ConsolidationJob job =
        ConsolidationJob.builder()
            .id(UUID.randomUUID())
            .tier(MemoryTier.WORKING)
            .trigger(ConsolidationTrigger.SCHEDULED)
            .cursor(cursor)
            .createdAt(NOW.minusSeconds(600))
            .build();
    job.fail("boom", NOW.minusSeconds(300));
    return job;
  }

  @Test
  @DisplayName("should create and start a job when the tier has none unfinished")
  void shouldCreateJob() {
    when(jobRepository.findFirstByTierAndStatusInOrderByCreatedAtDesc(
            eq(MemoryTier.WORKING), any()))
        .thenReturn(Optional.empty());

    ConsolidationJob job =
        jobService.open(MemoryTier.WORKING, ConsolidationTrigger.MANUAL).orElseThrow();

    assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
    assertThat(job.getTrigger()).isEqualTo(ConsolidationTrigger.MANUAL);
    assertThat(job.getCursor()).isNull();
    assertThat(job.getStartedAt()).isEqualTo(NOW);
  }

  @Test
  @DisplayName("should resume a failed job from its cursor")
  void shouldResumeFailedJob() {
    ConsolidationJob failed = failedJob("rec-42");
    when(jobRepository.findFirstByTierAndStatusInOrderByCreatedAtDesc(
            eq(MemoryTier.WORKING), any()))
        .thenReturn(Optional.of(failed));

    ConsolidationJob job =
        jobService.open(MemoryTier.WORKING, ConsolidationTrigger.SCHEDULED).orElseThrow();

    assertThat(job).isSameAs(failed);
    assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
    assertThat(job.getCursor()).isEqualTo("rec-42");
    assertThat(job.getErrorDetail()).isNull();
  }

  @Test
  @DisplayName("should leave a tier alone while its job is dead-lettered")
  void shouldBlockDeadLetteredTier() {
    ConsolidationJob failed = failedJob("rec-42");
    when(jobRepository.findFirstByTierAndStatusInOrderByCreatedAtDesc(
            eq(MemoryTier.WORKING), any()))
        .thenReturn(Optional.of(failed));
    when(deadLetterService.isDeadLettered(DeadLetterSubject.JOB, failed.getId().toString()))
        .thenReturn(true);

    assertThat(jobService.open(MemoryTier.WORKING, ConsolidationTrigger.SCHEDULED)).isEmpty();
  }

  @Test
  @DisplayName("should keep the cursor and count the failure when a run fails")
  void shouldRecordJobFailure() {
    ConsolidationJob job = failedJob("rec-7");
    job.start(NOW);
    when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));
    RuntimeException error = new IllegalStateException("index closed");

    ConsolidationJob failed = jobService.fail(job.getId(), error);

    assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(failed.getAttempts()).isEqualTo(2);
    assertThat(failed.getCursor()).isEqualTo("rec-7");
    assertThat(failed.getErrorDetail()).isEqualTo("IllegalStateException: index closed");
    verify(deadLetterService)
        .recordFailure(DeadLetterSubject.JOB, job.getId().toString(), error, 3);
  }

  @Test
  @DisplayName("should accumulate progress across pages")
  void shouldAdvance() {
    ConsolidationJob job = failedJob(null);
    when(jobRepository.findById(job.getId())).thenReturn(Optional.of(job));

    jobService.advance(job.getId(), "rec-1", 10, 1);
    ConsolidationJob advanced = jobService.advance(job.getId(), "rec-2", 5, 0);
    ConsolidationJob done = jobService.complete(job.getId());

    assertThat(advanced.getCursor()).isEqualTo("rec-2");
    assertThat(advanced.getProcessedCount()).isEqualTo(15);
    assertThat(advanced.getFailedCount()).isEqualTo(1);
    assertThat(done.getStatus()).isEqualTo(JobStatus.DONE);
    assertThat(done.getFinishedAt()).isEqualTo(NOW);
  }
}
