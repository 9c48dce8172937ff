package com.flamingo.ai.memoryengine.domain.entity;

import com.flamingo.ai.memoryengine.domain.enums.ConsolidationTrigger;
import com.flamingo.ai.memoryengine.domain.enums.JobStatus;
import com.flamingo.ai.memoryengine.domain.enums.MemoryTier;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A background pass over one tier. The cursor is persisted after every page so that a crashed or
 * failed run resumes where it stopped instead of restarting or skipping the tail of the tier.
 */
@Entity
@Table(name = "consolidation_jobs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConsolidationJob {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private MemoryTier tier;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private JobStatus status = JobStatus.PENDING;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private ConsolidationTrigger trigger;

  /** Identifier of the last record of the last completed page; null before the first page. */
  private String cursor;

  /** Number of runs that ended in FAILED. */
  @Builder.Default private int attempts = 0;

  @Builder.Default private long processedCount = 0;

  @Builder.Default private long failedCount = 0;

  @Column(columnDefinition = "TEXT")
  private String errorDetail;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  private Instant startedAt;

  private Instant finishedAt;

  /** Moves the job to RUNNING. */
  public void start(Instant now) {
    this.status = JobStatus.RUNNING;
    this.startedAt = now;
    this.errorDetail = null;
  }

  /** Persists progress after a page. */
  public void advance(String nextCursor, int processed, int failed) {
    this.cursor = nextCursor;
    this.processedCount += processed;
    this.failedCount += failed;
  }

  /** Marks the job as DONE. */
  public void complete(Instant now) {
    this.status = JobStatus.DONE;
    this.finishedAt = now;
  }

  /** Marks the job as FAILED, keeping the cursor for a later resume. */
  public void fail(String detail, Instant now) {
    this.status = JobStatus.FAILED;
    this.attempts++;
    this.errorDetail = detail;
    this.finishedAt = now;
  }
}
