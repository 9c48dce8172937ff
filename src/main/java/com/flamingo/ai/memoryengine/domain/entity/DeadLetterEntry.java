package com.flamingo.ai.memoryengine.domain.entity;

import com.flamingo.ai.memoryengine.domain.enums.DeadLetterSubject;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Failure bookkeeping for a record or job. Once {@code failureCount} reaches the retry budget the
 * entry is dead-lettered and consolidation stops touching the subject until it is released.
 */
@Entity
@Table(
    name = "dead_letters",
    uniqueConstraints = @UniqueConstraint(columnNames = {"subject_type", "subject_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeadLetterEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(name = "subject_type", nullable = false)
  private DeadLetterSubject subjectType;

  @Column(name = "subject_id", nullable = false)
  private String subjectId;

  @Builder.Default private int failureCount = 0;

  @Column(columnDefinition = "TEXT")
  private String lastError;

  @Builder.Default private boolean deadLettered = false;

  @Column(nullable = false, updatable = false)
  private Instant firstFailedAt;

  private Instant lastFailedAt;

  private Instant deadLetteredAt;

  /**
   * Counts one more failure.
   *
   * @return true if this failure exhausted the retry budget
   */
  public boolean recordFailure(String error, int retryBudget, Instant now) {
    this.failureCount++;
    this.lastError = error;
    this.lastFailedAt = now;
    if (!deadLettered && failureCount >= retryBudget) {
      this.deadLettered = true;
      this.deadLetteredAt = now;
      return true;
    }
    return false;
  }
}
