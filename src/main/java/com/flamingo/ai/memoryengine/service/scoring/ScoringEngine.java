package com.flamingo.ai.memoryengine.service.scoring;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.config.MemoryEngineConfig.TierPolicy;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.domain.model.ScoreResult;
import com.flamingo.ai.memoryengine.exception.CorruptedStateException;
import com.flamingo.ai.memoryengine.exception.InvalidRecordStateException;
import java.time.Duration;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Importance, decay and tier-transition rules. Pure and deterministic: every method depends only
 * on its arguments and the injected per-tier policy, and never touches the store.
 *
 * <p>Decay follows {@code base / (1 + (ageDays / halfLifeDays)^2)}, which is 1x base at age zero,
 * half at one half-life and strictly decreasing afterwards without reaching zero.
 */
@Component
public class ScoringEngine {

  private static final double MILLIS_PER_DAY = 86_400_000d;

  private final MemoryEngineConfig.Scoring scoring;

  public ScoringEngine(MemoryEngineConfig config) {
    this.scoring = config.getScoring();
  }

  /**
   * Computes the effective importance and decay weight of {@code record} at {@code now}.
   *
   * @throws InvalidRecordStateException if the tier is unknown or the record is younger than zero
   * @throws CorruptedStateException if the creation timestamp or a stored score is missing
   */
  public ScoreResult score(MemoryRecord record, Instant now) {
    TierPolicy policy = policyOf(record);
    record
        .malformedNumericField()
        .ifPresent(
            field -> {
              throw new CorruptedStateException(record.getId(), "missing or malformed " + field);
            });
    double ageDays = ageDays(record, record.getCreatedAt(), "createdAt", now);
    double base = clamp(record.getBaseImportance());
    return new ScoreResult(
        effectiveImportance(base, record.getAccessCount()),
        decayWeight(base, ageDays, policy.getHalfLifeDays()));
  }

  /** Decay weight for a given age; non-increasing in {@code ageDays}. */
  public double decayWeight(double baseImportance, double ageDays, double halfLifeDays) {
    if (ageDays < 0) {
      throw new IllegalArgumentException("ageDays must be >= 0, got " + ageDays);
    }
    if (halfLifeDays <= 0) {
      throw new IllegalArgumentException("halfLifeDays must be > 0, got " + halfLifeDays);
    }
    double ratio = ageDays / halfLifeDays;
    return clamp(baseImportance) / (1 + ratio * ratio);
  }

  /** Base importance reinforced by usage: {@code clamp(base + r * ln(1 + accessCount))}. */
  public double effectiveImportance(double baseImportance, long accessCount) {
    double reinforcement = scoring.getAccessReinforcement() * Math.log1p(Math.max(0, accessCount));
    return clamp(baseImportance + reinforcement);
  }

  /**
   * Whether {@code record} may move to the next tier: it has spent at least the tier's minimum
   * dwell time there, and either its importance or its access count reaches the tier's threshold.
   * Records in the last tier or already archived never promote.
   */
  public boolean shouldPromote(MemoryRecord record, Instant now) {
    TierPolicy policy = policyOf(record);
    double dwellDays = ageDays(record, record.getTierEnteredAt(), "tierEnteredAt", now);
    if (record.isArchived() || record.getTier().next().isEmpty()) {
      return false;
    }
    if (dwellDays * MILLIS_PER_DAY < policy.getMinDwell().toMillis()) {
      return false;
    }
    double importance = score(record, now).importance();
    return importance >= policy.getPromotionImportanceThreshold()
        || record.getAccessCount() >= policy.getPromotionAccessThreshold();
  }

  /**
   * Whether the background pass should archive {@code record}: its decay weight is below the
   * archival floor and its importance below the ceiling, and it was not accessed within the
   * recency window.
   */
  public boolean shouldArchive(MemoryRecord record, Instant now) {
    ScoreResult result = score(record, now);
    if (record.isArchived()) {
      return false;
    }
    if (record.getLastAccessedAt() == null) {
      throw new CorruptedStateException(record.getId(), "missing lastAccessedAt");
    }
    Duration sinceAccess = Duration.between(record.getLastAccessedAt(), now);
    // an access stamped after now is treated as recent
    boolean recentlyAccessed = sinceAccess.compareTo(scoring.getRecencyWindow()) < 0;
    return result.decayWeight() < scoring.getArchivalFloor()
        && result.importance() < scoring.getArchivalImportanceCeiling()
        && !recentlyAccessed;
  }

  private TierPolicy policyOf(MemoryRecord record) {
    if (record.getTier() == null) {
      throw new InvalidRecordStateException(record.getId(), "unrecognized tier");
    }
    return scoring.policyFor(record.getTier());
  }

  private static double ageDays(MemoryRecord record, Instant since, String field, Instant now) {
    if (since == null) {
      throw new CorruptedStateException(record.getId(), "missing " + field);
    }
    long millis = Duration.between(since, now).toMillis();
    if (millis < 0) {
      throw new InvalidRecordStateException(
          record.getId(), String.format("%s %s is after now %s (clock skew)", field, since, now));
    }
    return millis / MILLIS_PER_DAY;
  }

  static double clamp(double value) {
    if (Double.isNaN(value)) {
      throw new IllegalArgumentException("score is NaN");
    }
    return Math.max(0.0, Math.min(1.0, value));
  }
}
