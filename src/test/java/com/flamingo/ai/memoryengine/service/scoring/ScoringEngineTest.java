package com.flamingo.ai.memoryengine.service.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.enums.MemoryTier;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.domain.model.ScoreResult;
import com.flamingo.ai.memoryengine.exception.CorruptedStateException;
import com.flamingo.ai.memoryengine.exception.InvalidRecordStateException;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ScoringEngineTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private MemoryEngineConfig config;
  private ScoringEngine scoringEngine;

  @BeforeEach
  void setUp() {
    config = new MemoryEngineConfig();
    scoringEngine = new ScoringEngine(config);
  }

  private MemoryRecord record(MemoryTier tier, double base, long accessCount, Duration age) {
    Instant created = NOW.minus(age);
    return MemoryRecord.builder()
        .id("rec-1")
        .owner("alice")
        .content("content")
        .tier(tier)
        .baseImportance(base)
        .accessCount(accessCount)
        .createdAt(created)
        .lastAccessedAt(created)
        .lastModifiedAt(created)
        .tierEnteredAt(created)
        .build();
  }

  @Nested
  @DisplayName("decayWeight")
  class DecayWeightTests {

    @Test
    @DisplayName("should equal base importance at age zero and half of it at one half-life")
    void shouldFollowHalfLifeCurve() {
      assertThat(scoringEngine.decayWeight(0.8, 0, 30)).isEqualTo(0.8);
      assertThat(scoringEngine.decayWeight(0.8, 30, 30)).isCloseTo(0.4, within(1e-12));
    }

    @Test
    @DisplayName("should be non-increasing in age and never negative")
    void shouldBeMonotonicallyNonIncreasing() {
      double previous = Double.MAX_VALUE;
      for (int day = 0; day <= 3650; day += 7) {
        double weight = scoringEngine.decayWeight(0.9, day, 30);
        assertThat(weight).isLessThanOrEqualTo(previous).isGreaterThanOrEqualTo(0.0);
        previous = weight;
      }
    }

    @Test
    @DisplayName("should match the formula for a 100 day old short-term record")
    void shouldMatchFormulaForOldShortTermRecord() {
      MemoryRecord old = record(MemoryTier.SHORT_TERM, 0.9, 1, Duration.ofDays(100));

      ScoreResult result = scoringEngine.score(old, NOW);

      double expected = 0.9 / (1 + Math.pow(100.0 / 30.0, 2));
      assertThat(result.decayWeight()).isCloseTo(expected, within(1e-9));
    }

    @Test
    @DisplayName("should reject negative age and non-positive half-life")
    void shouldRejectInvalidArguments() {
      assertThatThrownBy(() -> scoringEngine.decayWeight(0.5, -1, 30))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> scoringEngine.decayWeight(0.5, 1, 0))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("score")
  class ScoreTests {

    @Test
    @DisplayName("should reinforce importance logarithmically with access count")
    void shouldReinforceImportanceWithAccesses() {
      double once =
          scoringEngine.score(record(MemoryTier.WORKING, 0.5, 1, Duration.ZERO), NOW).importance();
      double often =
          scoringEngine.score(record(MemoryTier.WORKING, 0.5, 100, Duration.ZERO), NOW)
              .importance();

      assertThat(once).isCloseTo(0.5 + 0.05 * Math.log(2), within(1e-12));
      assertThat(often).isGreaterThan(once).isLessThanOrEqualTo(1.0);
    }

    @Test
    @DisplayName("should clamp importance to one")
    void shouldClampImportance() {
      ScoreResult result =
          scoringEngine.score(record(MemoryTier.WORKING, 1.0, 1_000_000, Duration.ZERO), NOW);

      assertThat(result.importance()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should reject a creation time in the future")
    void shouldRejectClockSkew() {
      MemoryRecord future = record(MemoryTier.WORKING, 0.5, 1, Duration.ofMinutes(-5));

      assertThatThrownBy(() -> scoringEngine.score(future, NOW))
          .isInstanceOf(InvalidRecordStateException.class)
          .hasMessageContaining("clock skew");
    }

    @Test
    @DisplayName("should report a missing creation time as corrupted state")
    void shouldRejectMissingCreatedAt() {
      MemoryRecord broken = record(MemoryTier.WORKING, 0.5, 1, Duration.ZERO);
      broken.setCreatedAt(null);

      assertThatThrownBy(() -> scoringEngine.score(broken, NOW))
          .isInstanceOf(CorruptedStateException.class);
    }

    @Test
    @DisplayName("should report a missing base importance as corrupted state")
    void shouldRejectMissingBaseImportance() {
      MemoryRecord broken = record(MemoryTier.WORKING, 0.5, 1, Duration.ZERO);
      broken.setBaseImportance(Double.NaN);

      assertThatThrownBy(() -> scoringEngine.score(broken, NOW))
          .isInstanceOf(CorruptedStateException.class)
          .hasMessageContaining("baseImportance");
    }

    @Test
    @DisplayName("should reject a record without a tier")
    void shouldRejectMissingTier() {
      MemoryRecord broken = record(null, 0.5, 1, Duration.ZERO);

      assertThatThrownBy(() -> scoringEngine.score(broken, NOW))
          .isInstanceOf(InvalidRecordStateException.class);
    }
  }

  @Nested
  @DisplayName("shouldPromote")
  class ShouldPromoteTests {

    @Test
    @DisplayName("should not promote before the minimum dwell time even when important")
    void shouldRespectMinimumDwell() {
      MemoryRecord fresh = record(MemoryTier.WORKING, 1.0, 50, Duration.ofMinutes(10));

      assertThat(scoringEngine.shouldPromote(fresh, NOW)).isFalse();
    }

    @Test
    @DisplayName("should promote after dwell when the access threshold is reached")
    void shouldPromoteOnAccessCount() {
      MemoryRecord used = record(MemoryTier.WORKING, 0.1, 5, Duration.ofHours(1));

      assertThat(scoringEngine.shouldPromote(used, NOW)).isTrue();
    }

    @Test
    @DisplayName("should promote after dwell when the importance threshold is reached")
    void shouldPromoteOnImportance() {
      MemoryRecord important = record(MemoryTier.WORKING, 0.85, 1, Duration.ofHours(1));

      assertThat(scoringEngine.shouldPromote(important, NOW)).isTrue();
    }

    @Test
    @DisplayName("should not promote an unimportant, rarely used record")
    void shouldNotPromoteUnimportantRecord() {
      MemoryRecord dull = record(MemoryTier.WORKING, 0.2, 1, Duration.ofHours(1));

      assertThat(scoringEngine.shouldPromote(dull, NOW)).isFalse();
    }

    @Test
    @DisplayName("should never promote long-term or archived records")
    void shouldNotPromoteTerminalRecords() {
      MemoryRecord longTerm = record(MemoryTier.LONG_TERM, 1.0, 1000, Duration.ofDays(400));
      MemoryRecord archived = record(MemoryTier.WORKING, 1.0, 1000, Duration.ofDays(1));
      archived.setArchived(true);

      assertThat(scoringEngine.shouldPromote(longTerm, NOW)).isFalse();
      assertThat(scoringEngine.shouldPromote(archived, NOW)).isFalse();
    }

    @Test
    @DisplayName("should measure dwell from tier entry rather than creation")
    void shouldMeasureDwellFromTierEntry() {
      MemoryRecord promoted = record(MemoryTier.SHORT_TERM, 1.0, 50, Duration.ofDays(30));
      promoted.setTierEnteredAt(NOW.minus(Duration.ofDays(1)));

      assertThat(scoringEngine.shouldPromote(promoted, NOW)).isFalse();
    }
  }

  @Nested
  @DisplayName("shouldArchive")
  class ShouldArchiveTests {

    @Test
    @DisplayName("should archive a decayed, unimportant record not accessed recently")
    void shouldArchiveDecayedRecord() {
      MemoryRecord stale = record(MemoryTier.WORKING, 0.1, 0, Duration.ofDays(10));

      assertThat(scoringEngine.shouldArchive(stale, NOW)).isTrue();
    }

    @Test
    @DisplayName("should keep a decayed record accessed within the recency window")
    void shouldKeepRecentlyAccessedRecord() {
      MemoryRecord stale = record(MemoryTier.WORKING, 0.1, 0, Duration.ofDays(10));
      stale.setLastAccessedAt(NOW.minus(Duration.ofMinutes(5)));

      assertThat(scoringEngine.shouldArchive(stale, NOW)).isFalse();
    }

    @Test
    @DisplayName("should keep a decayed record whose importance is above the ceiling")
    void shouldKeepImportantRecord() {
      config.getScoring().setArchivalImportanceCeiling(0.1);
      MemoryRecord stale = record(MemoryTier.WORKING, 0.3, 0, Duration.ofDays(10));

      assertThat(scoringEngine.shouldArchive(stale, NOW)).isFalse();
    }

    @Test
    @DisplayName("should keep a record until its decay weight falls below the floor")
    void shouldKeepRecordAboveFloor() {
      MemoryRecord young = record(MemoryTier.WORKING, 0.29, 0, Duration.ofHours(12));
      MemoryRecord older = record(MemoryTier.WORKING, 0.29, 0, Duration.ofDays(3));

      assertThat(scoringEngine.shouldArchive(young, NOW)).isFalse();
      assertThat(scoringEngine.shouldArchive(older, NOW)).isTrue();
    }

    @Test
    @DisplayName("should report a missing last access time as corrupted state")
    void shouldRejectMissingLastAccess() {
      MemoryRecord broken = record(MemoryTier.WORKING, 0.1, 0, Duration.ofDays(10));
      broken.setLastAccessedAt(null);

      assertThatThrownBy(() -> scoringEngine.shouldArchive(broken, NOW))
          .isInstanceOf(CorruptedStateException.class);
    }
  }
}
