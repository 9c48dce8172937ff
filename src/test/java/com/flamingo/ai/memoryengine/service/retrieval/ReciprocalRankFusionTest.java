package com.flamingo.ai.memoryengine.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.memoryengine.domain.enums.RetrievalSignal;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.domain.model.RetrievalCandidate;
import com.flamingo.ai.memoryengine.domain.model.ScoredRecord;
import com.flamingo.ai.memoryengine.domain.model.SignalScore;
import com.flamingo.ai.memoryengine.support.TestRecords;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ReciprocalRankFusionTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final Map<RetrievalSignal, Double> EQUAL_WEIGHTS =
      Map.of(RetrievalSignal.VECTOR, 1.0, RetrievalSignal.KEYWORD, 1.0, RetrievalSignal.GRAPH, 1.0);

  private final ReciprocalRankFusion fusion = new ReciprocalRankFusion();

  private static List<ScoredRecord> ranked(String... ids) {
    double score = ids.length;
    List<ScoredRecord> list = new ArrayList<>();
    for (String id : ids) {
      list.add(new ScoredRecord(TestRecords.withId(id, 0.5, NOW), score--));
    }
    return list;
  }

  private static RetrievalCandidate rankedFirst(MemoryRecord record) {
    RetrievalCandidate candidate = new RetrievalCandidate(record);
    candidate.addSignal(RetrievalSignal.VECTOR, new SignalScore(1, 1.0, 1.0, 1.0 / 61));
    return candidate;
  }

  private static Map<RetrievalSignal, List<ScoredRecord>> lists(
      List<ScoredRecord> vector, List<ScoredRecord> keyword) {
    Map<RetrievalSignal, List<ScoredRecord>> lists = new EnumMap<>(RetrievalSignal.class);
    lists.put(RetrievalSignal.VECTOR, vector);
    lists.put(RetrievalSignal.KEYWORD, keyword);
    return lists;
  }

  @Nested
  @DisplayName("fuse")
  class FuseTests {

    @Test
    @DisplayName("should rank records found by both signals above single-signal records")
    void shouldRewardAgreement() {
      List<RetrievalCandidate> fused =
          fusion.fuse(lists(ranked("A", "B", "C"), ranked("B", "C", "D")), EQUAL_WEIGHTS, 60);

      assertThat(fused)
          .extracting(RetrievalCandidate::getRecordId)
          .containsExactly("B", "C", "A", "D");
      assertThat(fused.get(0).getFusedScore()).isCloseTo(1.0 / 62 + 1.0 / 61, within(1e-12));
      assertThat(fused.get(1).getFusedScore()).isCloseTo(1.0 / 63 + 1.0 / 62, within(1e-12));
      assertThat(fused.get(2).getFusedScore()).isCloseTo(1.0 / 61, within(1e-12));
      assertThat(fused.get(3).getFusedScore()).isCloseTo(1.0 / 63, within(1e-12));
    }

    @Test
    @DisplayName("should record rank, normalized score and contribution per signal")
    void shouldKeepPerSignalTrace() {
      List<RetrievalCandidate> fused =
          fusion.fuse(lists(ranked("A", "B", "C"), ranked("B", "C", "D")), EQUAL_WEIGHTS, 60);

      RetrievalCandidate b = fused.get(0);
      assertThat(b.getSources())
          .containsExactly(RetrievalSignal.VECTOR, RetrievalSignal.KEYWORD);
      SignalScore vector = b.getSignalScores().get(RetrievalSignal.VECTOR);
      assertThat(vector.rank()).isEqualTo(2);
      assertThat(vector.normalizedScore()).isEqualTo(0.5);
      SignalScore keyword = b.getSignalScores().get(RetrievalSignal.KEYWORD);
      assertThat(keyword.rank()).isEqualTo(1);
      assertThat(keyword.normalizedScore()).isEqualTo(1.0);
      assertThat(keyword.contribution()).isCloseTo(1.0 / 61, within(1e-12));
    }

    @Test
    @DisplayName("should scale contributions by signal weight")
    void shouldApplyWeights() {
      Map<RetrievalSignal, Double> keywordHeavy =
          Map.of(RetrievalSignal.VECTOR, 1.0, RetrievalSignal.KEYWORD, 3.0);

      List<RetrievalCandidate> fused =
          fusion.fuse(lists(ranked("A"), ranked("Z")), keywordHeavy, 60);

      assertThat(fused).extracting(RetrievalCandidate::getRecordId).containsExactly("Z", "A");
    }

    @Test
    @DisplayName("should produce the same ranking regardless of input map order")
    void shouldBeDeterministic() {
      Map<RetrievalSignal, List<ScoredRecord>> forward =
          lists(ranked("A", "B", "C"), ranked("C", "B", "A"));
      Map<RetrievalSignal, List<ScoredRecord>> backward = new LinkedHashMap<>();
      backward.put(RetrievalSignal.KEYWORD, forward.get(RetrievalSignal.KEYWORD));
      backward.put(RetrievalSignal.VECTOR, forward.get(RetrievalSignal.VECTOR));

      List<String> first =
          fusion.fuse(forward, EQUAL_WEIGHTS, 60).stream()
              .map(RetrievalCandidate::getRecordId)
              .toList();
      List<String> second =
          fusion.fuse(backward, EQUAL_WEIGHTS, 60).stream()
              .map(RetrievalCandidate::getRecordId)
              .toList();

      // A and C tie exactly; B's two middle ranks sum lower
      assertThat(first).containsExactly("A", "C", "B").isEqualTo(second);
    }

    @Test
    @DisplayName("should break ties by importance, then last access, then identifier")
    void shouldBreakTies() {
      RetrievalCandidate neverAccessed = rankedFirst(TestRecords.withId("a", 0.5, null));
      RetrievalCandidate older = rankedFirst(TestRecords.withId("b", 0.5, NOW.minusSeconds(60)));
      RetrievalCandidate sameAsOlder =
          rankedFirst(TestRecords.withId("c", 0.5, NOW.minusSeconds(60)));
      RetrievalCandidate recent = rankedFirst(TestRecords.withId("d", 0.5, NOW));
      RetrievalCandidate important = rankedFirst(TestRecords.withId("e", 0.9, null));

      List<RetrievalCandidate> sorted =
          Stream.of(neverAccessed, sameAsOlder, older, recent, important)
              .sorted(ReciprocalRankFusion.FUSED_ORDER)
              .toList();

      assertThat(sorted)
          .extracting(RetrievalCandidate::getRecordId)
          .containsExactly("e", "d", "b", "c", "a");
    }

    @Test
    @DisplayName("should keep the first rank of a record listed twice by one signal")
    void shouldDeduplicateWithinSignal() {
      List<RetrievalCandidate> fused =
          fusion.fuse(lists(ranked("A", "B", "A"), List.of()), EQUAL_WEIGHTS, 60);

      assertThat(fused).extracting(RetrievalCandidate::getRecordId).containsExactly("A", "B");
      assertThat(fused.get(0).getFusedScore()).isCloseTo(1.0 / 61, within(1e-12));
    }

    @Test
    @DisplayName("should ignore signals without a weight and reject a non-positive k")
    void shouldHandleEdgeCases() {
      List<RetrievalCandidate> fused =
          fusion.fuse(lists(ranked("A"), ranked("B")), Map.of(RetrievalSignal.VECTOR, 1.0), 60);

      assertThat(fused.get(0).getRecordId()).isEqualTo("A");
      assertThat(fused.get(1).getFusedScore()).isZero();
      assertThat(fusion.fuse(Map.of(), EQUAL_WEIGHTS, 60)).isEmpty();
      assertThatThrownBy(() -> fusion.fuse(Map.of(), EQUAL_WEIGHTS, 0))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}
