package com.flamingo.ai.memoryengine.service.retrieval;

import com.flamingo.ai.memoryengine.domain.enums.RetrievalSignal;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.domain.model.RetrievalCandidate;
import com.flamingo.ai.memoryengine.domain.model.ScoredRecord;
import com.flamingo.ai.memoryengine.domain.model.SignalScore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Weighted Reciprocal Rank Fusion over any number of ranked candidate lists.
 *
 * <p>RRF score = Σ weight_signal / (k + rank_signal), rank starting at 1. Contributions are
 * summed in {@link RetrievalSignal} declaration order so the floating-point result does not depend
 * on map iteration order. Raw scores are min-max normalized per signal for traceability only; they
 * do not enter the fused score.
 */
@Component
@Slf4j
public class ReciprocalRankFusion {

  /** Fused score desc, importance desc, last access desc (missing last), identifier asc. */
  static final Comparator<RetrievalCandidate> FUSED_ORDER =
      Comparator.comparingDouble(RetrievalCandidate::getFusedScore)
          .reversed()
          .thenComparing(
              Comparator.comparingDouble((RetrievalCandidate c) -> c.getRecord().getImportance())
                  .reversed())
          .thenComparing(
              c -> c.getRecord().getLastAccessedAt(),
              Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
          .thenComparing(RetrievalCandidate::getRecordId);

  /**
   * Fuses the ranked lists into one deterministic ranking.
   *
   * @param rankedLists best-first candidates per signal; a record listed twice by one signal keeps
   *     its first rank
   * @param weights weight per signal; signals without a weight count as 0
   * @param k damping constant, must be positive
   * @return every distinct candidate, best first
   */
  public List<RetrievalCandidate> fuse(
      Map<RetrievalSignal, List<ScoredRecord>> rankedLists,
      Map<RetrievalSignal, Double> weights,
      int k) {
    if (k <= 0) {
      throw new IllegalArgumentException("k must be > 0, got " + k);
    }
    Map<String, RetrievalCandidate> candidates = new LinkedHashMap<>();
    for (RetrievalSignal signal : RetrievalSignal.values()) {
      List<ScoredRecord> ranked = distinct(rankedLists.getOrDefault(signal, List.of()));
      if (ranked.isEmpty()) {
        continue;
      }
      double weight = weights.getOrDefault(signal, 0.0);
      double min = ranked.stream().mapToDouble(ScoredRecord::score).min().orElse(0.0);
      double max = ranked.stream().mapToDouble(ScoredRecord::score).max().orElse(0.0);
      for (int i = 0; i < ranked.size(); i++) {
        ScoredRecord scored = ranked.get(i);
        MemoryRecord record = scored.record();
        int rank = i + 1;
        double normalized = max > min ? (scored.score() - min) / (max - min) : 1.0;
        SignalScore signalScore =
            new SignalScore(rank, scored.score(), normalized, weight / (k + rank));
        candidates
            .computeIfAbsent(record.getId(), id -> new RetrievalCandidate(record))
            .addSignal(signal, signalScore);
      }
      log.debug("[RRF] signal={} weight={} candidates={}", signal, weight, ranked.size());
    }

    List<RetrievalCandidate> fused = new ArrayList<>(candidates.values());
    fused.sort(FUSED_ORDER);
    log.debug("[RRF] unique candidates after fusion: {}", fused.size());
    return fused;
  }

  private static List<ScoredRecord> distinct(List<ScoredRecord> ranked) {
    Set<String> seen = new HashSet<>();
    List<ScoredRecord> result = new ArrayList<>(ranked.size());
    for (ScoredRecord scored : ranked) {
      if (seen.add(scored.record().getId())) {
        result.add(scored);
      }
    }
    return result;
  }
}
