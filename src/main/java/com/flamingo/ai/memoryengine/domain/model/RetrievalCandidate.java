package com.flamingo.ai.memoryengine.domain.model;

import com.flamingo.ai.memoryengine.domain.enums.RetrievalSignal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.ToString;

/** Per-query candidate accumulating contributions from every signal that returned it. */
@Getter
@ToString
public class RetrievalCandidate {

  private final String recordId;
  private final MemoryRecord record;
  private final Map<RetrievalSignal, SignalScore> signalScores =
      new EnumMap<>(RetrievalSignal.class);
  private double fusedScore;

  public RetrievalCandidate(MemoryRecord record) {
    this.recordId = record.getId();
    this.record = record;
  }

  /** Records one signal's opinion and adds its contribution to the fused score. */
  public void addSignal(RetrievalSignal signal, SignalScore score) {
    if (signalScores.putIfAbsent(signal, score) == null) {
      fusedScore += score.contribution();
    }
  }

  /** Signals this candidate was found by, in declaration order. */
  public Set<RetrievalSignal> getSources() {
    return signalScores.isEmpty()
        ? Collections.emptySet()
        : Collections.unmodifiableSet(EnumSet.copyOf(signalScores.keySet()));
  }

  public Map<RetrievalSignal, SignalScore> getSignalScores() {
    return Collections.unmodifiableMap(signalScores);
  }
}
