package com.flamingo.ai.memoryengine.domain.model;

import com.flamingo.ai.memoryengine.domain.enums.QueryIntent;
import com.flamingo.ai.memoryengine.domain.enums.RetrievalSignal;
import com.flamingo.ai.memoryengine.domain.enums.SignalStatus;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * Ranked, budget-bounded search outcome.
 *
 * @param candidates accepted candidates in fused order
 * @param partial true when at least one signal failed or timed out
 * @param signalStatuses outcome per signal
 * @param intent classified query intent, or null if unavailable
 * @param context rendered context block for prompt assembly
 * @param tokensUsed estimated tokens consumed by the accepted candidates
 * @param droppedForBudget candidates skipped because they did not fit the budget
 */
@Builder
public record SearchResult(
    List<RetrievalCandidate> candidates,
    boolean partial,
    Map<RetrievalSignal, SignalStatus> signalStatuses,
    QueryIntent intent,
    String context,
    int tokensUsed,
    int droppedForBudget) {

  public List<String> recordIds() {
    return candidates.stream().map(RetrievalCandidate::getRecordId).toList();
  }
}
