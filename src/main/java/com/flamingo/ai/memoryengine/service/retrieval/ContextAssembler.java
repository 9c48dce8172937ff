package com.flamingo.ai.memoryengine.service.retrieval;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.enums.RetrievalSignal;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.domain.model.RetrievalCandidate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Greedy, budget-bounded selection of fused candidates and rendering of the context block handed
 * to prompt assembly.
 */
@Component
@Slf4j
public class ContextAssembler {

  static final String HEADER = "Relevant memories:\n";

  private final MemoryEngineConfig.Retrieval retrieval;

  public ContextAssembler(MemoryEngineConfig config) {
    this.retrieval = config.getRetrieval();
  }

  /**
   * Selected candidates plus their rendered context.
   *
   * @param accepted candidates that fit, in fused order
   * @param context rendered block, empty when nothing was accepted
   * @param tokensUsed estimated tokens of the accepted entries
   * @param droppedForBudget candidates skipped because their entry did not fit
   */
  public record AssembledContext(
      List<RetrievalCandidate> accepted, String context, int tokensUsed, int droppedForBudget) {}

  /**
   * Walks {@code ranked} in order and accepts every candidate whose entry still fits in the
   * remaining budget. A candidate that does not fit is skipped and a later, shorter one may still
   * be accepted. Stops at {@code limit} accepted candidates.
   */
  public AssembledContext assemble(List<RetrievalCandidate> ranked, int limit, int tokenBudget) {
    List<RetrievalCandidate> accepted = new ArrayList<>();
    StringBuilder entries = new StringBuilder();
    int used = 0;
    int dropped = 0;
    for (RetrievalCandidate candidate : ranked) {
      if (accepted.size() >= limit) {
        break;
      }
      String entry = render(candidate);
      int cost = estimateTokens(entry);
      if (used + cost > tokenBudget) {
        dropped++;
        log.debug(
            "Skipping {} ({} tokens) with {} of {} tokens used",
            candidate.getRecordId(),
            cost,
            used,
            tokenBudget);
        continue;
      }
      accepted.add(candidate);
      entries.append(entry);
      used += cost;
    }
    String context = accepted.isEmpty() ? "" : HEADER + entries;
    return new AssembledContext(List.copyOf(accepted), context, used, dropped);
  }

  /** Tokens estimated as ceil(characters / charsPerToken). */
  int estimateTokens(String text) {
    int charsPerToken = retrieval.getCharsPerToken();
    return (text.length() + charsPerToken - 1) / charsPerToken;
  }

  /** One line per candidate, naming the signals that found it. */
  static String render(RetrievalCandidate candidate) {
    MemoryRecord record = candidate.getRecord();
    String via =
        candidate.getSources().stream()
            .map(RetrievalSignal::name)
            .map(name -> name.toLowerCase(Locale.ROOT))
            .collect(Collectors.joining(", "));
    return String.format(
        Locale.ROOT,
        "- [%s] %s (importance: %.1f, via: %s)\n",
        record.getTier(),
        record.getContent(),
        record.getImportance(),
        via);
  }
}
