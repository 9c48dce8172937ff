package com.flamingo.ai.memoryengine.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.enums.RetrievalSignal;
import com.flamingo.ai.memoryengine.domain.model.RetrievalCandidate;
import com.flamingo.ai.memoryengine.domain.model.SignalScore;
import com.flamingo.ai.memoryengine.service.retrieval.ContextAssembler.AssembledContext;
import com.flamingo.ai.memoryengine.support.TestRecords;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ContextAssemblerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private ContextAssembler contextAssembler;

  @BeforeEach
  void setUp() {
    contextAssembler = new ContextAssembler(new MemoryEngineConfig());
  }

  private static RetrievalCandidate candidate(String content, RetrievalSignal... signals) {
    RetrievalCandidate candidate =
        new RetrievalCandidate(TestRecords.working("alice", content, NOW).build());
    for (RetrievalSignal signal : signals) {
      candidate.addSignal(signal, new SignalScore(1, 1.0, 1.0, 0.01));
    }
    return candidate;
  }

  @Test
  @DisplayName("should render one line per memory with tier, importance and sources")
  void shouldRenderEntries() {
    RetrievalCandidate first =
        candidate("User prefers dark mode", RetrievalSignal.VECTOR, RetrievalSignal.KEYWORD);
    RetrievalCandidate second = candidate("Works in Berlin", RetrievalSignal.GRAPH);

    AssembledContext assembled = contextAssembler.assemble(List.of(first, second), 10, 1000);

    assertThat(assembled.context())
        .isEqualTo(
            "Relevant memories:\n"
                + "- [WORKING] User prefers dark mode (importance: 0.5, via: vector, keyword)\n"
                + "- [WORKING] Works in Berlin (importance: 0.5, via: graph)\n");
    assertThat(assembled.accepted()).containsExactly(first, second);
    assertThat(assembled.droppedForBudget()).isZero();
  }

  @Test
  @DisplayName("should stop at the result limit")
  void shouldRespectLimit() {
    List<RetrievalCandidate> ranked =
        List.of(
            candidate("one", RetrievalSignal.VECTOR),
            candidate("two", RetrievalSignal.VECTOR),
            candidate("three", RetrievalSignal.VECTOR));

    AssembledContext assembled = contextAssembler.assemble(ranked, 2, 1000);

    assertThat(assembled.accepted()).hasSize(2);
    assertThat(assembled.accepted().get(1).getRecord().getContent()).isEqualTo("two");
  }

  @Test
  @DisplayName("should skip an entry that does not fit and keep a later shorter one")
  void shouldSkipOversizedEntries() {
    RetrievalCandidate shortFirst = candidate("short", RetrievalSignal.VECTOR);
    RetrievalCandidate huge = candidate("x".repeat(400), RetrievalSignal.VECTOR);
    RetrievalCandidate shortLast = candidate("tiny", RetrievalSignal.VECTOR);
    int budget =
        contextAssembler.estimateTokens(ContextAssembler.render(shortFirst))
            + contextAssembler.estimateTokens(ContextAssembler.render(shortLast));

    AssembledContext assembled =
        contextAssembler.assemble(List.of(shortFirst, huge, shortLast), 10, budget);

    assertThat(assembled.accepted()).containsExactly(shortFirst, shortLast);
    assertThat(assembled.droppedForBudget()).isEqualTo(1);
    assertThat(assembled.tokensUsed()).isEqualTo(budget);
  }

  @Test
  @DisplayName("should return an empty context when nothing fits")
  void shouldReturnEmptyContext() {
    AssembledContext assembled =
        contextAssembler.assemble(List.of(candidate("hello", RetrievalSignal.VECTOR)), 10, 1);

    assertThat(assembled.accepted()).isEmpty();
    assertThat(assembled.context()).isEmpty();
    assertThat(assembled.tokensUsed()).isZero();
  }

  @Test
  @DisplayName("should estimate tokens by rounding characters up")
  void shouldEstimateTokens() {
    assertThat(contextAssembler.estimateTokens("")).isZero();
    assertThat(contextAssembler.estimateTokens("abcd")).isEqualTo(1);
    assertThat(contextAssembler.estimateTokens("abcde")).isEqualTo(2);
  }
}
