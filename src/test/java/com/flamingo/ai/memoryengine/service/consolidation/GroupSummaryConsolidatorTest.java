package com.flamingo.ai.memoryengine.service.consolidation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.enums.LlmErrorKind;
import com.flamingo.ai.memoryengine.domain.enums.MemoryTier;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.exception.LlmServiceException;
import com.flamingo.ai.memoryengine.service.lifecycle.LifecycleCoordinator;
import com.flamingo.ai.memoryengine.service.llm.LanguageModelService;
import com.flamingo.ai.memoryengine.support.TestRecords;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class GroupSummaryConsolidatorTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Mock private LifecycleCoordinator lifecycleCoordinator;
  @Mock private LanguageModelService languageModelService;

  private MemoryEngineConfig config;
  private GroupSummaryConsolidator consolidator;

  @BeforeEach
  void setUp() {
    config = new MemoryEngineConfig();
    config.getConsolidation().getGrouping().setEnabled(true);
    config.getConsolidation().getGrouping().setMinGroupSize(2);
    consolidator = new GroupSummaryConsolidator(lifecycleCoordinator, languageModelService, config);
    when(languageModelService.summarize(anyList())).thenReturn("summary");
    when(lifecycleCoordinator.consolidateGroup(anyList(), anyString()))
        .thenReturn(Optional.of("consolidated"));
  }

  private static MemoryRecord shortTerm(String owner, String content, float... embedding) {
    return TestRecords.working(owner, content, NOW)
        .tier(MemoryTier.SHORT_TERM)
        .embedding(embedding)
        .build();
  }

  @Test
  @DisplayName("should consolidate a cluster of similar records of one owner")
  void shouldConsolidateCluster() {
    MemoryRecord tea = shortTerm("alice", "likes tea", 1, 0, 0, 0);
    MemoryRecord greenTea = shortTerm("alice", "likes green tea", 1, 0.1f, 0, 0);
    MemoryRecord berlin = shortTerm("alice", "lives in Berlin", 0, 0, 1, 0);

    int created = consolidator.consolidate(List.of(tea, greenTea, berlin));

    assertThat(created).isEqualTo(1);
    verify(lifecycleCoordinator)
        .consolidateGroup(
            eq(Stream.of(tea, greenTea).map(MemoryRecord::getId).sorted().toList()),
            eq("summary"));
  }

  @Test
  @DisplayName("should never group records of different owners")
  void shouldKeepOwnersApart() {
    MemoryRecord alice = shortTerm("alice", "likes tea", 1, 0, 0, 0);
    MemoryRecord bob = shortTerm("bob", "likes tea", 1, 0, 0, 0);

    int created = consolidator.consolidate(List.of(alice, bob));

    assertThat(created).isZero();
    verify(lifecycleCoordinator, never()).consolidateGroup(any(), any());
  }

  @Test
  @DisplayName("should ignore records outside SHORT_TERM, archived or without embeddings")
  void shouldIgnoreIneligibleRecords() {
    MemoryRecord working =
        TestRecords.working("alice", "likes tea", NOW).embedding(new float[] {1, 0, 0, 0}).build();
    MemoryRecord archived = shortTerm("alice", "likes green tea", 1, 0, 0, 0);
    archived.setArchived(true);
    MemoryRecord bare = shortTerm("alice", "likes black tea");
    MemoryRecord single = shortTerm("alice", "likes oolong", 1, 0, 0, 0);

    assertThat(consolidator.consolidate(List.of(working, archived, bare, single))).isZero();
    verify(languageModelService, never()).summarize(any());
  }

  @Test
  @DisplayName("should keep going when one group fails to summarise")
  void shouldContainGroupFailures() {
    MemoryRecord tea = shortTerm("alice", "likes tea", 1, 0, 0, 0);
    MemoryRecord greenTea = shortTerm("alice", "likes green tea", 1, 0, 0, 0);
    MemoryRecord berlin = shortTerm("alice", "lives in Berlin", 0, 1, 0, 0);
    MemoryRecord munich = shortTerm("alice", "lives near Munich", 0, 1, 0, 0);
    when(languageModelService.summarize(List.of("likes tea", "likes green tea")))
        .thenThrow(new LlmServiceException(LlmErrorKind.TIMEOUT, "timed out"));
    when(languageModelService.summarize(List.of("likes green tea", "likes tea")))
        .thenThrow(new LlmServiceException(LlmErrorKind.TIMEOUT, "timed out"));

    int created = consolidator.consolidate(List.of(tea, greenTea, berlin, munich));

    assertThat(created).isEqualTo(1);
  }
}
