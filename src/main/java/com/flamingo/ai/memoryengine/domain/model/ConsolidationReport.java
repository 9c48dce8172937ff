package com.flamingo.ai.memoryengine.domain.model;

import java.util.List;
import java.util.UUID;
import lombok.Builder;

/** Summary of one consolidation tick. */
@Builder
public record ConsolidationReport(
    List<UUID> jobIds,
    int pagesProcessed,
    int recordsProcessed,
    int rescored,
    int promoted,
    int archived,
    int merged,
    int summarized,
    int grouped,
    int embeddingsBackfilled,
    int failed,
    int deadLettered) {

  public static ConsolidationReport empty() {
    return ConsolidationReport.builder().jobIds(List.of()).build();
  }
}
