package com.flamingo.ai.memoryengine.service.consolidation;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.enums.MemoryTier;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.exception.MemoryEngineException;
import com.flamingo.ai.memoryengine.service.dedup.VectorMath;
import com.flamingo.ai.memoryengine.service.lifecycle.LifecycleCoordinator;
import com.flamingo.ai.memoryengine.service.llm.LanguageModelService;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Folds clusters of related SHORT_TERM memories into one LONG_TERM summary memory. Clusters are
 * formed greedily within one scanned page: records are visited in identifier order and each
 * unassigned record seeds a cluster of the unassigned records of the same owner that are similar
 * enough to it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GroupSummaryConsolidator {

  private final LifecycleCoordinator lifecycleCoordinator;
  private final LanguageModelService languageModelService;
  private final MemoryEngineConfig config;

  /**
   * Consolidates the clusters found in {@code page}.
   *
   * @return number of consolidated records created or reused
   */
  public int consolidate(List<MemoryRecord> page) {
    MemoryEngineConfig.Grouping grouping = config.getConsolidation().getGrouping();
    List<MemoryRecord> eligible =
        page.stream()
            .filter(r -> r.getTier() == MemoryTier.SHORT_TERM)
            .filter(r -> !r.isArchived() && r.hasEmbedding())
            .sorted(Comparator.comparing(MemoryRecord::getId))
            .toList();

    Set<String> assigned = new HashSet<>();
    int consolidated = 0;
    for (MemoryRecord seed : eligible) {
      if (assigned.contains(seed.getId())) {
        continue;
      }
      List<MemoryRecord> cluster = new ArrayList<>();
      cluster.add(seed);
      for (MemoryRecord other : eligible) {
        if (other == seed
            || assigned.contains(other.getId())
            || !other.getOwner().equals(seed.getOwner())) {
          continue;
        }
        if (VectorMath.cosine(seed.getEmbedding(), other.getEmbedding())
            >= grouping.getSimilarityThreshold()) {
          cluster.add(other);
        }
      }
      if (cluster.size() < grouping.getMinGroupSize()) {
        continue;
      }
      cluster.forEach(member -> assigned.add(member.getId()));
      try {
        String summary =
            languageModelService.summarize(
                cluster.stream().map(MemoryRecord::getContent).toList());
        if (lifecycleCoordinator
            .consolidateGroup(cluster.stream().map(MemoryRecord::getId).toList(), summary)
            .isPresent()) {
          consolidated++;
        }
      } catch (MemoryEngineException e) {
        log.warn(
            "Failed to consolidate group of {} memories seeded by {}: {}",
            cluster.size(),
            seed.getId(),
            e.getMessage());
      }
    }
    return consolidated;
  }
}
