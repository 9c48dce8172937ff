package com.flamingo.ai.memoryengine.service.lifecycle;

import com.flamingo.ai.memoryengine.event.MemoryIngestedEvent;
import com.flamingo.ai.memoryengine.service.llm.LanguageModelService;
import com.flamingo.ai.memoryengine.store.GraphStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Language-model work that ingest does not wait for: the embedding that feeds vector search and
 * semantic dedup, and the entity mentions that feed graph expansion.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryEnrichmentService {

  private final LifecycleCoordinator lifecycleCoordinator;
  private final LanguageModelService languageModelService;
  private final GraphStore graphStore;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /**
   * Handles a newly created record. A failure leaves the record without an embedding, which the
   * next consolidation pass backfills.
   */
  @Async("enrichmentExecutor")
  @EventListener
  public void onMemoryIngested(MemoryIngestedEvent event) {
    try {
      enrich(event.recordId(), event.owner(), event.content());
    } catch (RuntimeException e) {
      meterRegistry.counter("memory.enrichment.errors").increment();
      log.warn("Failed to enrich memory {}: {}", event.recordId(), e.getMessage());
    }
  }

  /**
   * Embeds {@code content} and attaches the vector, then links the record to the entities it
   * mentions. Failures propagate to the caller.
   */
  public void enrich(String recordId, String owner, String content) {
    float[] embedding = languageModelService.embed(content);
    lifecycleCoordinator.attachEmbedding(recordId, embedding);

    List<String> entities = languageModelService.extractEntities(content);
    if (!entities.isEmpty()) {
      String target = lifecycleCoordinator.resolveId(recordId);
      graphStore.linkMentions(target, owner, entities, clock.instant());
    }
    meterRegistry.counter("memory.enrichment.success").increment();
    log.debug("Enriched memory {} with {} entities", recordId, entities.size());
  }
}
