package com.flamingo.ai.memoryengine.service.retrieval;

import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.enums.QueryIntent;
import com.flamingo.ai.memoryengine.domain.enums.RetrievalSignal;
import com.flamingo.ai.memoryengine.domain.enums.SignalStatus;
import com.flamingo.ai.memoryengine.domain.model.GraphHit;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.domain.model.RetrievalCandidate;
import com.flamingo.ai.memoryengine.domain.model.ScoredRecord;
import com.flamingo.ai.memoryengine.domain.model.SearchFilters;
import com.flamingo.ai.memoryengine.domain.model.SearchRequest;
import com.flamingo.ai.memoryengine.domain.model.SearchResult;
import com.flamingo.ai.memoryengine.exception.SearchCancelledException;
import com.flamingo.ai.memoryengine.exception.UpstreamUnavailableException;
import com.flamingo.ai.memoryengine.exception.ValidationException;
import com.flamingo.ai.memoryengine.service.dedup.DeduplicationEngine;
import com.flamingo.ai.memoryengine.service.llm.LanguageModelService;
import com.flamingo.ai.memoryengine.store.GraphStore;
import com.flamingo.ai.memoryengine.store.MemoryStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Hybrid retrieval: vector, keyword and graph candidate generation in parallel, caller filters,
 * weighted Reciprocal Rank Fusion and budget-bounded context assembly.
 *
 * <p>A failed or late signal degrades the search instead of aborting it: fusion runs on whatever
 * the other signals returned and the result is flagged partial. Only when every signal that was
 * attempted failed does the search itself fail.
 */
@Service
@Slf4j
public class HybridRetriever {

  private final MemoryStore memoryStore;
  private final GraphStore graphStore;
  private final LanguageModelService languageModelService;
  private final DeduplicationEngine deduplicationEngine;
  private final ReciprocalRankFusion reciprocalRankFusion;
  private final ContextAssembler contextAssembler;
  private final MemoryEngineConfig.Retrieval retrieval;
  private final Executor retrievalExecutor;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public HybridRetriever(
      MemoryStore memoryStore,
      GraphStore graphStore,
      LanguageModelService languageModelService,
      DeduplicationEngine deduplicationEngine,
      ReciprocalRankFusion reciprocalRankFusion,
      ContextAssembler contextAssembler,
      MemoryEngineConfig config,
      @Qualifier("retrievalExecutor") Executor retrievalExecutor,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.memoryStore = memoryStore;
    this.graphStore = graphStore;
    this.languageModelService = languageModelService;
    this.deduplicationEngine = deduplicationEngine;
    this.reciprocalRankFusion = reciprocalRankFusion;
    this.contextAssembler = contextAssembler;
    this.retrieval = config.getRetrieval();
    this.retrievalExecutor = retrievalExecutor;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /**
   * Runs a hybrid search.
   *
   * @throws ValidationException if the query is blank or a bound is not positive
   * @throws SearchCancelledException if the calling thread is interrupted while waiting
   * @throws UpstreamUnavailableException if every attempted signal failed or timed out
   */
  @Timed(value = "memory.search", description = "Time for hybrid search over memories")
  public SearchResult search(SearchRequest request) {
    validate(request);
    String query = request.query().trim();
    SearchFilters filters = request.effectiveFilters();
    int candidateLimit = retrieval.getCandidateLimit();
    Duration deadline =
        request.deadline() != null ? request.deadline() : retrieval.getSignalTimeout();
    log.debug(
        "Starting hybrid search: query='{}' limit={} filters={}", query, request.limit(), filters);

    Map<RetrievalSignal, CompletableFuture<List<ScoredRecord>>> signals =
        new EnumMap<>(RetrievalSignal.class);
    signals.put(
        RetrievalSignal.VECTOR,
        async(
            () ->
                memoryStore.vectorTopK(
                    languageModelService.embed(query), filters, candidateLimit)));
    signals.put(
        RetrievalSignal.KEYWORD,
        async(() -> memoryStore.keywordTopK(query, filters, candidateLimit)));
    if (retrieval.getGraph().isEnabled()) {
      signals.put(
          RetrievalSignal.GRAPH, async(() -> graphCandidates(query, filters, candidateLimit)));
    }
    CompletableFuture<QueryIntent> intentFuture =
        retrieval.getIntentWeighting().isEnabled()
            ? async(() -> languageModelService.classifyIntent(query))
            : null;

    awaitSignals(signals, intentFuture, deadline);

    Map<RetrievalSignal, SignalStatus> statuses = new EnumMap<>(RetrievalSignal.class);
    Map<RetrievalSignal, List<ScoredRecord>> rankedLists = new EnumMap<>(RetrievalSignal.class);
    for (RetrievalSignal signal : RetrievalSignal.values()) {
      CompletableFuture<List<ScoredRecord>> future = signals.get(signal);
      if (future == null) {
        statuses.put(signal, SignalStatus.SKIPPED);
        continue;
      }
      Outcome<List<ScoredRecord>> outcome = outcomeOf(future);
      statuses.put(signal, outcome.status());
      if (outcome.status() == SignalStatus.OK) {
        List<ScoredRecord> filtered =
            outcome.value().stream().filter(s -> filters.matches(s.record())).toList();
        rankedLists.put(signal, filtered);
        log.debug("Signal {} returned {} candidates after filtering", signal, filtered.size());
      } else {
        meterRegistry
            .counter(
                "retrieval.signal.failures",
                "signal",
                signal.name(),
                "status",
                outcome.status().name())
            .increment();
        log.warn(
            "Retrieval signal {} {} for query '{}': {}",
            signal,
            outcome.status(),
            query,
            outcome.error() != null ? outcome.error().getMessage() : "deadline " + deadline);
      }
    }
    if (rankedLists.isEmpty()) {
      meterRegistry.counter("retrieval.failed").increment();
      throw new UpstreamUnavailableException(
          "retrieval", "every retrieval signal failed: " + statuses);
    }

    QueryIntent intent = intentOf(intentFuture);
    List<RetrievalCandidate> fused =
        reciprocalRankFusion.fuse(rankedLists, weightsFor(intent), retrieval.getRrfK());

    int tokenBudget =
        request.tokenBudget() != null ? request.tokenBudget() : retrieval.getDefaultTokenBudget();
    ContextAssembler.AssembledContext assembled =
        contextAssembler.assemble(fused, request.limit(), tokenBudget);

    boolean partial = statuses.values().stream().anyMatch(SignalStatus::isDegraded);
    if (partial) {
      meterRegistry.counter("retrieval.partial").increment();
    }
    meterRegistry.counter("retrieval.success").increment();
    log.debug(
        "Hybrid search fused {} candidates, accepted {} ({} tokens, {} over budget), partial={}",
        fused.size(),
        assembled.accepted().size(),
        assembled.tokensUsed(),
        assembled.droppedForBudget(),
        partial);

    return SearchResult.builder()
        .candidates(assembled.accepted())
        .partial(partial)
        .signalStatuses(statuses)
        .intent(intent)
        .context(assembled.context())
        .tokensUsed(assembled.tokensUsed())
        .droppedForBudget(assembled.droppedForBudget())
        .build();
  }

  /** Weight per signal, with the signal favoured by {@code intent} boosted when enabled. */
  Map<RetrievalSignal, Double> weightsFor(QueryIntent intent) {
    Map<RetrievalSignal, Double> weights = new EnumMap<>(RetrievalSignal.class);
    for (RetrievalSignal signal : RetrievalSignal.values()) {
      weights.put(signal, retrieval.getWeights().weightOf(signal));
    }
    if (intent != null) {
      RetrievalSignal favoured =
          switch (intent) {
            case FACT -> RetrievalSignal.KEYWORD;
            case SUMMARY -> RetrievalSignal.VECTOR;
            case ANALYSIS -> RetrievalSignal.GRAPH;
          };
      weights.computeIfPresent(favoured, (s, w) -> w * retrieval.getIntentWeighting().getBoost());
    }
    return weights;
  }

  /**
   * Graph signal: entities recognised in the query seed a bounded expansion; hits are resolved
   * through merge tombstones and loaded from the record index, nearest first.
   */
  private List<ScoredRecord> graphCandidates(String query, SearchFilters filters, int limit) {
    List<String> entities = languageModelService.extractEntities(query);
    if (entities.isEmpty()) {
      log.debug("No entities recognised in query, graph signal has no seeds");
      return List.of();
    }
    MemoryEngineConfig.Graph graph = retrieval.getGraph();
    List<GraphHit> hits =
        graphStore.traverse(
            new LinkedHashSet<>(entities),
            filters.owner(),
            graph.effectiveMaxDepth(),
            graph.getMaxFrontier(),
            limit,
            clock.instant());

    Map<String, Double> scoreById = new LinkedHashMap<>();
    for (GraphHit hit : hits) {
      scoreById.putIfAbsent(deduplicationEngine.resolveAlias(hit.recordId()), hit.score());
    }
    Map<String, MemoryRecord> recordsById = new LinkedHashMap<>();
    for (MemoryRecord record : memoryStore.findAllById(scoreById.keySet())) {
      recordsById.put(record.getId(), record);
    }
    List<ScoredRecord> ranked = new ArrayList<>(scoreById.size());
    scoreById.forEach(
        (id, score) -> {
          MemoryRecord record = recordsById.get(id);
          if (record != null) {
            ranked.add(new ScoredRecord(record, score));
          }
        });
    return ranked;
  }

  /**
   * Waits for every branch until {@code deadline}. Branches still running after the deadline are
   * cancelled and their late results discarded; an interrupt aborts the whole search.
   */
  private void awaitSignals(
      Map<RetrievalSignal, CompletableFuture<List<ScoredRecord>>> signals,
      CompletableFuture<QueryIntent> intentFuture,
      Duration deadline) {
    List<CompletableFuture<?>> all = new ArrayList<>(signals.values());
    if (intentFuture != null) {
      all.add(intentFuture);
    }
    CompletableFuture<Void> joined =
        CompletableFuture.allOf(all.toArray(new CompletableFuture<?>[0]));
    try {
      joined.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      log.debug("Search deadline {} reached, abandoning unfinished signals", deadline);
      all.forEach(future -> future.cancel(true));
    } catch (ExecutionException e) {
      // at least one branch failed; each is inspected individually
      log.debug("Retrieval branch failed: {}", e.getMessage());
    } catch (InterruptedException e) {
      all.forEach(future -> future.cancel(true));
      Thread.currentThread().interrupt();
      throw new SearchCancelledException("Search cancelled by caller", e);
    }
  }

  /** Classified intent, or null when classification is disabled, late or failed. */
  private QueryIntent intentOf(CompletableFuture<QueryIntent> intentFuture) {
    if (intentFuture == null) {
      return null;
    }
    Outcome<QueryIntent> outcome = outcomeOf(intentFuture);
    if (outcome.status() != SignalStatus.OK) {
      log.debug("Intent classification {}, using configured weights", outcome.status());
      return null;
    }
    return outcome.value();
  }

  private <T> CompletableFuture<T> async(Supplier<T> supplier) {
    return CompletableFuture.supplyAsync(supplier, retrievalExecutor);
  }

  private static <T> Outcome<T> outcomeOf(CompletableFuture<T> future) {
    if (!future.isDone() || future.isCancelled()) {
      return new Outcome<>(SignalStatus.TIMED_OUT, null, null);
    }
    try {
      return new Outcome<>(SignalStatus.OK, future.getNow(null), null);
    } catch (CompletionException e) {
      return new Outcome<>(SignalStatus.FAILED, null, unwrap(e));
    } catch (CancellationException e) {
      return new Outcome<>(SignalStatus.TIMED_OUT, null, null);
    }
  }

  private static Throwable unwrap(CompletionException e) {
    return e.getCause() != null ? e.getCause() : e;
  }

  private static void validate(SearchRequest request) {
    if (request == null) {
      throw new ValidationException("request", "must not be null");
    }
    if (request.query() == null || request.query().isBlank()) {
      throw new ValidationException("query", "must not be blank");
    }
    if (request.limit() <= 0) {
      throw new ValidationException("limit", "must be > 0, got " + request.limit());
    }
    if (request.tokenBudget() != null && request.tokenBudget() <= 0) {
      throw new ValidationException("tokenBudget", "must be > 0, got " + request.tokenBudget());
    }
    if (request.deadline() != null
        && (request.deadline().isNegative() || request.deadline().isZero())) {
      throw new ValidationException("deadline", "must be positive, got " + request.deadline());
    }
  }

  private record Outcome<T>(SignalStatus status, T value, Throwable error) {}
}
