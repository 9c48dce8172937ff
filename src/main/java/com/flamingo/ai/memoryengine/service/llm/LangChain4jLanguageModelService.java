package com.flamingo.ai.memoryengine.service.llm;

import com.flamingo.ai.memoryengine.agent.EntityExtractionAgent;
import com.flamingo.ai.memoryengine.agent.MemorySummaryAgent;
import com.flamingo.ai.memoryengine.agent.QueryIntentAgent;
import com.flamingo.ai.memoryengine.agent.dto.ExtractedEntities;
import com.flamingo.ai.memoryengine.agent.dto.IntentClassification;
import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.enums.LlmErrorKind;
import com.flamingo.ai.memoryengine.domain.enums.QueryIntent;
import com.flamingo.ai.memoryengine.exception.DimensionMismatchException;
import com.flamingo.ai.memoryengine.exception.LlmServiceException;
import com.flamingo.ai.memoryengine.exception.UpstreamUnavailableException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.exception.TimeoutException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link LanguageModelService} on LangChain4j models and agents.
 *
 * <p>Outbound calls are capped by the {@code llm} bulkhead and retried by the {@code llm} retry
 * when the failure is transient. Embeddings go through a size-bounded Caffeine cache keyed by the
 * exact input text.
 */
@Service
@Slf4j
public class LangChain4jLanguageModelService implements LanguageModelService {

  // Conservative for dense CJK content, well below the embedding model's token limit
  static final int MAX_CHARS_PER_EMBEDDING = 8000;
  static final int MAX_ENTITIES = 10;

  private final EmbeddingModel embeddingModel;
  private final MemorySummaryAgent summaryAgent;
  private final QueryIntentAgent intentAgent;
  private final EntityExtractionAgent entityAgent;
  private final MeterRegistry meterRegistry;
  private final int dimensions;
  private final Cache<String, float[]> embeddingCache;

  public LangChain4jLanguageModelService(
      EmbeddingModel embeddingModel,
      MemorySummaryAgent summaryAgent,
      QueryIntentAgent intentAgent,
      EntityExtractionAgent entityAgent,
      MeterRegistry meterRegistry,
      MemoryEngineConfig config) {
    this.embeddingModel = embeddingModel;
    this.summaryAgent = summaryAgent;
    this.intentAgent = intentAgent;
    this.entityAgent = entityAgent;
    this.meterRegistry = meterRegistry;
    this.dimensions = config.getEmbedding().getDimensions();
    this.embeddingCache =
        Caffeine.newBuilder()
            .maximumSize(config.getEmbedding().getCacheMaxEntries())
            .expireAfterWrite(config.getEmbedding().getCacheTtl())
            .build();
  }

  @Override
  @Retry(name = "llm")
  @Bulkhead(name = "llm")
  public float[] embed(String text) {
    String input = text;
    if (input.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          input.length(),
          MAX_CHARS_PER_EMBEDDING);
      input = input.substring(0, MAX_CHARS_PER_EMBEDDING);
    }
    float[] cached = embeddingCache.getIfPresent(input);
    if (cached != null) {
      meterRegistry.counter("llm.embedding.cache.hits").increment();
      return cached.clone();
    }
    String embeddingInput = input;
    Response<Embedding> response = call("embed", () -> embeddingModel.embed(embeddingInput));
    if (response == null || response.content() == null) {
      throw invalid("embed", "empty embedding response");
    }
    float[] vector = response.content().vector();
    if (vector.length != dimensions) {
      throw new DimensionMismatchException(dimensions, vector.length);
    }
    embeddingCache.put(input, vector.clone());
    return vector;
  }

  @Override
  @Retry(name = "llm")
  @Bulkhead(name = "llm")
  public String summarize(List<String> texts) {
    String memories = texts.stream().map(t -> "- " + t.strip()).collect(Collectors.joining("\n"));
    String summary = call("summarize", () -> summaryAgent.summarize(memories));
    if (summary == null || summary.isBlank()) {
      throw invalid("summarize", "empty summary");
    }
    return summary.strip();
  }

  @Override
  @Retry(name = "llm")
  @Bulkhead(name = "llm")
  public QueryIntent classifyIntent(String text) {
    IntentClassification result = call("classifyIntent", () -> intentAgent.classify(text));
    if (result == null || result.intent() == null) {
      throw invalid("classifyIntent", "missing intent");
    }
    try {
      return QueryIntent.valueOf(result.intent().trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw invalid("classifyIntent", "unknown intent '" + result.intent() + "'");
    }
  }

  @Override
  @Retry(name = "llm")
  @Bulkhead(name = "llm")
  public List<String> extractEntities(String text) {
    ExtractedEntities result = call("extractEntities", () -> entityAgent.extract(text));
    if (result == null || result.entities() == null) {
      throw invalid("extractEntities", "missing entity list");
    }
    // de-duplicate case-insensitively, keep the first spelling and the model's order
    Map<String, String> unique = new LinkedHashMap<>();
    for (String entity : result.entities()) {
      if (entity != null && !entity.isBlank()) {
        unique.putIfAbsent(entity.strip().toLowerCase(Locale.ROOT), entity.strip());
      }
    }
    return unique.values().stream().limit(MAX_ENTITIES).toList();
  }

  /** Runs one model call, timing it and translating LangChain4j failures. */
  private <T> T call(String operation, Supplier<T> invocation) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      T result = invocation.get();
      meterRegistry
          .counter("llm.requests", "operation", operation, "outcome", "success")
          .increment();
      return result;
    } catch (RateLimitException e) {
      throw failure(
          operation,
          new LlmServiceException(LlmErrorKind.RATE_LIMITED, message(operation, e), e));
    } catch (TimeoutException e) {
      throw failure(
          operation, new LlmServiceException(LlmErrorKind.TIMEOUT, message(operation, e), e));
    } catch (RetriableException e) {
      throw failure(operation, new UpstreamUnavailableException("llm", message(operation, e), e));
    } catch (NonRetriableException e) {
      throw failure(
          operation, new UpstreamUnavailableException("llm", message(operation, e), e, false));
    } catch (RuntimeException e) {
      // output that could not be parsed into the agent's return type
      throw failure(
          operation,
          new LlmServiceException(LlmErrorKind.INVALID_RESPONSE, message(operation, e), e));
    } finally {
      sample.stop(meterRegistry.timer("llm.duration", "operation", operation));
    }
  }

  private LlmServiceException invalid(String operation, String detail) {
    return failure(
        operation,
        new LlmServiceException(
            LlmErrorKind.INVALID_RESPONSE, "LLM " + operation + " returned " + detail));
  }

  private <E extends UpstreamUnavailableException> E failure(String operation, E exception) {
    meterRegistry
        .counter("llm.requests", "operation", operation, "outcome", exception.getCode())
        .increment();
    log.warn("LLM {} failed [{}]: {}", operation, exception.getCode(), exception.getMessage());
    return exception;
  }

  private static String message(String operation, Exception e) {
    return "LLM " + operation + " failed: " + e.getMessage();
  }
}
