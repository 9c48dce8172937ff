package com.flamingo.ai.memoryengine.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch.core.GetResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.memoryengine.exception.UpstreamUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class for the engine's Elasticsearch indexes.
 *
 * <p>Owns index bootstrap (create, or validate and extend the mapping of an existing index),
 * document conversion hooks and the mapping of client failures onto {@link
 * UpstreamUnavailableException}. Failures are always rethrown: no method here turns an error into
 * an empty result.
 *
 * @param <T> the type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  public abstract String getIndexName();

  /** Field name to property definition of every mapped field. */
  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  /**
   * Converts a stored source back into the entity.
   *
   * @param id the document {@code _id}, which is metadata and not part of the source
   * @param source the document source
   */
  protected abstract T convertFromDocument(String id, Map<String, Object> source);

  /** Upstream name reported in errors ("memoryStore", "graphStore"). */
  protected abstract String getUpstreamName();

  /** Prefix for this index's counters (e.g. "memory.store", "memory.graph"). */
  protected abstract String getMetricPrefix();

  @PostConstruct
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        updateAndValidateMappings();
      }
    } catch (Exception e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // dynamic=false: undeclared fields stay in _source but are never auto-mapped
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds missing fields to an existing index and fails fast on type mismatches, which
   * Elasticsearch cannot fix in place.
   */
  private void updateAndValidateMappings() throws IOException {
    Map<String, Property> expectedProperties = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      Property actual = actualProperties.get(entry.getKey());
      if (actual == null) {
        missingFields.put(entry.getKey(), entry.getValue());
      } else if (entry.getValue()._kind() != actual._kind()) {
        mismatches.add(
            String.format(
                "field '%s' expected type '%s' but found '%s'",
                entry.getKey(), entry.getValue()._kind(), actual._kind()));
      }
    }
    if (!mismatches.isEmpty()) {
      log.error("Mapping mismatch in index '{}': {}", getIndexName(), mismatches);
      throw new IllegalStateException(
          "Index '"
              + getIndexName()
              + "' has incompatible field type(s), delete and recreate it: "
              + String.join("; ", mismatches));
    }

    if (!missingFields.isEmpty()) {
      PutMappingRequest putRequest =
          PutMappingRequest.of(p -> p.index(getIndexName()).properties(missingFields));
      elasticsearchClient.indices().putMapping(putRequest);
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          getIndexName(),
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified correctly.", getIndexName());
    }
  }

  /** Point read of one document. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  protected Optional<GetResponse<Map>> getRaw(String id) {
    try {
      GetResponse<Map> response =
          elasticsearchClient.get(g -> g.index(getIndexName()).id(id), Map.class);
      if (!response.found() || response.source() == null) {
        return Optional.empty();
      }
      return Optional.of(response);
    } catch (IOException | ElasticsearchException e) {
      throw unavailable("get " + id, e);
    }
  }

  /** Unconditional write of one document. */
  protected void putDocument(String id, T entity) {
    try {
      Map<String, Object> document = convertToDocument(entity);
      elasticsearchClient.index(i -> i.index(getIndexName()).id(id).document(document));
    } catch (IOException | ElasticsearchException e) {
      throw unavailable("index " + id, e);
    }
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  protected List<Hit<Map>> search(SearchRequest request, String operation) {
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<Hit<Map>> hits = response.hits().hits();
      log.debug("[{}] index={} returned={}", operation, getIndexName(), hits.size());
      return hits;
    } catch (IOException | ElasticsearchException e) {
      throw unavailable(operation, e);
    }
  }

  @SuppressWarnings("unchecked")
  protected T fromHit(@SuppressWarnings("rawtypes") Hit<Map> hit) {
    return convertFromDocument(hit.id(), (Map<String, Object>) hit.source());
  }

  /**
   * Maps a client failure onto the engine's error model. Transport errors, overload (429) and
   * server errors are retryable; other rejections are not.
   */
  protected UpstreamUnavailableException unavailable(String operation, Exception e) {
    boolean retryable = true;
    if (e instanceof ElasticsearchException ese) {
      retryable = ese.status() == 429 || ese.status() >= 500;
    }
    meterRegistry.counter(getMetricPrefix() + ".errors").increment();
    log.warn(
        "Elasticsearch {} failed on index {} (retryable={}): {}",
        operation,
        getIndexName(),
        retryable,
        e.getMessage());
    return new UpstreamUnavailableException(
        getUpstreamName(),
        String.format("Elasticsearch %s failed on %s", operation, getIndexName()),
        e,
        retryable);
  }

  protected static boolean isConflict(ElasticsearchException e) {
    return e.status() == 409;
  }

  protected static boolean isNotFound(ElasticsearchException e) {
    return e.status() == 404;
  }

  // Source value conversions. Numbers arrive as Integer, Long or Double depending on magnitude.

  protected static Long toEpochMillis(Instant instant) {
    return instant != null ? instant.toEpochMilli() : null;
  }

  protected static Instant instantOf(Object value) {
    return value instanceof Number n ? Instant.ofEpochMilli(n.longValue()) : null;
  }

  /** The number in {@code value}, or {@code missing} when it is absent or not a number. */
  protected static double doubleOf(Object value, double missing) {
    return value instanceof Number n ? n.doubleValue() : missing;
  }

  protected static long longOf(Object value, long missing) {
    return value instanceof Number n ? n.longValue() : missing;
  }

  protected static String stringOf(Object value) {
    return value != null ? value.toString() : null;
  }
}
