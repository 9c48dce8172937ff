package com.flamingo.ai.memoryengine.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** Elasticsearch index of merge tombstones, keyed by the discarded record identifier. */
@Service
@Slf4j
public class MemoryAliasIndexService extends AbstractElasticsearchIndexService<MemoryAlias> {

  private final Clock clock;

  @Value("${elasticsearch.index.aliases:memory-aliases}")
  private String indexName;

  public MemoryAliasIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry, Clock clock) {
    super(elasticsearchClient, meterRegistry);
    this.clock = clock;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put("discardedId", Property.of(p -> p.keyword(k -> k)));
    properties.put("survivorId", Property.of(p -> p.keyword(k -> k)));
    properties.put("createdAt", Property.of(p -> p.long_(l -> l)));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(MemoryAlias alias) {
    Map<String, Object> doc = new HashMap<>();
    doc.put("discardedId", alias.discardedId());
    doc.put("survivorId", alias.survivorId());
    doc.put("createdAt", toEpochMillis(alias.createdAt()));
    return doc;
  }

  @Override
  protected MemoryAlias convertFromDocument(String id, Map<String, Object> source) {
    return new MemoryAlias(
        id, stringOf(source.get("survivorId")), instantOf(source.get("createdAt")));
  }

  @Override
  protected String getUpstreamName() {
    return "memoryStore";
  }

  @Override
  protected String getMetricPrefix() {
    return "memory.alias";
  }

  /** Writes or overwrites the tombstone for {@code discardedId}. */
  public void put(String discardedId, String survivorId) {
    putDocument(discardedId, new MemoryAlias(discardedId, survivorId, clock.instant()));
    log.debug("Tombstoned {} -> {}", discardedId, survivorId);
  }

  @SuppressWarnings("unchecked")
  public Optional<String> find(String discardedId) {
    return getRaw(discardedId)
        .map(response -> convertFromDocument(response.id(), response.source()))
        .map(MemoryAlias::survivorId);
  }
}
