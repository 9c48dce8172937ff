package com.flamingo.ai.memoryengine.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.flamingo.ai.memoryengine.domain.model.EntityNode;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** Elasticsearch index of knowledge-graph entity nodes. */
@Service
public class EntityNodeIndexService extends AbstractElasticsearchIndexService<EntityNode> {

  @Value("${elasticsearch.index.entities:memory-entities}")
  private String indexName;

  public EntityNodeIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put("owner", Property.of(p -> p.keyword(k -> k)));
    properties.put("name", Property.of(p -> p.keyword(k -> k)));
    properties.put("normalizedName", Property.of(p -> p.keyword(k -> k)));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(EntityNode node) {
    Map<String, Object> doc = new HashMap<>();
    doc.put("owner", node.owner());
    doc.put("name", node.name());
    doc.put("normalizedName", normalize(node.name()));
    return doc;
  }

  @Override
  protected EntityNode convertFromDocument(String id, Map<String, Object> source) {
    return new EntityNode(id, stringOf(source.get("owner")), stringOf(source.get("name")));
  }

  @Override
  protected String getUpstreamName() {
    return "graphStore";
  }

  @Override
  protected String getMetricPrefix() {
    return "memory.graph.entities";
  }

  /** Builds the bulk document of a node, for callers batching writes. */
  Map<String, Object> toDocument(EntityNode node) {
    return convertToDocument(node);
  }

  /**
   * Resolves entity names to node identifiers across every owner. Used when a search is not
   * restricted to one owner, so identifiers cannot be derived locally.
   */
  public Set<String> findIdsByNames(Collection<String> names, int limit) {
    List<FieldValue> normalized =
        names.stream().map(EntityNodeIndexService::normalize).map(FieldValue::of).toList();
    if (normalized.isEmpty()) {
      return Set.of();
    }
    Query query =
        Query.of(q -> q.terms(t -> t.field("normalizedName").terms(v -> v.value(normalized))));
    SearchRequest request =
        SearchRequest.of(
            s -> s.index(indexName).size(limit).query(query).source(src -> src.fetch(false)));
    Set<String> ids = new LinkedHashSet<>();
    search(request, "findIdsByNames").forEach(hit -> ids.add(hit.id()));
    return ids;
  }

  static String normalize(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
