package com.flamingo.ai.memoryengine.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.model.EntityNode;
import com.flamingo.ai.memoryengine.domain.model.GraphHit;
import com.flamingo.ai.memoryengine.domain.model.RelationEdge;
import com.flamingo.ai.memoryengine.exception.UpstreamUnavailableException;
import com.flamingo.ai.memoryengine.store.GraphStore;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * {@link GraphStore} backed by an Elasticsearch relations index plus the entity node index.
 *
 * <p>Edges are written create-only under deterministic identifiers, so re-linking the same record
 * keeps the original {@code recordedAt}. Superseded edges are closed by setting {@code validTo}
 * rather than deleted.
 */
@Service
@Slf4j
public class ElasticsearchGraphStore extends AbstractElasticsearchIndexService<RelationEdge>
    implements GraphStore {

  private static final int EDGES_PER_NODE = 100;
  private static final int MAX_EDGES_PER_HOP = 10_000;

  private final EntityNodeIndexService nodeIndex;

  @Value("${elasticsearch.index.relations:memory-relations}")
  private String indexName;

  public ElasticsearchGraphStore(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      EntityNodeIndexService nodeIndex) {
    super(elasticsearchClient, meterRegistry);
    this.nodeIndex = nodeIndex;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected String getUpstreamName() {
    return "graphStore";
  }

  @Override
  protected String getMetricPrefix() {
    return "memory.graph";
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put("owner", Property.of(p -> p.keyword(k -> k)));
    properties.put("sourceId", Property.of(p -> p.keyword(k -> k)));
    properties.put("targetId", Property.of(p -> p.keyword(k -> k)));
    properties.put("relationType", Property.of(p -> p.keyword(k -> k)));
    properties.put("weight", Property.of(p -> p.double_(d -> d)));
    properties.put("validFrom", Property.of(p -> p.long_(l -> l)));
    properties.put("validTo", Property.of(p -> p.long_(l -> l)));
    properties.put("recordedAt", Property.of(p -> p.long_(l -> l)));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(RelationEdge edge) {
    Map<String, Object> doc = new HashMap<>();
    doc.put("owner", edge.owner());
    doc.put("sourceId", edge.sourceId());
    doc.put("targetId", edge.targetId());
    doc.put("relationType", edge.relationType());
    doc.put("weight", edge.weight());
    doc.put("validFrom", toEpochMillis(edge.validFrom()));
    doc.put("validTo", toEpochMillis(edge.validTo()));
    doc.put("recordedAt", toEpochMillis(edge.recordedAt()));
    return doc;
  }

  @Override
  protected RelationEdge convertFromDocument(String id, Map<String, Object> source) {
    return RelationEdge.builder()
        .id(id)
        .owner(stringOf(source.get("owner")))
        .sourceId(stringOf(source.get("sourceId")))
        .targetId(stringOf(source.get("targetId")))
        .relationType(stringOf(source.get("relationType")))
        .weight(doubleOf(source.get("weight"), 0.0))
        .validFrom(instantOf(source.get("validFrom")))
        .validTo(instantOf(source.get("validTo")))
        .recordedAt(instantOf(source.get("recordedAt")))
        .build();
  }

  @Override
  @Retry(name = "graphStore")
  public void linkMentions(
      String recordId, String owner, Collection<String> entityNames, Instant now) {
    // one node per normalized name, first spelling wins
    Map<String, EntityNode> nodes = new TreeMap<>();
    for (String name : entityNames) {
      if (name != null && !name.isBlank()) {
        EntityNode node = EntityNode.of(owner, name);
        nodes.putIfAbsent(node.id(), node);
      }
    }
    if (nodes.isEmpty()) {
      return;
    }

    BulkRequest.Builder bulk = new BulkRequest.Builder();
    for (EntityNode node : nodes.values()) {
      Map<String, Object> doc = nodeIndex.toDocument(node);
      bulk.operations(
          op -> op.index(i -> i.index(nodeIndex.getIndexName()).id(node.id()).document(doc)));
      createEdge(bulk, edge(owner, node.id(), recordId, RelationEdge.MENTIONS, now));
    }
    List<String> nodeIds = new ArrayList<>(nodes.keySet());
    for (int i = 0; i < nodeIds.size(); i++) {
      for (int j = i + 1; j < nodeIds.size(); j++) {
        createEdge(
            bulk, edge(owner, nodeIds.get(i), nodeIds.get(j), RelationEdge.CO_OCCURS, now));
      }
    }
    executeBulk(bulk, "linkMentions " + recordId);
    meterRegistry.counter("memory.graph.linked").increment();
    log.debug("Linked record {} to {} entities", recordId, nodes.size());
  }

  @Override
  @Retry(name = "graphStore")
  public void putRelation(RelationEdge edge) {
    putDocument(edge.id(), edge);
  }

  @Override
  @Retry(name = "graphStore")
  public void relinkRecord(String owner, String fromRecordId, String toRecordId, Instant now) {
    List<RelationEdge> mentions =
        findEdges(
            RelationEdge.MENTIONS,
            owner,
            SearchFilterQueries.term("targetId", fromRecordId),
            MAX_EDGES_PER_HOP);
    BulkRequest.Builder bulk = new BulkRequest.Builder();
    int moved = 0;
    for (RelationEdge mention : mentions) {
      if (!mention.isActiveAt(now)) {
        continue;
      }
      RelationEdge closed =
          RelationEdge.builder()
              .id(mention.id())
              .owner(mention.owner())
              .sourceId(mention.sourceId())
              .targetId(mention.targetId())
              .relationType(mention.relationType())
              .weight(mention.weight())
              .validFrom(mention.validFrom())
              .validTo(now)
              .recordedAt(mention.recordedAt())
              .build();
      Map<String, Object> closedDoc = convertToDocument(closed);
      bulk.operations(op -> op.index(i -> i.index(indexName).id(closed.id()).document(closedDoc)));
      createEdge(bulk, edge(owner, mention.sourceId(), toRecordId, RelationEdge.MENTIONS, now));
      moved++;
    }
    if (moved > 0) {
      executeBulk(bulk, "relinkRecord " + fromRecordId);
      log.debug("Moved {} mention edges from {} to {}", moved, fromRecordId, toRecordId);
    }
  }

  /**
   * Breadth-first expansion. Records mentioned by a seed entity are at hop 0; every {@code
   * CO_OCCURS} step away from the seeds adds one hop, up to {@code maxDepth} steps.
   */
  @Override
  @Retry(name = "graphStore")
  @Timed(value = "memory.graph.traverse", description = "Time for bounded graph expansion")
  public List<GraphHit> traverse(
      Set<String> seeds,
      String owner,
      int maxDepth,
      int maxFrontier,
      int limit,
      Instant asOf) {
    int depth = Math.min(maxDepth, MemoryEngineConfig.MAX_GRAPH_DEPTH);
    Set<String> seedIds = new TreeSet<>();
    if (owner != null) {
      seeds.forEach(name -> seedIds.add(EntityNode.idFor(owner, name)));
    } else {
      seedIds.addAll(nodeIndex.findIdsByNames(seeds, maxFrontier));
    }
    Set<String> frontier = cap(seedIds, maxFrontier);
    Set<String> visited = new HashSet<>(frontier);
    Map<String, Integer> hopsByRecord = new LinkedHashMap<>();

    for (int hops = 0; hops <= depth && !frontier.isEmpty(); hops++) {
      int edgeBudget = Math.min(MAX_EDGES_PER_HOP, frontier.size() * EDGES_PER_NODE);
      for (RelationEdge mention :
          findEdges(RelationEdge.MENTIONS, owner, anyOf("sourceId", frontier), edgeBudget)) {
        if (mention.isActiveAt(asOf)) {
          hopsByRecord.putIfAbsent(mention.targetId(), hops);
        }
      }
      if (hops == depth || hopsByRecord.size() >= limit) {
        break;
      }
      Set<String> next = new TreeSet<>();
      Query fromFrontier = anyOf("sourceId", frontier);
      Query toFrontier = anyOf("targetId", frontier);
      Query touchingFrontier =
          Query.of(
              q ->
                  q.bool(
                      b -> b.should(fromFrontier).should(toFrontier).minimumShouldMatch("1")));
      for (RelationEdge cooccurs :
          findEdges(RelationEdge.CO_OCCURS, owner, touchingFrontier, edgeBudget)) {
        if (!cooccurs.isActiveAt(asOf)) {
          continue;
        }
        for (String neighbour : List.of(cooccurs.sourceId(), cooccurs.targetId())) {
          if (!visited.contains(neighbour)) {
            next.add(neighbour);
          }
        }
      }
      frontier = cap(next, maxFrontier);
      visited.addAll(frontier);
    }

    return hopsByRecord.entrySet().stream()
        .map(e -> new GraphHit(e.getKey(), e.getValue(), 1.0 / (1 + e.getValue())))
        .sorted(Comparator.comparingInt(GraphHit::hops).thenComparing(GraphHit::recordId))
        .limit(limit)
        .toList();
  }

  @SuppressWarnings("rawtypes")
  private List<RelationEdge> findEdges(String relationType, String owner, Query match, int size) {
    List<Query> clauses = new ArrayList<>();
    clauses.add(SearchFilterQueries.term("relationType", relationType));
    if (owner != null) {
      clauses.add(SearchFilterQueries.term("owner", owner));
    }
    clauses.add(match);
    SearchRequest request =
        SearchRequest.of(
            s -> s.index(indexName).size(size).query(SearchFilterQueries.allOf(clauses)));
    List<RelationEdge> edges = new ArrayList<>();
    for (Hit<Map> hit : search(request, "findEdges " + relationType)) {
      edges.add(fromHit(hit));
    }
    return edges;
  }

  private static Query anyOf(String field, Collection<String> values) {
    List<FieldValue> terms = values.stream().map(FieldValue::of).toList();
    return Query.of(q -> q.terms(t -> t.field(field).terms(v -> v.value(terms))));
  }

  private static Set<String> cap(Set<String> ids, int max) {
    Set<String> capped = new TreeSet<>();
    for (String id : ids) {
      if (capped.size() == max) {
        break;
      }
      capped.add(id);
    }
    return capped;
  }

  private static RelationEdge edge(
      String owner, String sourceId, String targetId, String relationType, Instant now) {
    return RelationEdge.builder()
        .id(relationType + ":" + sourceId + "->" + targetId)
        .owner(owner)
        .sourceId(sourceId)
        .targetId(targetId)
        .relationType(relationType)
        .weight(1.0)
        .validFrom(now)
        .recordedAt(now)
        .build();
  }

  private void createEdge(BulkRequest.Builder bulk, RelationEdge edge) {
    Map<String, Object> doc = convertToDocument(edge);
    bulk.operations(op -> op.create(c -> c.index(indexName).id(edge.id()).document(doc)));
  }

  /** Executes a bulk request; create conflicts mean the edge already exists and are ignored. */
  private void executeBulk(BulkRequest.Builder bulk, String operation) {
    try {
      BulkResponse response = elasticsearchClient.bulk(bulk.build());
      if (!response.errors()) {
        return;
      }
      for (BulkResponseItem item : response.items()) {
        if (item.error() != null && item.status() != 409) {
          throw new UpstreamUnavailableException(
              getUpstreamName(),
              String.format(
                  "Bulk %s failed on %s: %s", operation, item.index(), item.error().reason()),
              null,
              item.status() == 429 || item.status() >= 500);
        }
      }
    } catch (IOException | ElasticsearchException e) {
      throw unavailable(operation, e);
    }
  }
}
