package com.flamingo.ai.memoryengine.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.OpType;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.MgetResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.get.GetResult;
import co.elastic.clients.elasticsearch.core.mget.MultiGetResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.enums.MemoryTier;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.domain.model.RecordPage;
import com.flamingo.ai.memoryengine.domain.model.ScoredRecord;
import com.flamingo.ai.memoryengine.domain.model.SearchFilters;
import com.flamingo.ai.memoryengine.domain.model.UpsertOutcome;
import com.flamingo.ai.memoryengine.domain.model.VersionedRecord;
import com.flamingo.ai.memoryengine.exception.CorruptedStateException;
import com.flamingo.ai.memoryengine.exception.DimensionMismatchException;
import com.flamingo.ai.memoryengine.exception.UpstreamUnavailableException;
import com.flamingo.ai.memoryengine.store.MemoryStore;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * {@link MemoryStore} backed by an Elasticsearch records index plus the alias index.
 *
 * <p>Create-if-absent uses {@code op_type=create}; conditional updates use {@code
 * if_seq_no}/{@code if_primary_term}. Both surface a lost race as HTTP 409, which this class turns
 * into a retry of the read-modify-write, so concurrent writers on several engine instances still
 * converge.
 */
@Service
@Slf4j
public class ElasticsearchMemoryStore extends AbstractElasticsearchIndexService<MemoryRecord>
    implements MemoryStore {

  private static final int MAX_UPSERT_ATTEMPTS = 16;
  private static final int MAX_KNN_CANDIDATES = 10_000;

  private final MemoryAliasIndexService aliasIndex;
  private final int dimensions;

  @Value("${elasticsearch.index.records:memory-records}")
  private String indexName;

  public ElasticsearchMemoryStore(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      MemoryAliasIndexService aliasIndex,
      MemoryEngineConfig config) {
    super(elasticsearchClient, meterRegistry);
    this.aliasIndex = aliasIndex;
    this.dimensions = config.getEmbedding().getDimensions();
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected String getUpstreamName() {
    return "memoryStore";
  }

  @Override
  protected String getMetricPrefix() {
    return "memory.store";
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put(MemoryRecordFields.RECORD_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(MemoryRecordFields.OWNER, Property.of(p -> p.keyword(k -> k)));
    properties.put(MemoryRecordFields.CONTENT, Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(MemoryRecordFields.CONTENT_HASH, Property.of(p -> p.keyword(k -> k)));
    properties.put(MemoryRecordFields.SUMMARY, Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(MemoryRecordFields.TIER, Property.of(p -> p.keyword(k -> k)));
    properties.put(MemoryRecordFields.BASE_IMPORTANCE, Property.of(p -> p.double_(d -> d)));
    properties.put(MemoryRecordFields.IMPORTANCE, Property.of(p -> p.double_(d -> d)));
    properties.put(MemoryRecordFields.DECAY_WEIGHT, Property.of(p -> p.double_(d -> d)));
    properties.put(MemoryRecordFields.ACCESS_COUNT, Property.of(p -> p.long_(l -> l)));
    properties.put(MemoryRecordFields.CREATED_AT, Property.of(p -> p.long_(l -> l)));
    properties.put(MemoryRecordFields.LAST_ACCESSED_AT, Property.of(p -> p.long_(l -> l)));
    properties.put(MemoryRecordFields.LAST_MODIFIED_AT, Property.of(p -> p.long_(l -> l)));
    properties.put(MemoryRecordFields.TIER_ENTERED_AT, Property.of(p -> p.long_(l -> l)));
    properties.put(MemoryRecordFields.ARCHIVED, Property.of(p -> p.boolean_(b -> b)));
    properties.put(MemoryRecordFields.ARCHIVED_AT, Property.of(p -> p.long_(l -> l)));
    properties.put(MemoryRecordFields.TAGS, Property.of(p -> p.keyword(k -> k)));
    // free-form metadata is kept in _source only
    properties.put(MemoryRecordFields.METADATA, Property.of(p -> p.object(o -> o.enabled(false))));
    properties.put(
        MemoryRecordFields.EMBEDDING,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d -> d.dims(dimensions).index(true).similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(MemoryRecord record) {
    Map<String, Object> doc = new HashMap<>();
    doc.put(MemoryRecordFields.RECORD_ID, record.getId());
    doc.put(MemoryRecordFields.OWNER, record.getOwner());
    doc.put(MemoryRecordFields.CONTENT, record.getContent());
    doc.put(MemoryRecordFields.CONTENT_HASH, record.getContentHash());
    doc.put(MemoryRecordFields.SUMMARY, record.getSummary());
    doc.put(MemoryRecordFields.TIER, record.getTier() != null ? record.getTier().name() : null);
    doc.put(MemoryRecordFields.BASE_IMPORTANCE, record.getBaseImportance());
    doc.put(MemoryRecordFields.IMPORTANCE, record.getImportance());
    doc.put(MemoryRecordFields.DECAY_WEIGHT, record.getDecayWeight());
    doc.put(MemoryRecordFields.ACCESS_COUNT, record.getAccessCount());
    doc.put(MemoryRecordFields.CREATED_AT, toEpochMillis(record.getCreatedAt()));
    doc.put(MemoryRecordFields.LAST_ACCESSED_AT, toEpochMillis(record.getLastAccessedAt()));
    doc.put(MemoryRecordFields.LAST_MODIFIED_AT, toEpochMillis(record.getLastModifiedAt()));
    doc.put(MemoryRecordFields.TIER_ENTERED_AT, toEpochMillis(record.getTierEnteredAt()));
    doc.put(MemoryRecordFields.ARCHIVED, record.isArchived());
    doc.put(MemoryRecordFields.ARCHIVED_AT, toEpochMillis(record.getArchivedAt()));
    doc.put(MemoryRecordFields.TAGS, new ArrayList<>(record.getTags()));
    doc.put(MemoryRecordFields.METADATA, new TreeMap<>(record.getMetadata()));
    if (record.hasEmbedding()) {
      doc.put(MemoryRecordFields.EMBEDDING, toFloatList(record.getEmbedding()));
    }
    return doc;
  }

  @Override
  protected MemoryRecord convertFromDocument(String id, Map<String, Object> source) {
    Object tier = source.get(MemoryRecordFields.TIER);
    MemoryRecord record =
        MemoryRecord.builder()
            .id(id)
            .owner(stringOf(source.get(MemoryRecordFields.OWNER)))
            .content(stringOf(source.get(MemoryRecordFields.CONTENT)))
            .contentHash(stringOf(source.get(MemoryRecordFields.CONTENT_HASH)))
            .summary(stringOf(source.get(MemoryRecordFields.SUMMARY)))
            .embedding(toFloatArray(source.get(MemoryRecordFields.EMBEDDING)))
            // an unknown tier name stays null and is rejected by scoring
            .tier(tier != null ? parseTier(tier.toString()) : null)
            // missing numbers read as out of range and are reported as corruption, never as 0
            .baseImportance(doubleOf(source.get(MemoryRecordFields.BASE_IMPORTANCE), Double.NaN))
            .importance(doubleOf(source.get(MemoryRecordFields.IMPORTANCE), Double.NaN))
            .decayWeight(doubleOf(source.get(MemoryRecordFields.DECAY_WEIGHT), Double.NaN))
            .accessCount(longOf(source.get(MemoryRecordFields.ACCESS_COUNT), -1L))
            .createdAt(instantOf(source.get(MemoryRecordFields.CREATED_AT)))
            .lastAccessedAt(instantOf(source.get(MemoryRecordFields.LAST_ACCESSED_AT)))
            .lastModifiedAt(instantOf(source.get(MemoryRecordFields.LAST_MODIFIED_AT)))
            .tierEnteredAt(instantOf(source.get(MemoryRecordFields.TIER_ENTERED_AT)))
            .archived(Boolean.TRUE.equals(source.get(MemoryRecordFields.ARCHIVED)))
            .archivedAt(instantOf(source.get(MemoryRecordFields.ARCHIVED_AT)))
            .build();
    if (source.get(MemoryRecordFields.TAGS) instanceof Collection<?> tags) {
      tags.forEach(tag -> record.getTags().add(tag.toString()));
    }
    if (source.get(MemoryRecordFields.METADATA) instanceof Map<?, ?> metadata) {
      metadata.forEach((k, v) -> record.getMetadata().put(k.toString(), stringOf(v)));
    }
    return record;
  }

  @Override
  @Timed(value = "memory.store.upsert", description = "Time to upsert a record by content key")
  public UpsertOutcome upsertByContentKey(MemoryRecord candidate, Instant now) {
    checkDimensions(candidate.getEmbedding());
    String id = candidate.getId();
    for (int attempt = 1; attempt <= MAX_UPSERT_ATTEMPTS; attempt++) {
      if (tryCreate(candidate)) {
        meterRegistry.counter("memory.store.created").increment();
        return new UpsertOutcome(id, true, candidate.getAccessCount());
      }
      Optional<VersionedRecord> current = findById(id);
      if (current.isEmpty()) {
        // deleted between the create conflict and the read
        continue;
      }
      Optional<String> malformed = current.get().record().malformedNumericField();
      if (malformed.isPresent()) {
        throw new CorruptedStateException(id, "missing or malformed " + malformed.get());
      }
      MemoryRecord updated = current.get().record().reingested(candidate, now);
      if (compareAndSet(current.get(), updated)) {
        meterRegistry.counter("memory.store.deduplicated").increment();
        return new UpsertOutcome(id, false, updated.getAccessCount());
      }
      log.debug("Upsert of {} lost a write race (attempt {})", id, attempt);
    }
    throw new UpstreamUnavailableException(
        getUpstreamName(),
        "Upsert of record " + id + " did not settle after " + MAX_UPSERT_ATTEMPTS + " attempts");
  }

  private boolean tryCreate(MemoryRecord candidate) {
    try {
      Map<String, Object> document = convertToDocument(candidate);
      elasticsearchClient.index(
          i ->
              i.index(indexName)
                  .id(candidate.getId())
                  .opType(OpType.Create)
                  .document(document));
      return true;
    } catch (ElasticsearchException e) {
      if (isConflict(e)) {
        return false;
      }
      throw unavailable("create " + candidate.getId(), e);
    } catch (IOException e) {
      throw unavailable("create " + candidate.getId(), e);
    }
  }

  @Override
  @Retry(name = "memoryStore")
  @SuppressWarnings("unchecked")
  public Optional<VersionedRecord> findById(String id) {
    return getRaw(id)
        .map(
            response ->
                new VersionedRecord(
                    convertFromDocument(response.id(), response.source()),
                    response.seqNo() != null ? response.seqNo() : -1L,
                    response.primaryTerm() != null ? response.primaryTerm() : -1L));
  }

  @Override
  @Retry(name = "memoryStore")
  @SuppressWarnings({"rawtypes", "unchecked"})
  public List<MemoryRecord> findAllById(Collection<String> ids) {
    if (ids.isEmpty()) {
      return List.of();
    }
    try {
      List<String> idList = List.copyOf(ids);
      MgetResponse<Map> response =
          elasticsearchClient.mget(m -> m.index(indexName).ids(idList), Map.class);
      List<MemoryRecord> records = new ArrayList<>();
      for (MultiGetResponseItem<Map> item : response.docs()) {
        if (!item.isResult()) {
          throw new UpstreamUnavailableException(
              getUpstreamName(), "Multi-get failed for " + item.failure().id());
        }
        GetResult<Map> result = item.result();
        if (result.found() && result.source() != null) {
          records.add(convertFromDocument(result.id(), result.source()));
        }
      }
      return records;
    } catch (IOException | ElasticsearchException e) {
      throw unavailable("mget", e);
    }
  }

  // Not retried: a resend after a lost response conflicts with its own write and the caller
  // would apply its change twice. Callers re-read and retry on false.
  @Override
  public boolean compareAndSet(VersionedRecord expected, MemoryRecord updated) {
    checkDimensions(updated.getEmbedding());
    try {
      Map<String, Object> document = convertToDocument(updated);
      elasticsearchClient.index(
          i ->
              i.index(indexName)
                  .id(updated.getId())
                  .ifSeqNo(expected.seqNo())
                  .ifPrimaryTerm(expected.primaryTerm())
                  .document(document));
      return true;
    } catch (ElasticsearchException e) {
      if (isConflict(e)) {
        meterRegistry.counter("memory.store.cas_conflicts").increment();
        return false;
      }
      throw unavailable("compare-and-set " + updated.getId(), e);
    } catch (IOException e) {
      throw unavailable("compare-and-set " + updated.getId(), e);
    }
  }

  @Override
  @Retry(name = "memoryStore")
  public void delete(String id) {
    try {
      elasticsearchClient.delete(d -> d.index(indexName).id(id));
    } catch (ElasticsearchException e) {
      if (!isNotFound(e)) {
        throw unavailable("delete " + id, e);
      }
    } catch (IOException e) {
      throw unavailable("delete " + id, e);
    }
  }

  @Override
  @Retry(name = "memoryStore")
  @SuppressWarnings("rawtypes")
  public RecordPage scan(MemoryTier tier, String cursor, int pageSize) {
    Query query =
        SearchFilterQueries.allOf(
            List.of(
                SearchFilterQueries.term(MemoryRecordFields.TIER, tier.name()),
                Query.of(
                    q -> q.term(t -> t.field(MemoryRecordFields.ARCHIVED).value(false)))));
    SearchRequest request =
        SearchRequest.of(
            s -> {
              s.index(indexName)
                  .size(pageSize)
                  .query(query)
                  .sort(
                      so ->
                          so.field(
                              f -> f.field(MemoryRecordFields.RECORD_ID).order(SortOrder.Asc)));
              if (cursor != null) {
                s.searchAfter(FieldValue.of(cursor));
              }
              return s;
            });
    List<MemoryRecord> records = new ArrayList<>();
    for (Hit<Map> hit : search(request, "scan " + tier)) {
      records.add(fromHit(hit));
    }
    String nextCursor =
        records.size() < pageSize ? null : records.get(records.size() - 1).getId();
    return new RecordPage(records, nextCursor);
  }

  @Override
  @Retry(name = "memoryStore")
  @Timed(value = "memory.store.vector_search", description = "Time for vector top-K")
  @SuppressWarnings("rawtypes")
  public List<ScoredRecord> vectorTopK(float[] embedding, SearchFilters filters, int k) {
    checkDimensions(embedding);
    List<Float> queryVector = toFloatList(embedding);
    List<Query> filterClauses = SearchFilterQueries.toFilterClauses(filters);
    int numCandidates = Math.min(Math.max(k * 2, 100), MAX_KNN_CANDIDATES);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        kn ->
                            kn.field(MemoryRecordFields.EMBEDDING)
                                .queryVector(queryVector)
                                .k(k)
                                .numCandidates(numCandidates)
                                .filter(filterClauses))
                    .size(k));
    List<ScoredRecord> results = new ArrayList<>();
    for (Hit<Map> hit : search(request, "vectorTopK")) {
      // cosine similarity is reported as (1 + cos) / 2
      double cosine = hit.score() != null ? 2.0 * hit.score() - 1.0 : 0.0;
      results.add(new ScoredRecord(fromHit(hit), cosine));
    }
    meterRegistry.counter("memory.store.vector_search").increment();
    return results;
  }

  @Override
  @Retry(name = "memoryStore")
  @Timed(value = "memory.store.keyword_search", description = "Time for keyword top-K")
  @SuppressWarnings("rawtypes")
  public List<ScoredRecord> keywordTopK(String query, SearchFilters filters, int k) {
    List<Query> filterClauses = SearchFilterQueries.toFilterClauses(filters);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .size(k)
                    .query(
                        q ->
                            q.bool(
                                b ->
                                    b.must(
                                            m ->
                                                m.multiMatch(
                                                    mm ->
                                                        mm.query(query)
                                                            .fields(
                                                                MemoryRecordFields.CONTENT,
                                                                MemoryRecordFields.SUMMARY)))
                                        .filter(filterClauses))));
    List<ScoredRecord> results = new ArrayList<>();
    for (Hit<Map> hit : search(request, "keywordTopK")) {
      results.add(new ScoredRecord(fromHit(hit), hit.score() != null ? hit.score() : 0.0));
    }
    meterRegistry.counter("memory.store.keyword_search").increment();
    return results;
  }

  @Override
  @Retry(name = "memoryStore")
  public void putAlias(String discardedId, String survivorId) {
    aliasIndex.put(discardedId, survivorId);
  }

  @Override
  @Retry(name = "memoryStore")
  public Optional<String> findAlias(String id) {
    return aliasIndex.find(id);
  }

  private void checkDimensions(float[] embedding) {
    if (embedding != null && embedding.length != dimensions) {
      throw new DimensionMismatchException(dimensions, embedding.length);
    }
  }

  private static MemoryTier parseTier(String name) {
    try {
      return MemoryTier.valueOf(name);
    } catch (IllegalArgumentException e) {
      log.warn("Unknown tier '{}' in stored record", name);
      return null;
    }
  }

  private static List<Float> toFloatList(float[] vector) {
    List<Float> list = new ArrayList<>(vector.length);
    for (float value : vector) {
      list.add(value);
    }
    return list;
  }

  private static float[] toFloatArray(Object value) {
    if (!(value instanceof List<?> list) || list.isEmpty()) {
      return null;
    }
    float[] vector = new float[list.size()];
    for (int i = 0; i < vector.length; i++) {
      vector[i] = ((Number) list.get(i)).floatValue();
    }
    return vector;
  }
}
