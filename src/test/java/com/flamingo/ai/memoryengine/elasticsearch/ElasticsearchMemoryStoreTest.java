package com.flamingo.ai.memoryengine.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.ErrorResponse;
import co.elastic.clients.elasticsearch.core.GetResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.flamingo.ai.memoryengine.config.MemoryEngineConfig;
import com.flamingo.ai.memoryengine.domain.enums.MemoryTier;
import com.flamingo.ai.memoryengine.domain.model.MemoryRecord;
import com.flamingo.ai.memoryengine.domain.model.SearchFilters;
import com.flamingo.ai.memoryengine.domain.model.UpsertOutcome;
import com.flamingo.ai.memoryengine.domain.model.VersionedRecord;
import com.flamingo.ai.memoryengine.exception.CorruptedStateException;
import com.flamingo.ai.memoryengine.exception.DimensionMismatchException;
import com.flamingo.ai.memoryengine.exception.UpstreamUnavailableException;
import com.flamingo.ai.memoryengine.support.TestRecords;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@SuppressWarnings({"rawtypes", "unchecked"})
class ElasticsearchMemoryStoreTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Mock private ElasticsearchClient elasticsearchClient;
  @Mock private MemoryAliasIndexService aliasIndex;

  private SimpleMeterRegistry meterRegistry;
  private ElasticsearchMemoryStore store;

  @BeforeEach
  void setUp() {
    MemoryEngineConfig config = new MemoryEngineConfig();
    config.getEmbedding().setDimensions(4);
    meterRegistry = new SimpleMeterRegistry();
    store = new ElasticsearchMemoryStore(elasticsearchClient, meterRegistry, aliasIndex, config);
    ReflectionTestUtils.setField(store, "indexName", "memory-records");
  }

  private static ElasticsearchException esError(int status) {
    return new ElasticsearchException(
        "index",
        ErrorResponse.of(
            r -> r.status(status).error(e -> e.type("test_exception").reason("status " + status))));
  }

  private static MemoryRecord sample() {
    MemoryRecord record =
        TestRecords.working("alice", "Alice moved to Paris", NOW)
            .embedding(new float[] {0.5f, 0.25f, 0f, 1f})
            .tier(MemoryTier.SHORT_TERM)
            .accessCount(3)
            .summary("moved")
            .build();
    record.getTags().addAll(Set.of("travel", "profile"));
    record.getMetadata().put("source", "chat");
    return record;
  }

  @Nested
  @DisplayName("document conversion")
  class ConversionTests {

    @Test
    @DisplayName("should restore every field from a stored source")
    void shouldRoundTripRecord() {
      MemoryRecord record = sample();

      MemoryRecord restored =
          store.convertFromDocument(record.getId(), store.convertToDocument(record));

      assertThat(restored).isEqualTo(record);
    }

    @Test
    @DisplayName("should accept the number types a JSON parser produces")
    void shouldAcceptParsedNumbers() {
      Map<String, Object> source = new HashMap<>();
      source.put(MemoryRecordFields.TIER, "LONG_TERM");
      source.put(MemoryRecordFields.IMPORTANCE, 1);
      source.put(MemoryRecordFields.ACCESS_COUNT, 7);
      source.put(MemoryRecordFields.CREATED_AT, NOW.toEpochMilli());
      source.put(MemoryRecordFields.EMBEDDING, List.of(1, 0.5, 0.25, 0));

      MemoryRecord record = store.convertFromDocument("r1", source);

      assertThat(record.getId()).isEqualTo("r1");
      assertThat(record.getTier()).isEqualTo(MemoryTier.LONG_TERM);
      assertThat(record.getImportance()).isEqualTo(1.0);
      assertThat(record.getAccessCount()).isEqualTo(7);
      assertThat(record.getCreatedAt()).isEqualTo(NOW);
      assertThat(record.getEmbedding()).containsExactly(1f, 0.5f, 0.25f, 0f);
      assertThat(record.hasEmbedding()).isTrue();
      assertThat(record.getLastAccessedAt()).isNull();
    }

    @Test
    @DisplayName("should leave an unknown tier empty")
    void shouldNotGuessUnknownTier() {
      MemoryRecord record = store.convertFromDocument("r1", Map.of("tier", "MID_TERM"));

      assertThat(record.getTier()).isNull();
      assertThat(record.hasEmbedding()).isFalse();
    }

    @Test
    @DisplayName("should read missing scores and counters as malformed rather than zero")
    void shouldNotDefaultMissingNumbers() {
      Map<String, Object> source = new HashMap<>();
      source.put(MemoryRecordFields.IMPORTANCE, 0.4);
      source.put(MemoryRecordFields.DECAY_WEIGHT, "0.2");

      MemoryRecord record = store.convertFromDocument("r1", source);

      assertThat(record.getImportance()).isEqualTo(0.4);
      assertThat(record.getBaseImportance()).isNaN();
      assertThat(record.getDecayWeight()).isNaN();
      assertThat(record.getAccessCount()).isNegative();
      assertThat(record.malformedNumericField()).contains("baseImportance");
    }
  }

  @Nested
  @DisplayName("upsertByContentKey")
  class UpsertTests {

    @Test
    @DisplayName("should create the record when the key is free")
    void shouldCreate() throws Exception {
      MemoryRecord record = sample();

      UpsertOutcome outcome = store.upsertByContentKey(record, NOW);

      assertThat(outcome).isEqualTo(new UpsertOutcome(record.getId(), true, 3));
      verify(elasticsearchClient).index(any(Function.class));
      assertThat(meterRegistry.counter("memory.store.created").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should count an access on the stored record when the key is taken")
    void shouldReingestOnConflict() throws Exception {
      MemoryRecord stored = sample();
      GetResponse<Map> response = mock(GetResponse.class);
      when(response.found()).thenReturn(true);
      when(response.id()).thenReturn(stored.getId());
      when(response.source()).thenReturn(store.convertToDocument(stored));
      when(response.seqNo()).thenReturn(7L);
      when(response.primaryTerm()).thenReturn(1L);
      when(elasticsearchClient.get(any(Function.class), eq(Map.class))).thenReturn(response);
      when(elasticsearchClient.index(any(Function.class)))
          .thenThrow(esError(409))
          .thenReturn(null);

      MemoryRecord incoming = TestRecords.working("alice", "Alice moved to Paris", NOW).build();
      UpsertOutcome outcome = store.upsertByContentKey(incoming, NOW.plusSeconds(60));

      assertThat(outcome).isEqualTo(new UpsertOutcome(stored.getId(), false, 4));
      verify(elasticsearchClient, times(2)).index(any(Function.class));
      assertThat(meterRegistry.counter("memory.store.deduplicated").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should not count an access on a stored record whose counter is missing")
    void shouldRefuseToReingestCorruptedRecord() throws Exception {
      Map<String, Object> document = store.convertToDocument(sample());
      document.remove(MemoryRecordFields.ACCESS_COUNT);
      GetResponse<Map> response = mock(GetResponse.class);
      when(response.found()).thenReturn(true);
      when(response.id()).thenReturn(sample().getId());
      when(response.source()).thenReturn(document);
      when(response.seqNo()).thenReturn(7L);
      when(response.primaryTerm()).thenReturn(1L);
      when(elasticsearchClient.get(any(Function.class), eq(Map.class))).thenReturn(response);
      when(elasticsearchClient.index(any(Function.class))).thenThrow(esError(409));

      MemoryRecord incoming = TestRecords.working("alice", "Alice moved to Paris", NOW).build();

      assertThatThrownBy(() -> store.upsertByContentKey(incoming, NOW))
          .isInstanceOf(CorruptedStateException.class)
          .hasMessageContaining("accessCount");
      verify(elasticsearchClient, times(1)).index(any(Function.class));
    }

    @Test
    @DisplayName("should reject an embedding of the wrong size before writing")
    void shouldRejectWrongDimensions() {
      MemoryRecord record = sample().toBuilder().embedding(new float[] {1f, 0f}).build();

      assertThatThrownBy(() -> store.upsertByContentKey(record, NOW))
          .isInstanceOf(DimensionMismatchException.class);
      verifyNoInteractions(elasticsearchClient);
    }
  }

  @Nested
  @DisplayName("compareAndSet")
  class CompareAndSetTests {

    @Test
    @DisplayName("should report a version conflict as a lost race")
    void shouldReturnFalseOnConflict() throws Exception {
      when(elasticsearchClient.index(any(Function.class))).thenThrow(esError(409));
      MemoryRecord record = sample();

      boolean written = store.compareAndSet(new VersionedRecord(record, 3L, 1L), record);

      assertThat(written).isFalse();
      assertThat(meterRegistry.counter("memory.store.cas_conflicts").count()).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("error mapping")
  class ErrorMappingTests {

    @Test
    @DisplayName("should treat overload and server errors as retryable")
    void shouldMarkServerErrorsRetryable() throws Exception {
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenThrow(esError(503));

      assertThatThrownBy(() -> store.keywordTopK("paris", SearchFilters.none(), 5))
          .isInstanceOf(UpstreamUnavailableException.class)
          .satisfies(
              e -> {
                UpstreamUnavailableException failure = (UpstreamUnavailableException) e;
                assertThat(failure.isRetryable()).isTrue();
                assertThat(failure.getUpstream()).isEqualTo("memoryStore");
              });
      assertThat(meterRegistry.counter("memory.store.errors").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should not retry a rejected request")
    void shouldMarkBadRequestsPermanent() throws Exception {
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenThrow(esError(400));

      assertThatThrownBy(() -> store.keywordTopK("paris", SearchFilters.none(), 5))
          .isInstanceOf(UpstreamUnavailableException.class)
          .satisfies(e -> assertThat(((UpstreamUnavailableException) e).isRetryable()).isFalse());
    }

    @Test
    @DisplayName("should reject a query vector of the wrong size without calling the index")
    void shouldRejectWrongQueryDimensions() {
      assertThatThrownBy(() -> store.vectorTopK(new float[] {1f, 0f}, SearchFilters.none(), 5))
          .isInstanceOf(DimensionMismatchException.class);
      verifyNoInteractions(elasticsearchClient);
    }
  }
}
