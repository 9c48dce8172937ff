package com.flamingo.ai.memoryengine.elasticsearch;

import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import com.flamingo.ai.memoryengine.domain.enums.MemoryTier;
import com.flamingo.ai.memoryengine.domain.model.SearchFilters;
import java.util.ArrayList;
import java.util.List;

/**
 * Translates {@link SearchFilters} into query-DSL filter clauses. Every caller value is passed as
 * a typed term or range value; nothing is concatenated into a query string.
 */
final class SearchFilterQueries {

  private SearchFilterQueries() {}

  static List<Query> toFilterClauses(SearchFilters filters) {
    List<Query> clauses = new ArrayList<>();
    if (filters.owner() != null) {
      clauses.add(term(MemoryRecordFields.OWNER, filters.owner()));
    }
    if (!filters.includeArchived()) {
      clauses.add(Query.of(q -> q.term(t -> t.field(MemoryRecordFields.ARCHIVED).value(false))));
    }
    if (filters.tiers() != null && !filters.tiers().isEmpty()) {
      List<FieldValue> tiers =
          filters.tiers().stream().map(MemoryTier::name).map(FieldValue::of).toList();
      clauses.add(
          Query.of(q -> q.terms(t -> t.field(MemoryRecordFields.TIER).terms(v -> v.value(tiers)))));
    }
    if (filters.tags() != null) {
      // every tag is required, so one term clause per tag
      filters.tags().forEach(tag -> clauses.add(term(MemoryRecordFields.TAGS, tag)));
    }
    if (filters.createdAfter() != null || filters.createdBefore() != null) {
      Double from =
          filters.createdAfter() != null ? (double) filters.createdAfter().toEpochMilli() : null;
      Double to =
          filters.createdBefore() != null ? (double) filters.createdBefore().toEpochMilli() : null;
      clauses.add(
          Query.of(
              q ->
                  q.range(
                      r ->
                          r.number(
                              n -> n.field(MemoryRecordFields.CREATED_AT).gte(from).lt(to)))));
    }
    return clauses;
  }

  static Query term(String field, String value) {
    return Query.of(q -> q.term(t -> t.field(field).value(value)));
  }

  static Query allOf(List<Query> clauses) {
    return Query.of(q -> q.bool(b -> b.filter(clauses)));
  }
}
