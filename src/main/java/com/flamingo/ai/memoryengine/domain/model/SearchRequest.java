package com.flamingo.ai.memoryengine.domain.model;

import java.time.Duration;
import lombok.Builder;

/**
 * Input of a hybrid search.
 *
 * @param query query text
 * @param filters caller filters, null for none
 * @param limit maximum number of results
 * @param tokenBudget context size budget in estimated tokens, null for the configured default
 * @param deadline soft deadline for candidate generation, null for the configured default
 */
@Builder(toBuilder = true)
public record SearchRequest(
    String query, SearchFilters filters, int limit, Integer tokenBudget, Duration deadline) {

  public static SearchRequest of(String query, SearchFilters filters, int limit) {
    return new SearchRequest(query, filters, limit, null, null);
  }

  public SearchFilters effectiveFilters() {
    return filters != null ? filters : SearchFilters.none();
  }
}
