package com.flamingo.ai.memoryengine.domain.enums;

/** Coarse intent of a search query, as classified by the language model. */
public enum QueryIntent {
  /** Looking for a specific fact, date, name or definition. */
  FACT,
  /** Looking for an overview of a topic. */
  SUMMARY,
  /** Looking for reasons, comparisons or relationships between concepts. */
  ANALYSIS
}
