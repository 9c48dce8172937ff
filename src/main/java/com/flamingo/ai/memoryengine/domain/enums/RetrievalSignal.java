package com.flamingo.ai.memoryengine.domain.enums;

/**
 * Independent candidate generators used by hybrid retrieval. Declaration order is the order in
 * which fused contributions are summed.
 */
public enum RetrievalSignal {
  VECTOR,
  KEYWORD,
  GRAPH
}
