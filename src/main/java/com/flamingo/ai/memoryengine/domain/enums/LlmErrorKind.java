package com.flamingo.ai.memoryengine.domain.enums;

/** Failure kinds reported by the language-model service. */
public enum LlmErrorKind {
  RATE_LIMITED,
  TIMEOUT,
  INVALID_RESPONSE
}
