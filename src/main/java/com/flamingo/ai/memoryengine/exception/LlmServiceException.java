package com.flamingo.ai.memoryengine.exception;

import com.flamingo.ai.memoryengine.domain.enums.LlmErrorKind;

/** Exception thrown when the language-model service fails. */
public class LlmServiceException extends UpstreamUnavailableException {

  private final LlmErrorKind kind;

  public LlmServiceException(LlmErrorKind kind, String message) {
    super("llm", message);
    this.kind = kind;
  }

  public LlmServiceException(LlmErrorKind kind, String message, Throwable cause) {
    super("llm", message, cause);
    this.kind = kind;
  }

  public LlmErrorKind getKind() {
    return kind;
  }

  public boolean isRateLimited() {
    return kind == LlmErrorKind.RATE_LIMITED;
  }

  @Override
  public boolean isRetryable() {
    return kind != LlmErrorKind.INVALID_RESPONSE;
  }

  @Override
  public String getCode() {
    return switch (kind) {
      case RATE_LIMITED -> LLM_RATE_LIMITED;
      case TIMEOUT -> LLM_TIMEOUT;
      case INVALID_RESPONSE -> LLM_INVALID_RESPONSE;
    };
  }
}
