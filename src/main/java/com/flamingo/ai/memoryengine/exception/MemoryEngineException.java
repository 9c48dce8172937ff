package com.flamingo.ai.memoryengine.exception;

/** Base class of every error the engine surfaces to its callers. */
public abstract class MemoryEngineException extends RuntimeException {

  // Error codes
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String MEMORY_NOT_FOUND = "MEMORY_001";
  public static final String DIMENSION_MISMATCH = "EMBEDDING_001";
  public static final String UPSTREAM_UNAVAILABLE = "UPSTREAM_001";
  public static final String LLM_RATE_LIMITED = "LLM_001";
  public static final String LLM_TIMEOUT = "LLM_002";
  public static final String LLM_INVALID_RESPONSE = "LLM_003";
  public static final String CORRUPTED_STATE = "STATE_001";
  public static final String INVALID_RECORD_STATE = "STATE_002";
  public static final String SEARCH_CANCELLED = "SEARCH_001";

  protected MemoryEngineException(String message) {
    super(message);
  }

  protected MemoryEngineException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Machine-readable error code. */
  public abstract String getCode();
}
