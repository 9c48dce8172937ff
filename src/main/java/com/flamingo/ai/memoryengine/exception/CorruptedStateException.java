package com.flamingo.ai.memoryengine.exception;

/**
 * Exception thrown when a stored record violates a timestamp, hash or alias invariant. Such state
 * is never repaired in place.
 */
public class CorruptedStateException extends MemoryEngineException {

  private final String recordId;

  public CorruptedStateException(String recordId, String message) {
    super(String.format("Corrupted state for record %s: %s", recordId, message));
    this.recordId = recordId;
  }

  public String getRecordId() {
    return recordId;
  }

  @Override
  public String getCode() {
    return CORRUPTED_STATE;
  }
}
