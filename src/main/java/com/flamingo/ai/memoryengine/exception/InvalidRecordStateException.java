package com.flamingo.ai.memoryengine.exception;

/**
 * Exception thrown when a record cannot be scored or transitioned in its current state (unknown
 * tier, negative age from clock skew, promotion out of the last tier).
 */
public class InvalidRecordStateException extends MemoryEngineException {

  private final String recordId;

  public InvalidRecordStateException(String recordId, String message) {
    super(String.format("Invalid state for record %s: %s", recordId, message));
    this.recordId = recordId;
  }

  public String getRecordId() {
    return recordId;
  }

  @Override
  public String getCode() {
    return INVALID_RECORD_STATE;
  }
}
