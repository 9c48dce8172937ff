package com.flamingo.ai.memoryengine.exception;

/** Exception thrown when a memory record is not found. */
public class MemoryNotFoundException extends MemoryEngineException {

  private final String recordId;

  public MemoryNotFoundException(String recordId) {
    super("Memory not found with ID: " + recordId);
    this.recordId = recordId;
  }

  public String getRecordId() {
    return recordId;
  }

  @Override
  public String getCode() {
    return MEMORY_NOT_FOUND;
  }
}
