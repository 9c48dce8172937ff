package com.flamingo.ai.memoryengine.exception;

/** Exception thrown when caller input is malformed. Raised before any store call. */
public class ValidationException extends MemoryEngineException {

  private final String field;

  public ValidationException(String field, String message) {
    super(field + ": " + message);
    this.field = field;
  }

  public String getField() {
    return field;
  }

  @Override
  public String getCode() {
    return VALIDATION_ERROR;
  }
}
