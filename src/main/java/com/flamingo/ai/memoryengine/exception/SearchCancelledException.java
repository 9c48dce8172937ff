package com.flamingo.ai.memoryengine.exception;

/** Exception thrown when a search is aborted by the caller before fusion. */
public class SearchCancelledException extends MemoryEngineException {

  public SearchCancelledException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String getCode() {
    return SEARCH_CANCELLED;
  }
}
