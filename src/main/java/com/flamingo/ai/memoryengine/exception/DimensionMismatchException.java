package com.flamingo.ai.memoryengine.exception;

/** Exception thrown when two embeddings, or an embedding and the store, disagree on size. */
public class DimensionMismatchException extends MemoryEngineException {

  private final int expected;
  private final int actual;

  public DimensionMismatchException(int expected, int actual) {
    super(String.format("Embedding dimension mismatch: expected %d, got %d", expected, actual));
    this.expected = expected;
    this.actual = actual;
  }

  public int getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }

  @Override
  public String getCode() {
    return DIMENSION_MISMATCH;
  }
}
