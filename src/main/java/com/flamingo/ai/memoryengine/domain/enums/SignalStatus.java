package com.flamingo.ai.memoryengine.domain.enums;

/** Outcome of one retrieval signal within a search. */
public enum SignalStatus {
  OK,
  FAILED,
  TIMED_OUT,
  SKIPPED;

  public boolean isDegraded() {
    return this == FAILED || this == TIMED_OUT;
  }
}
