package com.flamingo.ai.memoryengine.domain.enums;

/** State of a consolidation job: PENDING, RUNNING, then DONE or FAILED. */
public enum JobStatus {
  PENDING,
  RUNNING,
  DONE,
  FAILED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }
}
