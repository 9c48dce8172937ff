package com.flamingo.ai.memoryengine.domain.enums;

/** Kind of work item tracked in the dead-letter set. */
public enum DeadLetterSubject {
  RECORD,
  JOB
}
