package com.flamingo.ai.memoryengine.domain.enums;

/** What started a consolidation tick. */
public enum ConsolidationTrigger {
  SCHEDULED,
  MANUAL,
  FILL_THRESHOLD
}
