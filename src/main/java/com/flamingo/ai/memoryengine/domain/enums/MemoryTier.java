package com.flamingo.ai.memoryengine.domain.enums;

import java.util.Optional;

/** Coarse retention class of a memory record. Transitions only move forward. */
public enum MemoryTier {
  WORKING,
  SHORT_TERM,
  LONG_TERM;

  /**
   * Returns the tier a record is promoted into from this one.
   *
   * @return the next tier, or empty for {@link #LONG_TERM}
   */
  public Optional<MemoryTier> next() {
    return switch (this) {
      case WORKING -> Optional.of(SHORT_TERM);
      case SHORT_TERM -> Optional.of(LONG_TERM);
      case LONG_TERM -> Optional.empty();
    };
  }

  /** Whether moving from this tier to {@code target} is a forward transition. */
  public boolean precedes(MemoryTier target) {
    return target != null && ordinal() < target.ordinal();
  }
}
