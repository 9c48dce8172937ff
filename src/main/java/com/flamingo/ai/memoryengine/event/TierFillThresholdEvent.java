package com.flamingo.ai.memoryengine.event;

import com.flamingo.ai.memoryengine.domain.enums.MemoryTier;

/**
 * Published when enough new records entered a tier to request an early consolidation tick.
 *
 * @param tier the tier that filled up
 * @param newRecords records created in the tier since the previous request
 */
public record TierFillThresholdEvent(MemoryTier tier, long newRecords) {}
