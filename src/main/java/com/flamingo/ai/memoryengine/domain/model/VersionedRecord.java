package com.flamingo.ai.memoryengine.domain.model;

/**
 * A record together with the store version it was read at. Passing it back to {@code
 * compareAndSet} makes the write conditional on nobody having written in between.
 *
 * @param record the record as read
 * @param seqNo store sequence number at read time
 * @param primaryTerm store primary term at read time
 */
public record VersionedRecord(MemoryRecord record, long seqNo, long primaryTerm) {}
