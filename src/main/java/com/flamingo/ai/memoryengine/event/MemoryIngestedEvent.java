package com.flamingo.ai.memoryengine.event;

/**
 * Published after ingest created a new record. Drives background enrichment so that ingest never
 * waits on the language model.
 *
 * @param recordId identifier of the new record
 * @param owner owner of the record
 * @param content content to embed and mine for entities
 */
public record MemoryIngestedEvent(String recordId, String owner, String content) {}
