package com.flamingo.ai.memoryengine.elasticsearch;

/** Field names of the records index. */
final class MemoryRecordFields {

  static final String RECORD_ID = "recordId";
  static final String OWNER = "owner";
  static final String CONTENT = "content";
  static final String CONTENT_HASH = "contentHash";
  static final String SUMMARY = "summary";
  static final String EMBEDDING = "embedding";
  static final String TIER = "tier";
  static final String BASE_IMPORTANCE = "baseImportance";
  static final String IMPORTANCE = "importance";
  static final String DECAY_WEIGHT = "decayWeight";
  static final String ACCESS_COUNT = "accessCount";
  static final String CREATED_AT = "createdAt";
  static final String LAST_ACCESSED_AT = "lastAccessedAt";
  static final String LAST_MODIFIED_AT = "lastModifiedAt";
  static final String TIER_ENTERED_AT = "tierEnteredAt";
  static final String ARCHIVED = "archived";
  static final String ARCHIVED_AT = "archivedAt";
  static final String TAGS = "tags";
  static final String METADATA = "metadata";

  private MemoryRecordFields() {}
}
