package com.flamingo.ai.memoryengine.domain.model;

import java.util.Map;
import java.util.Set;
import lombok.Builder;

/**
 * Input of {@code LifecycleCoordinator.ingest}.
 *
 * @param content memory text
 * @param owner owner/subject identifier
 * @param tags free-form tags, may be null
 * @param metadata free-form string metadata, may be null
 * @param importance initial importance in [0, 1], or null for the configured default
 */
@Builder
public record IngestRequest(
    String content,
    String owner,
    Set<String> tags,
    Map<String, String> metadata,
    Double importance) {

  public static IngestRequest of(String content, String owner, Set<String> tags) {
    return new IngestRequest(content, owner, tags, null, null);
  }
}
