package com.flamingo.ai.memoryengine.domain.model;

import java.util.Locale;

/**
 * Entity node in the owner's knowledge graph.
 *
 * @param id node identifier, see {@link #idFor(String, String)}
 * @param owner owner the node belongs to
 * @param name display name
 */
public record EntityNode(String id, String owner, String name) {

  /** Builds a node whose identifier is derived from the owner and normalized name. */
  public static EntityNode of(String owner, String name) {
    return new EntityNode(idFor(owner, name), owner, name.trim());
  }

  public static String idFor(String owner, String name) {
    return owner + ":" + name.trim().toLowerCase(Locale.ROOT);
  }
}
