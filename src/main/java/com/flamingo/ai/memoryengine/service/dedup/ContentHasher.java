package com.flamingo.ai.memoryengine.service.dedup;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

/** Content hashing and the record identifiers derived from it. */
public final class ContentHasher {

  private ContentHasher() {}

  /** SHA-256 of the UTF-8 bytes of {@code content}, as lowercase hex. */
  public static String sha256Hex(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /**
   * Identifier of the record holding {@code contentHash} for {@code owner}. Deterministic, so
   * every writer of the same content computes the same key and the store can enforce uniqueness.
   */
  public static String recordId(String owner, String contentHash) {
    byte[] key = (owner + '\u0000' + contentHash).getBytes(StandardCharsets.UTF_8);
    return UUID.nameUUIDFromBytes(key).toString();
  }
}
