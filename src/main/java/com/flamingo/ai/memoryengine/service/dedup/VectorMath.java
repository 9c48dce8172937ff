package com.flamingo.ai.memoryengine.service.dedup;

import com.flamingo.ai.memoryengine.exception.DimensionMismatchException;

/** Vector helpers shared by deduplication and group consolidation. */
public final class VectorMath {

  private VectorMath() {}

  /**
   * Cosine similarity of two embeddings; 0 if either has zero norm.
   *
   * @throws DimensionMismatchException if the vectors differ in length
   */
  public static double cosine(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new DimensionMismatchException(a.length, b.length);
    }
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0 || normB == 0) {
      return 0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
