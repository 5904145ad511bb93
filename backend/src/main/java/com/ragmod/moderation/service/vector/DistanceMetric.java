package com.ragmod.moderation.service.vector;

/** Distance functions for nearest-neighbor search. For every metric, lower means more similar. */
public enum DistanceMetric {
  /** Squared Euclidean distance. */
  L2("EUCLIDEAN") {
    @Override
    public float distance(float[] a, float[] b) {
      float sum = 0f;
      for (int i = 0; i < a.length; i++) {
        float d = a[i] - b[i];
        sum += d * d;
      }
      return sum;
    }
  },
  /** One minus cosine similarity. Zero vectors are treated as maximally distant. */
  COSINE("COSINE") {
    @Override
    public float distance(float[] a, float[] b) {
      double dot = 0;
      double normA = 0;
      double normB = 0;
      for (int i = 0; i < a.length; i++) {
        dot += a[i] * b[i];
        normA += a[i] * a[i];
        normB += b[i] * b[i];
      }
      if (normA == 0 || normB == 0) {
        return 1f;
      }
      return (float) (1.0 - dot / (Math.sqrt(normA) * Math.sqrt(normB)));
    }
  },
  /** Negated dot product. */
  INNER_PRODUCT("DOT_PRODUCT") {
    @Override
    public float distance(float[] a, float[] b) {
      float dot = 0f;
      for (int i = 0; i < a.length; i++) {
        dot += a[i] * b[i];
      }
      return -dot;
    }
  };

  private final String warehouseName;

  DistanceMetric(String warehouseName) {
    this.warehouseName = warehouseName;
  }

  public abstract float distance(float[] a, float[] b);

  /** Name of the equivalent {@code distance_type} in a BigQuery {@code VECTOR_SEARCH}. */
  public String getWarehouseName() {
    return warehouseName;
  }
}
