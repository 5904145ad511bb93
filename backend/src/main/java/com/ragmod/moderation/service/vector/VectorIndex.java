package com.ragmod.moderation.service.vector;

import java.util.List;

/** k-nearest-neighbor search over fixed-dimension vectors. */
public interface VectorIndex {

  /**
   * Returns up to {@code k} examples ordered by non-decreasing distance from {@code queryVector}.
   * Asking for more results than the index holds returns the whole index.
   *
   * @throws IllegalArgumentException if {@code k <= 0}
   * @throws com.ragmod.moderation.exception.IndexNotReadyException if the index holds nothing
   * @throws com.ragmod.moderation.exception.DimensionMismatchException if the query vector has the
   *     wrong length
   */
  List<RetrievedExample> search(float[] queryVector, int k);

  /** Number of indexed vectors, or -1 when the backing store cannot report it cheaply. */
  int size();

  /** Vector length, or 0 when not known up front. */
  int dimension();

  DistanceMetric metric();

  /** Short backend name for health reporting. */
  String describe();
}
