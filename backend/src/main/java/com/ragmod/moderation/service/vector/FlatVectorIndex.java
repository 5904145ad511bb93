package com.ragmod.moderation.service.vector;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

import com.ragmod.moderation.exception.DimensionMismatchException;
import com.ragmod.moderation.exception.IndexNotReadyException;

/**
 * Exact in-memory index. Vectors live in one contiguous array, row {@code i} belonging to example
 * {@code i} of the store. Instances never change after construction; a rebuild produces a new
 * index.
 */
public final class FlatVectorIndex implements VectorIndex {

  /** Files that make up the persisted form, relative to the index directory. */
  public static final List<String> FILES =
      List.of(IndexFileFormat.VECTORS_FILE, IndexFileFormat.METADATA_FILE);

  private final ExampleStore store;
  private final float[] data;
  private final int dimension;
  private final DistanceMetric metric;

  FlatVectorIndex(ExampleStore store, float[] data, int dimension, DistanceMetric metric) {
    this.store = store;
    this.data = data;
    this.dimension = dimension;
    this.metric = metric;
  }

  /**
   * Builds an index over {@code examples}, where {@code vectors.get(i)} is the embedding of {@code
   * examples.get(i)}.
   */
  public static FlatVectorIndex build(
      List<Example> examples, List<float[]> vectors, DistanceMetric metric) {
    if (examples.size() != vectors.size()) {
      throw new IllegalArgumentException(
          String.format(
              "Got %d examples but %d vectors; they must pair up one to one",
              examples.size(), vectors.size()));
    }
    if (examples.isEmpty()) {
      throw new IllegalArgumentException("Cannot build an index from zero examples");
    }

    int dimension = vectors.get(0).length;
    if (dimension == 0) {
      throw new IllegalArgumentException("Vectors must have at least one component");
    }
    float[] data = new float[examples.size() * dimension];
    for (int row = 0; row < vectors.size(); row++) {
      float[] vector = vectors.get(row);
      if (vector.length != dimension) {
        throw new DimensionMismatchException(dimension, vector.length);
      }
      System.arraycopy(vector, 0, data, row * dimension, dimension);
    }
    return new FlatVectorIndex(ExampleStore.of(examples), data, dimension, metric);
  }

  public static FlatVectorIndex load(Path directory) throws IOException {
    return IndexFileFormat.read(directory);
  }

  public void save(Path directory) throws IOException {
    IndexFileFormat.write(this, directory);
  }

  @Override
  public List<RetrievedExample> search(float[] queryVector, int k) {
    if (k <= 0) {
      throw new IllegalArgumentException("k must be positive, got " + k);
    }
    if (store.isEmpty()) {
      throw new IndexNotReadyException("Vector index is empty");
    }
    if (queryVector.length != dimension) {
      throw new DimensionMismatchException(dimension, queryVector.length);
    }

    int limit = Math.min(k, store.size());
    // Max-heap on (distance, row) holding the best `limit` rows seen so far
    Comparator<Hit> nearestFirst =
        Comparator.comparingDouble((Hit h) -> h.distance).thenComparingInt(h -> h.row);
    PriorityQueue<Hit> best = new PriorityQueue<>(limit + 1, nearestFirst.reversed());

    float[] row = new float[dimension];
    for (int i = 0; i < store.size(); i++) {
      System.arraycopy(data, i * dimension, row, 0, dimension);
      Hit hit = new Hit(i, metric.distance(queryVector, row));
      if (best.size() < limit) {
        best.add(hit);
      } else if (nearestFirst.compare(hit, best.peek()) < 0) {
        best.poll();
        best.add(hit);
      }
    }

    List<Hit> ordered = new ArrayList<>(best);
    ordered.sort(nearestFirst);
    List<RetrievedExample> results = new ArrayList<>(ordered.size());
    for (Hit hit : ordered) {
      Example example = store.get(hit.row);
      results.add(
          RetrievedExample.builder()
              .text(example.getText())
              .category(example.getCategory())
              .distance(hit.distance)
              .build());
    }
    return results;
  }

  @Override
  public int size() {
    return store.size();
  }

  @Override
  public int dimension() {
    return dimension;
  }

  @Override
  public DistanceMetric metric() {
    return metric;
  }

  @Override
  public String describe() {
    return "local";
  }

  public ExampleStore store() {
    return store;
  }

  /** Copy of the vector stored at {@code row}. */
  public float[] vectorAt(int row) {
    return Arrays.copyOfRange(data, row * dimension, (row + 1) * dimension);
  }

  float[] rawData() {
    return data;
  }

  private static final class Hit {
    final int row;
    final float distance;

    Hit(int row, float distance) {
      this.row = row;
      this.distance = distance;
    }
  }
}
