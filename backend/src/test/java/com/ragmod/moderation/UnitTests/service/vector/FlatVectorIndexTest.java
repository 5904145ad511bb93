package com.ragmod.moderation.service.vector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ragmod.moderation.exception.DimensionMismatchException;
import com.ragmod.moderation.exception.IndexNotReadyException;
import com.ragmod.moderation.fixtures.TestFixtures;
import com.ragmod.moderation.service.taxonomy.ModerationCategory;

@DisplayName("FlatVectorIndex Tests")
class FlatVectorIndexTest {

  @Nested
  @DisplayName("Build Tests")
  class BuildTests {

    @Test
    @DisplayName("Should keep index size equal to store size")
    void shouldMatchStoreSize() {
      FlatVectorIndex index = TestFixtures.threeExampleIndex();

      assertThat(index.size()).isEqualTo(3);
      assertThat(index.store().size()).isEqualTo(index.size());
      assertThat(index.dimension()).isEqualTo(3);
      assertThat(index.metric()).isEqualTo(DistanceMetric.L2);
      assertThat(index.vectorAt(1)).containsExactly(TestFixtures.GREETING_VECTOR);
    }

    @Test
    @DisplayName("Should fail when examples and vectors do not pair up")
    void shouldRejectCountMismatch() {
      assertThatThrownBy(
              () ->
                  FlatVectorIndex.build(
                      TestFixtures.threeExamples(),
                      List.of(TestFixtures.THREAT_VECTOR),
                      DistanceMetric.L2))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("3 examples but 1 vectors");
    }

    @Test
    @DisplayName("Should fail on vectors of different dimensions")
    void shouldRejectRaggedVectors() {
      List<float[]> vectors =
          List.of(TestFixtures.THREAT_VECTOR, new float[] {1f, 2f}, TestFixtures.SPAM_VECTOR);

      assertThatThrownBy(
              () -> FlatVectorIndex.build(TestFixtures.threeExamples(), vectors, DistanceMetric.L2))
          .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    @DisplayName("Should fail on an empty build")
    void shouldRejectEmptyBuild() {
      assertThatThrownBy(() -> FlatVectorIndex.build(List.of(), List.of(), DistanceMetric.L2))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("Search Tests")
  class SearchTests {

    @Test
    @DisplayName("Should return the threat example first for a threatening query")
    void shouldReturnNearestFirst() {
      FlatVectorIndex index = TestFixtures.threeExampleIndex();

      List<RetrievedExample> results = index.search(TestFixtures.QUERY_VECTOR, 2);

      assertThat(results).hasSize(2);
      assertThat(results.get(0).getCategory()).isEqualTo(ModerationCategory.VIOLENCE_OR_THREATS);
      assertThat(results.get(0).getText()).isEqualTo(TestFixtures.THREAT_TEXT);
      assertThat(results.get(1).getText()).isEqualTo(TestFixtures.GREETING_TEXT);
      assertThat(results.get(0).getDistance()).isLessThan(results.get(1).getDistance());
    }

    @Test
    @DisplayName("Should return every example when k exceeds the index size")
    void shouldCapAtIndexSize() {
      FlatVectorIndex index = TestFixtures.threeExampleIndex();

      assertThat(index.search(TestFixtures.QUERY_VECTOR, 10)).hasSize(3);
    }

    @Test
    @DisplayName("Should break distance ties by insertion order")
    void shouldBreakTiesByInsertionOrder() {
      List<Example> examples = new ArrayList<>();
      List<float[]> vectors = new ArrayList<>();
      for (int i = 0; i < 6; i++) {
        examples.add(Example.of("same " + i, ModerationCategory.CLEAN));
        vectors.add(new float[] {1f, 1f});
      }
      FlatVectorIndex index = FlatVectorIndex.build(examples, vectors, DistanceMetric.L2);

      List<RetrievedExample> results = index.search(new float[] {0f, 0f}, 4);

      assertThat(results)
          .extracting(RetrievedExample::getText)
          .containsExactly("same 0", "same 1", "same 2", "same 3");
    }

    @Test
    @DisplayName("Should return non-decreasing distances for random data under every metric")
    void shouldOrderByDistance() {
      Random random = new Random(7);
      List<Example> examples = new ArrayList<>();
      List<float[]> vectors = new ArrayList<>();
      for (int i = 0; i < 200; i++) {
        examples.add(Example.of("text " + i, ModerationCategory.CLEAN));
        vectors.add(randomVector(random, 8));
      }
      float[] query = randomVector(random, 8);

      for (DistanceMetric metric : DistanceMetric.values()) {
        List<RetrievedExample> results =
            FlatVectorIndex.build(examples, vectors, metric).search(query, 25);

        assertThat(results).hasSize(25);
        for (int i = 1; i < results.size(); i++) {
          assertThat(results.get(i).getDistance())
              .isGreaterThanOrEqualTo(results.get(i - 1).getDistance());
        }
      }
    }

    @Test
    @DisplayName("Should reject a query of the wrong dimension")
    void shouldRejectWrongDimension() {
      FlatVectorIndex index = TestFixtures.threeExampleIndex();

      assertThatThrownBy(() -> index.search(new float[] {1f, 2f}, 1))
          .isInstanceOf(DimensionMismatchException.class)
          .hasMessageContaining("dimension 3 but got 2");
    }

    @Test
    @DisplayName("Should reject non-positive k")
    void shouldRejectNonPositiveK() {
      FlatVectorIndex index = TestFixtures.threeExampleIndex();

      assertThatThrownBy(() -> index.search(TestFixtures.QUERY_VECTOR, 0))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should report an empty index as not ready")
    void shouldFailOnEmptyIndex() {
      FlatVectorIndex empty =
          new FlatVectorIndex(ExampleStore.of(List.of()), new float[0], 3, DistanceMetric.L2);

      assertThatThrownBy(() -> empty.search(TestFixtures.QUERY_VECTOR, 1))
          .isInstanceOf(IndexNotReadyException.class);
    }
  }

  @Nested
  @DisplayName("Persistence Tests")
  class PersistenceTests {

    @TempDir Path tempDir;

    @Test
    @DisplayName("Should reproduce vectors and search results after save and load")
    void shouldRoundTrip() throws IOException {
      Map<String, Object> metadata = Map.of("source", "jigsaw");
      List<Example> examples = new ArrayList<>(TestFixtures.threeExamples());
      examples.set(
          2, new Example(TestFixtures.SPAM_TEXT, ModerationCategory.SPAM_OR_SCAMS, metadata));
      FlatVectorIndex original =
          FlatVectorIndex.build(examples, TestFixtures.threeVectors(), DistanceMetric.COSINE);

      original.save(tempDir);
      FlatVectorIndex loaded = FlatVectorIndex.load(tempDir);

      assertThat(loaded.size()).isEqualTo(loaded.store().size()).isEqualTo(3);
      assertThat(loaded.metric()).isEqualTo(DistanceMetric.COSINE);
      assertThat(loaded.store().get(2).getMetadata()).containsEntry("source", "jigsaw");
      for (int row = 0; row < 3; row++) {
        assertThat(loaded.vectorAt(row)).containsExactly(original.vectorAt(row));
      }
      assertThat(loaded.search(TestFixtures.QUERY_VECTOR, 3))
          .isEqualTo(original.search(TestFixtures.QUERY_VECTOR, 3));
      assertThat(tempDir.resolve("vectors.bin.tmp")).doesNotExist();
    }

    @Test
    @DisplayName("Should fail when no index was saved")
    void shouldFailWhenMissing() {
      assertThatThrownBy(() -> FlatVectorIndex.load(tempDir))
          .isInstanceOf(IOException.class)
          .hasMessageContaining("No persisted index");
    }

    @Test
    @DisplayName("Should fail when metadata and vectors disagree on the count")
    void shouldFailOnMisalignedFiles() throws IOException {
      TestFixtures.threeExampleIndex().save(tempDir);
      Path metadata = tempDir.resolve("metadata.jsonl");
      List<String> lines = Files.readAllLines(metadata, StandardCharsets.UTF_8);
      Files.write(metadata, lines.subList(0, 2), StandardCharsets.UTF_8);

      assertThatThrownBy(() -> FlatVectorIndex.load(tempDir))
          .isInstanceOf(IOException.class)
          .hasMessageContaining("out of alignment");
    }

    @Test
    @DisplayName("Should refuse metadata saved with a different vector file of the same size")
    void shouldRefuseMetadataFromAnotherSave() throws IOException {
      // Given
      Path first = tempDir.resolve("first");
      Path second = tempDir.resolve("second");
      Example threat =
          new Example(TestFixtures.THREAT_TEXT, ModerationCategory.VIOLENCE_OR_THREATS, Map.of());
      Example greeting =
          new Example(TestFixtures.GREETING_TEXT, ModerationCategory.CLEAN, Map.of());
      FlatVectorIndex.build(
              List.of(threat, greeting),
              List.of(TestFixtures.THREAT_VECTOR, TestFixtures.GREETING_VECTOR),
              DistanceMetric.L2)
          .save(first);
      FlatVectorIndex.build(
              List.of(greeting, threat),
              List.of(TestFixtures.GREETING_VECTOR, TestFixtures.THREAT_VECTOR),
              DistanceMetric.L2)
          .save(second);

      // When
      Files.copy(
          second.resolve("metadata.jsonl"),
          first.resolve("metadata.jsonl"),
          StandardCopyOption.REPLACE_EXISTING);

      // Then
      assertThatThrownBy(() -> FlatVectorIndex.load(first))
          .isInstanceOf(IOException.class)
          .hasMessageContaining("out of alignment");
      assertThat(FlatVectorIndex.load(second).search(TestFixtures.QUERY_VECTOR, 1))
          .extracting(RetrievedExample::getCategory)
          .containsExactly(ModerationCategory.VIOLENCE_OR_THREATS);
    }

    @Test
    @DisplayName("Should fail on a truncated vector file")
    void shouldFailOnTruncatedVectors() throws IOException {
      TestFixtures.threeExampleIndex().save(tempDir);
      Path vectors = tempDir.resolve("vectors.bin");
      byte[] bytes = Files.readAllBytes(vectors);
      Files.write(vectors, Arrays.copyOf(bytes, bytes.length - 5));

      assertThatThrownBy(() -> FlatVectorIndex.load(tempDir))
          .isInstanceOf(IOException.class)
          .hasMessageContaining("truncated");
    }

    @Test
    @DisplayName("Should fail on a file that is not an index")
    void shouldFailOnForeignFile() throws IOException {
      TestFixtures.threeExampleIndex().save(tempDir);
      Files.write(tempDir.resolve("vectors.bin"), "not an index".getBytes(StandardCharsets.UTF_8));

      assertThatThrownBy(() -> FlatVectorIndex.load(tempDir))
          .isInstanceOf(IOException.class)
          .hasMessageContaining("not a vector index file");
    }
  }

  @Nested
  @DisplayName("DistanceMetric Tests")
  class DistanceMetricTests {

    @Test
    @DisplayName("Should compute lower-is-closer distances")
    void shouldComputeDistances() {
      float[] a = {1f, 0f};
      float[] b = {0f, 1f};

      assertThat(DistanceMetric.L2.distance(a, b)).isEqualTo(2f);
      assertThat(DistanceMetric.COSINE.distance(a, a)).isCloseTo(0f, offset(1e-6f));
      assertThat(DistanceMetric.COSINE.distance(a, b)).isCloseTo(1f, offset(1e-6f));
      assertThat(DistanceMetric.INNER_PRODUCT.distance(a, a)).isEqualTo(-1f);
      assertThat(DistanceMetric.COSINE.distance(a, new float[] {0f, 0f})).isEqualTo(1f);
    }

    @Test
    @DisplayName("Should map to warehouse distance types")
    void shouldMapWarehouseNames() {
      assertThat(DistanceMetric.L2.getWarehouseName()).isEqualTo("EUCLIDEAN");
      assertThat(DistanceMetric.COSINE.getWarehouseName()).isEqualTo("COSINE");
      assertThat(DistanceMetric.INNER_PRODUCT.getWarehouseName()).isEqualTo("DOT_PRODUCT");
    }
  }

  private static float[] randomVector(Random random, int dimension) {
    float[] vector = new float[dimension];
    for (int i = 0; i < dimension; i++) {
      vector[i] = random.nextFloat() * 2 - 1;
    }
    return vector;
  }
}
