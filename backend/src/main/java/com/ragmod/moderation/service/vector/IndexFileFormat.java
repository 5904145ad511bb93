package com.ragmod.moderation.service.vector;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;
import com.ragmod.moderation.service.taxonomy.ModerationCategory;

/**
 * On-disk form of a {@link FlatVectorIndex}: {@code vectors.bin} holds a small header followed by
 * the raw floats, {@code metadata.jsonl} holds one example per line. Line {@code i} describes
 * vector {@code i}. The header carries the SHA-256 of the metadata file written alongside it, so
 * a pair mixed from two saves is refused on load.
 *
 * <pre>
 * int   magic ("RMVX")
 * int   format version
 * UTF   metric name
 * int   dimension
 * int   count
 * int   digest length
 * byte[digest length]  SHA-256 of metadata.jsonl
 * float[count * dimension]
 * </pre>
 */
final class IndexFileFormat {

  static final String VECTORS_FILE = "vectors.bin";
  static final String METADATA_FILE = "metadata.jsonl";

  private static final int MAGIC = 0x524D5658;
  private static final int VERSION = 2;

  private static final int MAX_DIGEST_BYTES = 64;

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE =
      new TypeReference<>() {};

  private IndexFileFormat() {}

  static void write(FlatVectorIndex index, Path directory) throws IOException {
    Files.createDirectories(directory);
    Path vectorsTmp = directory.resolve(VECTORS_FILE + ".tmp");
    Path metadataTmp = directory.resolve(METADATA_FILE + ".tmp");

    try (BufferedWriter writer = Files.newBufferedWriter(metadataTmp, StandardCharsets.UTF_8)) {
      for (Example example : index.store().asList()) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("text", example.getText());
        row.put("moderation_category", example.getCategory().getLabel());
        if (!example.getMetadata().isEmpty()) {
          row.put("metadata", example.getMetadata());
        }
        writer.write(MAPPER.writeValueAsString(row));
        writer.newLine();
      }
    }

    byte[] metadataDigest = digestOf(metadataTmp);

    try (DataOutputStream out =
        new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(vectorsTmp)))) {
      out.writeInt(MAGIC);
      out.writeInt(VERSION);
      out.writeUTF(index.metric().name());
      out.writeInt(index.dimension());
      out.writeInt(index.size());
      out.writeInt(metadataDigest.length);
      out.write(metadataDigest);
      for (float value : index.rawData()) {
        out.writeFloat(value);
      }
    }

    // A reader that lands between the two moves fails the digest check
    move(metadataTmp, directory.resolve(METADATA_FILE));
    move(vectorsTmp, directory.resolve(VECTORS_FILE));
  }

  static FlatVectorIndex read(Path directory) throws IOException {
    Path vectorsFile = directory.resolve(VECTORS_FILE);
    Path metadataFile = directory.resolve(METADATA_FILE);
    if (!Files.exists(vectorsFile) || !Files.exists(metadataFile)) {
      throw new IOException("No persisted index found in " + directory);
    }

    DistanceMetric metric;
    int dimension;
    byte[] expectedDigest;
    float[] data;
    try (DataInputStream in =
        new DataInputStream(new BufferedInputStream(Files.newInputStream(vectorsFile)))) {
      if (in.readInt() != MAGIC) {
        throw new IOException(vectorsFile + " is not a vector index file");
      }
      int version = in.readInt();
      if (version != VERSION) {
        throw new IOException("Unsupported index format version " + version);
      }
      metric = DistanceMetric.valueOf(in.readUTF());
      dimension = in.readInt();
      int count = in.readInt();
      int digestLength = in.readInt();
      if (dimension <= 0 || count < 0 || digestLength <= 0 || digestLength > MAX_DIGEST_BYTES) {
        throw new IOException(
            String.format(
                "Corrupt index header: dimension=%d count=%d digest=%d",
                dimension, count, digestLength));
      }
      expectedDigest = new byte[digestLength];
      in.readFully(expectedDigest);
      data = new float[Math.multiplyExact(count, dimension)];
      for (int i = 0; i < data.length; i++) {
        data[i] = in.readFloat();
      }
      if (in.read() != -1) {
        throw new IOException(vectorsFile + " has trailing bytes after " + count + " vectors");
      }
    } catch (EOFException e) {
      throw new IOException(vectorsFile + " is truncated", e);
    }

    if (!Arrays.equals(expectedDigest, digestOf(metadataFile))) {
      throw new IOException(
          String.format(
              "Index files out of alignment: %s was not written with %s in %s",
              METADATA_FILE, VECTORS_FILE, directory));
    }

    List<Example> examples = readMetadata(metadataFile);
    int vectorCount = data.length / dimension;
    if (examples.size() != vectorCount) {
      throw new IOException(
          String.format(
              "Index files out of alignment: %d vectors but %d metadata rows",
              vectorCount, examples.size()));
    }
    return new FlatVectorIndex(ExampleStore.of(examples), data, dimension, metric);
  }

  private static List<Example> readMetadata(Path metadataFile) throws IOException {
    List<Example> examples = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(metadataFile, StandardCharsets.UTF_8)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        Map<String, Object> row = MAPPER.readValue(line, ROW_TYPE);
        Object text = row.get("text");
        Object label = row.get("moderation_category");
        ModerationCategory category =
            ModerationCategory.fromLabel(label == null ? null : label.toString()).orElse(null);
        if (text == null || category == null) {
          throw new IOException(
              String.format(
                  "%s line %d: missing text or unknown category '%s'",
                  metadataFile, lineNumber, label));
        }
        examples.add(new Example(text.toString(), category, metadataOf(row)));
      }
    }
    return examples;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> metadataOf(Map<String, Object> row) {
    Object metadata = row.get("metadata");
    return metadata instanceof Map ? (Map<String, Object>) metadata : null;
  }

  private static byte[] digestOf(Path file) throws IOException {
    return MoreFiles.asByteSource(file).hash(Hashing.sha256()).asBytes();
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
