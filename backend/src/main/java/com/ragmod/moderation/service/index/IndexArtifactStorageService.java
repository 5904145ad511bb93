package com.ragmod.moderation.service.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.ragmod.moderation.config.ModerationProperties;
import com.ragmod.moderation.service.vector.FlatVectorIndex;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * Copies persisted index files between the local index directory and an S3 prefix, so that
 * serving instances can start from an index built elsewhere.
 */
@Slf4j
@Service
public class IndexArtifactStorageService {

  private final ModerationProperties.Artifacts config;

  private volatile S3Client s3Client;

  @Autowired
  public IndexArtifactStorageService(ModerationProperties properties) {
    this(properties.getArtifacts(), null);
  }

  IndexArtifactStorageService(ModerationProperties.Artifacts config, S3Client s3Client) {
    this.config = config;
    this.s3Client = s3Client;
  }

  public boolean isConfigured() {
    return config.getS3Bucket() != null && !config.getS3Bucket().isBlank();
  }

  /** Downloads every index file into {@code directory}, replacing local copies. */
  public void download(Path directory) throws IOException {
    requireConfigured();
    Files.createDirectories(directory);
    for (String file : FlatVectorIndex.FILES) {
      String key = keyFor(file);
      Path target = directory.resolve(file);
      Path partial = directory.resolve(file + ".download");
      try {
        ResponseBytes<GetObjectResponse> bytes =
            client()
                .getObjectAsBytes(
                    GetObjectRequest.builder().bucket(config.getS3Bucket()).key(key).build());
        Files.write(partial, bytes.asByteArray());
      } catch (SdkException e) {
        Files.deleteIfExists(partial);
        throw new IOException(
            String.format("Failed to download s3://%s/%s", config.getS3Bucket(), key), e);
      }
      Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
      log.info("Downloaded s3://{}/{} to {}", config.getS3Bucket(), key, target);
    }
  }

  /** Uploads every index file found in {@code directory}. */
  public void upload(Path directory) throws IOException {
    requireConfigured();
    for (String file : FlatVectorIndex.FILES) {
      Path source = directory.resolve(file);
      if (!Files.exists(source)) {
        throw new IOException("Cannot upload missing index file " + source);
      }
      String key = keyFor(file);
      try {
        client()
            .putObject(
                PutObjectRequest.builder().bucket(config.getS3Bucket()).key(key).build(),
                RequestBody.fromFile(source));
      } catch (SdkException e) {
        throw new IOException(
            String.format("Failed to upload %s to s3://%s/%s", source, config.getS3Bucket(), key),
            e);
      }
      log.info("Uploaded {} to s3://{}/{}", source, config.getS3Bucket(), key);
    }
  }

  @PreDestroy
  public void close() {
    if (s3Client != null) {
      s3Client.close();
    }
  }

  String keyFor(String file) {
    String prefix = config.getS3Prefix() == null ? "" : config.getS3Prefix();
    if (!prefix.isEmpty() && !prefix.endsWith("/")) {
      prefix = prefix + "/";
    }
    return prefix + file;
  }

  private void requireConfigured() {
    if (!isConfigured()) {
      throw new IllegalStateException("No S3 bucket configured for index artifacts");
    }
  }

  private S3Client client() {
    S3Client client = s3Client;
    if (client == null) {
      synchronized (this) {
        if (s3Client == null) {
          s3Client =
              S3Client.builder()
                  .region(Region.of(config.getRegion()))
                  .credentialsProvider(DefaultCredentialsProvider.create())
                  .build();
          log.info("S3 client initialized for bucket {}", config.getS3Bucket());
        }
        client = s3Client;
      }
    }
    return client;
  }
}
