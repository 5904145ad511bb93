package com.ragmod.moderation.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import com.ragmod.moderation.service.parser.CategoryTieBreak;
import com.ragmod.moderation.service.vector.DistanceMetric;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "moderation")
public class ModerationProperties {

  private String version = "1.0.0";

  private Embedding embedding = new Embedding();
  private Generation generation = new Generation();
  private Http http = new Http();
  private Retry retry = new Retry();
  private Index index = new Index();
  private Remote remote = new Remote();
  private Artifacts artifacts = new Artifacts();
  private Prompt prompt = new Prompt();
  private Parser parser = new Parser();
  private Request request = new Request();
  private Security security = new Security();

  public enum EmbeddingProvider {
    OPENAI,
    BEDROCK
  }

  public enum IndexBackend {
    LOCAL,
    REMOTE
  }

  @Data
  public static class Embedding {
    private EmbeddingProvider provider = EmbeddingProvider.OPENAI;
    private String baseUrl = "http://localhost:8890/v1";
    private String model = "Alibaba-NLP/gte-Qwen2-1.5B-instruct";
    private String apiKey = "";
    private long timeoutMs = 30_000;
    private int batchSize = 32;
    private String bedrockModelId = "amazon.titan-embed-text-v2:0";
    private String bedrockRegion = "us-east-1";
    private Cache cache = new Cache();
  }

  @Data
  public static class Cache {
    private boolean enabled;
    private long maxSize = 10_000;
    private long expireAfterWriteMinutes = 60;
  }

  @Data
  public static class Generation {
    private String baseUrl = "http://localhost:8899/v1";
    private String model = "microsoft/Phi-3.5-mini-instruct";
    private String apiKey = "";
    private long timeoutMs = 60_000;
    private int maxTokens = 128;
    private double temperature = 0.0;
  }

  @Data
  public static class Http {
    private int maxTotal = 192;
    private int maxPerRoute = 192;
    private long connectTimeoutMs = 5_000;
    private long keepAliveSeconds = 60;
  }

  @Data
  public static class Retry {
    private int maxAttempts = 3;
    private long initialDelayMs = 200;
    private long maxDelayMs = 5_000;
    private long jitterMs = 100;
  }

  @Data
  public static class Index {
    private IndexBackend backend = IndexBackend.LOCAL;
    private String directory = "data/index";
    private DistanceMetric metric = DistanceMetric.L2;
    private boolean loadOnStartup = true;
  }

  @Data
  public static class Remote {
    private String projectId = "";
    private String dataset = "stage_test_tables";
    private String table = "test_comment_mod_embeddings";
    private String embeddingColumn = "embedding";
    private DistanceMetric metric = DistanceMetric.COSINE;
    private double fractionListsToSearch = 0.15;
    private boolean useBruteForce;
    private long timeoutMs = 30_000;

    /** Expected embedding length; 0 skips the local check. */
    private int dimension;
  }

  @Data
  public static class Artifacts {
    private String s3Bucket = "";
    private String s3Prefix = "moderation-index/";
    private String region = "us-east-1";
    private boolean downloadOnStartup;
  }

  @Data
  public static class Prompt {
    private String systemTemplate = "moderation-system";
    private String examplesTemplate = "moderation-rag";
  }

  @Data
  public static class Parser {
    /** Non-clean predictions below this confidence become clean. 0 disables the downgrade. */
    private double confidenceThreshold = 0.0;

    private CategoryTieBreak tieBreak = CategoryTieBreak.FIRST_MATCH;
  }

  @Data
  public static class Request {
    private int defaultNumExamples = 3;
    private int maxNumExamples = 10;
    private int defaultMaxTextLength = 2000;
    private int defaultMaxGeneratedTokens = 128;
  }

  @Data
  public static class Security {
    private String apiKey = "";

    /** Browser origins allowed by CORS; empty allows any. */
    private List<String> allowedOrigins = new ArrayList<>();

    public boolean isEnabled() {
      return apiKey != null && !apiKey.isBlank();
    }
  }
}
