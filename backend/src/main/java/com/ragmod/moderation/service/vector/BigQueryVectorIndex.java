package com.ragmod.moderation.service.vector;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.ServiceOptions;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.BigQueryOptions;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.JobException;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.QueryParameterValue;
import com.google.cloud.bigquery.StandardSQLTypeName;
import com.google.cloud.bigquery.TableResult;
import com.google.cloud.http.HttpTransportOptions;
import com.ragmod.moderation.config.ModerationProperties;
import com.ragmod.moderation.exception.DimensionMismatchException;
import com.ragmod.moderation.exception.UpstreamException;
import com.ragmod.moderation.exception.UpstreamRejectedException;
import com.ragmod.moderation.exception.UpstreamUnreachableException;
import com.ragmod.moderation.service.gateway.GatewayCall;
import com.ragmod.moderation.service.gateway.RetryPolicy;
import com.ragmod.moderation.service.taxonomy.ModerationCategory;

import lombok.extern.slf4j.Slf4j;

/**
 * Nearest-neighbor search delegated to a BigQuery table with a vector column, through {@code
 * VECTOR_SEARCH}. The query embedding travels as a query parameter; table name, metric and tuning
 * options come from configuration.
 */
@Slf4j
@Service
public class BigQueryVectorIndex implements VectorIndex {

  static final String UPSTREAM = "bigquery";

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_\\-]+");

  private final ModerationProperties.Remote config;
  private final ObjectMapper objectMapper;
  private final RetryPolicy retryPolicy;

  private volatile BigQuery bigQuery;

  @Autowired
  public BigQueryVectorIndex(ModerationProperties properties, ObjectMapper objectMapper) {
    this(properties.getRemote(), objectMapper, RetryPolicy.from(properties.getRetry()), null);
  }

  BigQueryVectorIndex(
      ModerationProperties.Remote config,
      ObjectMapper objectMapper,
      RetryPolicy retryPolicy,
      BigQuery bigQuery) {
    this.config = config;
    this.objectMapper = objectMapper;
    this.retryPolicy = retryPolicy;
    this.bigQuery = bigQuery;
  }

  @Override
  public List<RetrievedExample> search(float[] queryVector, int k) {
    return searchWithTelemetry(queryVector, k).getValue();
  }

  /** Like {@link #search} but also reports attempts and elapsed time. */
  public GatewayCall<List<RetrievedExample>> searchWithTelemetry(float[] queryVector, int k) {
    if (k <= 0) {
      throw new IllegalArgumentException("k must be positive, got " + k);
    }
    if (config.getDimension() > 0 && queryVector.length != config.getDimension()) {
      throw new DimensionMismatchException(config.getDimension(), queryVector.length);
    }

    QueryJobConfiguration query = buildQuery(queryVector, k);
    GatewayCall<List<RetrievedExample>> call =
        retryPolicy.execute("vector search", () -> runQuery(query));
    log.debug(
        "Remote vector search returned {} rows in {} ms ({} attempt(s))",
        call.getValue().size(),
        call.getElapsedMs(),
        call.getAttempts());
    return call;
  }

  @Override
  public int size() {
    return -1;
  }

  @Override
  public int dimension() {
    return config.getDimension();
  }

  @Override
  public DistanceMetric metric() {
    return config.getMetric();
  }

  @Override
  public String describe() {
    return "remote";
  }

  public boolean isConfigured() {
    return IDENTIFIER.matcher(config.getDataset()).matches()
        && IDENTIFIER.matcher(config.getTable()).matches()
        && IDENTIFIER.matcher(config.getEmbeddingColumn()).matches();
  }

  QueryJobConfiguration buildQuery(float[] queryVector, int k) {
    if (!isConfigured()) {
      throw new IllegalStateException(
          "Remote index table is not configured: " + config.getDataset() + "." + config.getTable());
    }

    Double[] embedding = new Double[queryVector.length];
    for (int i = 0; i < queryVector.length; i++) {
      embedding[i] = (double) queryVector[i];
    }

    String sql =
        String.format(
            "SELECT base.text AS text, base.moderation_category AS moderation_category, distance\n"
                + "FROM VECTOR_SEARCH(\n"
                + "  TABLE `%s`, '%s',\n"
                + "  (SELECT @query_embedding AS %s),\n"
                + "  top_k => %d,\n"
                + "  distance_type => '%s',\n"
                + "  options => '%s')\n"
                + "ORDER BY distance\n"
                + "LIMIT %d",
            tableReference(),
            config.getEmbeddingColumn(),
            config.getEmbeddingColumn(),
            k,
            config.getMetric().getWarehouseName(),
            searchOptions(),
            k);

    return QueryJobConfiguration.newBuilder(sql)
        .addNamedParameter(
            "query_embedding", QueryParameterValue.array(embedding, StandardSQLTypeName.FLOAT64))
        .setUseLegacySql(false)
        .build();
  }

  String searchOptions() {
    Map<String, Object> options = new LinkedHashMap<>();
    options.put("fraction_lists_to_search", config.getFractionListsToSearch());
    options.put("use_brute_force", config.isUseBruteForce());
    try {
      return objectMapper.writeValueAsString(options);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not encode vector search options", e);
    }
  }

  private String tableReference() {
    String project = config.getProjectId();
    String dataset = config.getDataset() + "." + config.getTable();
    return project == null || project.isBlank() ? dataset : project + "." + dataset;
  }

  private List<RetrievedExample> runQuery(QueryJobConfiguration query) {
    TableResult result;
    try {
      result = client().query(query);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UpstreamUnreachableException(UPSTREAM, "Interrupted waiting for query", e);
    } catch (JobException e) {
      throw new UpstreamRejectedException(UPSTREAM, 0, "Query job failed: " + e.getMessage(), e);
    } catch (BigQueryException e) {
      throw classify(e);
    }

    List<RetrievedExample> examples = new ArrayList<>();
    for (FieldValueList row : result.iterateAll()) {
      String label = stringOrNull(row.get("moderation_category"));
      Optional<ModerationCategory> category = ModerationCategory.fromLabel(label);
      if (category.isEmpty()) {
        log.warn("Skipping remote row with unknown category '{}'", label);
        continue;
      }
      examples.add(
          RetrievedExample.builder()
              .text(stringOrNull(row.get("text")))
              .category(category.get())
              .distance((float) row.get("distance").getDoubleValue())
              .build());
    }
    return examples;
  }

  static UpstreamException classify(BigQueryException e) {
    int code = e.getCode();
    if (code == 0 || code >= 500) {
      return new UpstreamUnreachableException(UPSTREAM, e.getMessage(), e);
    }
    return new UpstreamRejectedException(UPSTREAM, code, e.getReason() + ": " + e.getMessage(), e);
  }

  private static String stringOrNull(FieldValue value) {
    return value == null || value.isNull() ? null : value.getStringValue();
  }

  private BigQuery client() {
    BigQuery client = bigQuery;
    if (client == null) {
      synchronized (this) {
        if (bigQuery == null) {
          BigQueryOptions.Builder options =
              BigQueryOptions.newBuilder()
                  .setRetrySettings(ServiceOptions.getNoRetrySettings())
                  .setTransportOptions(
                      HttpTransportOptions.newBuilder()
                          .setConnectTimeout((int) config.getTimeoutMs())
                          .setReadTimeout((int) config.getTimeoutMs())
                          .build());
          if (config.getProjectId() != null && !config.getProjectId().isBlank()) {
            options.setProjectId(config.getProjectId());
          }
          bigQuery = options.build().getService();
          log.info(
              "BigQuery client initialized for {}.{}", config.getDataset(), config.getTable());
        }
        client = bigQuery;
      }
    }
    return client;
  }
}
