package com.ragmod.moderation.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthResponse {

  public static final String HEALTHY = "healthy";
  public static final String DEGRADED = "degraded";

  @JsonProperty("status")
  private String status;

  @JsonProperty("index_loaded")
  private boolean indexLoaded;

  @JsonProperty("index_backend")
  private String indexBackend;

  @JsonProperty("index_size")
  private Integer indexSize;

  @JsonProperty("embedding_model")
  private String embeddingModel;

  @JsonProperty("generation_model")
  private String generationModel;

  @JsonProperty("version")
  private String version;

  @JsonProperty("timestamp")
  private Instant timestamp;
}
