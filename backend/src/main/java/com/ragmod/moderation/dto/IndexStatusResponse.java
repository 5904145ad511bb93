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
public class IndexStatusResponse {

  @JsonProperty("backend")
  private String backend;

  @JsonProperty("loaded")
  private boolean loaded;

  @JsonProperty("size")
  private Integer size;

  @JsonProperty("dimension")
  private Integer dimension;

  @JsonProperty("metric")
  private String metric;

  @JsonProperty("directory")
  private String directory;

  @JsonProperty("building")
  private boolean building;

  @JsonProperty("installed_at")
  private Instant installedAt;

  @JsonProperty("last_error")
  private String lastError;
}
