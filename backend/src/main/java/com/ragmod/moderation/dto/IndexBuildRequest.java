package com.ragmod.moderation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexBuildRequest {

  /** JSONL corpus on the server's filesystem. */
  @NotBlank
  @JsonProperty("corpus_path")
  private String corpusPath;

  /** Also upload the built index to the configured S3 prefix. */
  @JsonProperty("upload")
  private boolean upload;
}
