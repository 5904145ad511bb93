package com.ragmod.moderation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassifyRequest {

  @NotBlank
  @JsonProperty("text")
  @Schema(description = "Text to classify", example = "Buy cheap pills now")
  private String text;

  @Min(1)
  @Max(10)
  @JsonProperty("num_examples")
  @Schema(description = "Number of retrieved examples to show the model", example = "3")
  private Integer numExamples;

  @Min(1)
  @JsonProperty("max_text_length")
  @Schema(description = "Maximum characters of query and example text in the prompt")
  private Integer maxTextLength;

  @Min(1)
  @Max(4096)
  @JsonProperty("max_generated_tokens")
  private Integer maxGeneratedTokens;
}
