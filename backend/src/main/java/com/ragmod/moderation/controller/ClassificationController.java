package com.ragmod.moderation.controller;

import java.time.Instant;
import java.util.Locale;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import com.ragmod.moderation.config.ModerationProperties;
import com.ragmod.moderation.dto.ClassifyRequest;
import com.ragmod.moderation.dto.ClassifyResponse;
import com.ragmod.moderation.dto.HealthResponse;
import com.ragmod.moderation.exception.GlobalExceptionHandler.ErrorResponse;
import com.ragmod.moderation.service.classification.ClassificationOrchestrator;
import com.ragmod.moderation.service.classification.ClassificationRequest;
import com.ragmod.moderation.service.classification.ClassificationResult;
import com.ragmod.moderation.service.gateway.EmbeddingGateway;
import com.ragmod.moderation.service.gateway.GenerationGateway;
import com.ragmod.moderation.service.index.IndexHolder;
import com.ragmod.moderation.service.index.VectorIndexRouter;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Moderation", description = "Retrieval-augmented text moderation")
public class ClassificationController {

  private final ClassificationOrchestrator orchestrator;
  private final VectorIndexRouter indexRouter;
  private final IndexHolder indexHolder;
  private final EmbeddingGateway embeddingGateway;
  private final GenerationGateway generationGateway;
  private final ModerationProperties properties;

  @Value("${app.response.include-prompt:false}")
  private boolean includePrompt;

  @PostMapping(
      value = "/classify",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Classify text",
      description =
          "Retrieves similar labeled examples, asks the generative model for a category and"
              + " returns the validated label with the examples used")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Classification completed",
            content = @Content(schema = @Schema(implementation = ClassifyResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(
            responseCode = "502",
            description = "An upstream model rejected the call or answered malformed",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(
            responseCode = "503",
            description = "No vector index is loaded",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(
            responseCode = "504",
            description = "An upstream model could not be reached",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
      })
  public ResponseEntity<ClassifyResponse> classify(@Valid @RequestBody ClassifyRequest request) {
    log.debug(
        "Classification request: {} chars, num_examples={}",
        request.getText().length(),
        request.getNumExamples());

    ClassificationRequest classification =
        orchestrator.withDefaults(
            request.getText(),
            request.getNumExamples(),
            request.getMaxTextLength(),
            request.getMaxGeneratedTokens());
    ClassificationResult result = orchestrator.classify(classification);
    return ResponseEntity.ok(ClassifyResponse.from(result, includePrompt));
  }

  @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Health check", description = "Reports whether an index is ready to serve")
  public ResponseEntity<HealthResponse> health() {
    boolean ready = indexRouter.isReady();
    HealthResponse health =
        HealthResponse.builder()
            .status(ready ? HealthResponse.HEALTHY : HealthResponse.DEGRADED)
            .indexLoaded(ready)
            .indexBackend(indexRouter.getBackend().name().toLowerCase(Locale.ROOT))
            .indexSize(indexHolder.current().map(index -> index.size()).orElse(null))
            .embeddingModel(embeddingGateway.getModelId())
            .generationModel(generationGateway.getModelId())
            .version(properties.getVersion())
            .timestamp(Instant.now())
            .build();
    return ResponseEntity.ok(health);
  }
}
