package com.ragmod.moderation.service.classification;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import org.springframework.stereotype.Service;

import com.ragmod.moderation.config.ModerationProperties;
import com.ragmod.moderation.exception.IndexNotReadyException;
import com.ragmod.moderation.exception.UpstreamException;
import com.ragmod.moderation.service.gateway.EmbeddingGateway;
import com.ragmod.moderation.service.gateway.GatewayCall;
import com.ragmod.moderation.service.gateway.GenerationGateway;
import com.ragmod.moderation.service.index.VectorIndexRouter;
import com.ragmod.moderation.service.parser.ModerationResponseParser;
import com.ragmod.moderation.service.parser.ParsedModeration;
import com.ragmod.moderation.service.prompt.PromptAssembler;
import com.ragmod.moderation.service.prompt.TextTruncator;
import com.ragmod.moderation.service.vector.RetrievedExample;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Classifies one text: embed the query, retrieve the nearest labeled examples, render the few-shot
 * prompt, generate, then parse the answer into a category.
 *
 * <p>Stages run strictly in sequence on the calling thread and each records its own latency; the
 * reported total is their sum. Failures while embedding or retrieving end the request, since
 * generating without examples would be a silently different classifier. Parsing never fails; an
 * unusable answer becomes the fallback category with a flagged outcome. Retries happen only inside
 * a single gateway call, never across stages.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClassificationOrchestrator {

  private final EmbeddingGateway embeddingGateway;
  private final VectorIndexRouter indexRouter;
  private final PromptAssembler promptAssembler;
  private final GenerationGateway generationGateway;
  private final ModerationResponseParser responseParser;
  private final ModerationProperties properties;

  public ClassificationResult classify(ClassificationRequest request) {
    validate(request);
    List<StageTiming> timings = new ArrayList<>(ClassificationStage.values().length);
    String query = request.getText();

    String embeddedText = TextTruncator.truncate(query, request.getMaxTextLength());
    float[] queryVector =
        runStage(
            ClassificationStage.EMBED_QUERY,
            timings,
            () -> embeddingGateway.embedOne(embeddedText));

    List<RetrievedExample> examples =
        runStage(
            ClassificationStage.RETRIEVE,
            timings,
            () -> {
              GatewayCall<List<RetrievedExample>> call =
                  indexRouter.retrieve(queryVector, request.getNumExamples());
              if (call.getValue().isEmpty()) {
                throw new IndexNotReadyException("Vector index returned no examples");
              }
              return call;
            });

    String prompt =
        runLocalStage(
            ClassificationStage.ASSEMBLE_PROMPT,
            timings,
            () -> promptAssembler.assemble(query, examples, request.getMaxTextLength()));

    String rawResponse =
        runStage(
            ClassificationStage.GENERATE,
            timings,
            () ->
                generationGateway.generate(
                    promptAssembler.getSystemPrompt(), prompt, request.getMaxGeneratedTokens()));

    ParsedModeration parsed =
        runLocalStage(
            ClassificationStage.PARSE_AND_VALIDATE, timings, () -> responseParser.parse(rawResponse));

    ClassificationResult result =
        ClassificationResult.builder()
            .query(query)
            .category(parsed.getCategory())
            .confidence(parsed.getConfidence())
            .confidenceLevel(parsed.getConfidenceLevel())
            .explanation(parsed.getExplanation())
            .outcome(parsed.getOutcome())
            .rawResponse(rawResponse)
            .prompt(prompt)
            .retrievedExamples(examples)
            .stageTimings(timings)
            .timestamp(Instant.now())
            .build();

    log.info(
        "Classified as {} ({}, outcome={}) in {} ms [embedding={} retrieval={} prompt={} generation={} parse={}]",
        result.getCategory(),
        result.getConfidenceLevel(),
        result.getOutcome().getTag(),
        format(result.getTotalLatencyMs()),
        format(timings.get(0).getLatencyMs()),
        format(timings.get(1).getLatencyMs()),
        format(timings.get(2).getLatencyMs()),
        format(timings.get(3).getLatencyMs()),
        format(timings.get(4).getLatencyMs()));
    return result;
  }

  /** Fills unset knobs with configured defaults. */
  public ClassificationRequest withDefaults(
      String text, Integer numExamples, Integer maxTextLength, Integer maxGeneratedTokens) {
    ModerationProperties.Request defaults = properties.getRequest();
    return ClassificationRequest.builder()
        .text(text)
        .numExamples(numExamples != null ? numExamples : defaults.getDefaultNumExamples())
        .maxTextLength(maxTextLength != null ? maxTextLength : defaults.getDefaultMaxTextLength())
        .maxGeneratedTokens(
            maxGeneratedTokens != null
                ? maxGeneratedTokens
                : defaults.getDefaultMaxGeneratedTokens())
        .build();
  }

  private void validate(ClassificationRequest request) {
    if (request.getText() == null || request.getText().isBlank()) {
      throw new IllegalArgumentException("Text to classify must not be empty");
    }
    int maxExamples = properties.getRequest().getMaxNumExamples();
    if (request.getNumExamples() < 1 || request.getNumExamples() > maxExamples) {
      throw new IllegalArgumentException(
          String.format("num_examples must be between 1 and %d", maxExamples));
    }
    if (request.getMaxTextLength() < 1) {
      throw new IllegalArgumentException("max_text_length must be positive");
    }
    if (request.getMaxGeneratedTokens() < 1) {
      throw new IllegalArgumentException("max_generated_tokens must be positive");
    }
  }

  private <T> T runStage(
      ClassificationStage stage, List<StageTiming> timings, Supplier<GatewayCall<T>> body) {
    long start = System.nanoTime();
    try {
      GatewayCall<T> call = body.get();
      timings.add(new StageTiming(stage, elapsedMs(start), call.getAttempts()));
      log.debug("Stage {} done in {} ms", stage.getTag(), format(elapsedMs(start)));
      return call.getValue();
    } catch (RuntimeException e) {
      throw fail(stage, timings, start, e);
    }
  }

  private <T> T runLocalStage(
      ClassificationStage stage, List<StageTiming> timings, Supplier<T> body) {
    long start = System.nanoTime();
    try {
      T value = body.get();
      timings.add(new StageTiming(stage, elapsedMs(start), 0));
      return value;
    } catch (RuntimeException e) {
      throw fail(stage, timings, start, e);
    }
  }

  private ClassificationException fail(
      ClassificationStage stage, List<StageTiming> timings, long start, RuntimeException e) {
    ClassificationException failure =
        new ClassificationException(stage, e, withFailedStage(timings, stage, start, e));
    log.warn(
        "Classification failed at stage {} after {} ms: {}",
        stage.getTag(),
        format(elapsedMs(start)),
        e.getMessage());
    return failure;
  }

  private static List<StageTiming> withFailedStage(
      List<StageTiming> timings, ClassificationStage stage, long start, RuntimeException e) {
    List<StageTiming> all = new ArrayList<>(timings);
    int attempts =
        e instanceof UpstreamException ? ((UpstreamException) e).getAttempts() : 0;
    all.add(new StageTiming(stage, elapsedMs(start), attempts));
    return all;
  }

  private static double elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000.0;
  }

  private static String format(double millis) {
    return String.format("%.1f", millis);
  }
}
