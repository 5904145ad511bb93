package com.ragmod.moderation.loadtest;

import com.ragmod.moderation.dto.ClassifyRequest;
import com.ragmod.moderation.dto.ClassifyResponse;
import com.ragmod.moderation.service.classification.ClassificationException;
import com.ragmod.moderation.service.classification.ClassificationOrchestrator;
import com.ragmod.moderation.service.index.VectorIndexRouter;

import lombok.RequiredArgsConstructor;

/** Drives the orchestrator in-process, bypassing HTTP. */
@RequiredArgsConstructor
public class OrchestratorClassifyClient implements ClassifyClient {

  private final ClassificationOrchestrator orchestrator;
  private final VectorIndexRouter indexRouter;

  @Override
  public ClassifyOutcome classify(ClassifyRequest request) {
    try {
      return ClassifyOutcome.success(
          ClassifyResponse.from(
              orchestrator.classify(
                  orchestrator.withDefaults(
                      request.getText(),
                      request.getNumExamples(),
                      request.getMaxTextLength(),
                      request.getMaxGeneratedTokens())),
              false));
    } catch (ClassificationException e) {
      return ClassifyOutcome.failure(e.getMessage(), null);
    } catch (IllegalArgumentException e) {
      return ClassifyOutcome.failure(e.getMessage(), 400);
    }
  }

  @Override
  public boolean isHealthy() {
    return indexRouter.isReady();
  }
}
