package com.ragmod.moderation.service.gateway;

/** Sends an assembled prompt to an external text-generation model. */
public interface GenerationGateway {

  /**
   * Generates a completion at temperature 0.
   *
   * @return the trimmed generated text
   * @throws com.ragmod.moderation.exception.UpstreamException on failure or a response without
   *     content
   */
  GatewayCall<String> generate(String systemPrompt, String userPrompt, int maxTokens);

  String getModelId();
}
