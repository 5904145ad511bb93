package com.ragmod.moderation.service.vector;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ragmod.moderation.service.taxonomy.ModerationCategory;

import lombok.Builder;
import lombok.Value;

/** One nearest-neighbor hit. Lower distance means more similar. */
@Value
@Builder
public class RetrievedExample {

  @JsonProperty("text")
  String text;

  @JsonProperty("category")
  ModerationCategory category;

  @JsonProperty("distance")
  float distance;
}
