package com.ragmod.moderation.service.gateway;

import lombok.Value;

/** Result of a gateway call together with how many attempts and how long it took. */
@Value
public class GatewayCall<T> {
  T value;
  int attempts;
  long elapsedMs;
}
