package com.ragmod.moderation.loadtest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import com.ragmod.moderation.config.ApiKeyFilter;
import com.ragmod.moderation.dto.ClassifyRequest;

@DisplayName("HttpClassifyClient Tests")
class HttpClassifyClientTest {

  private MockRestServiceServer server;
  private HttpClassifyClient client;

  @BeforeEach
  void setUp() {
    RestTemplate restTemplate = new RestTemplate();
    server = MockRestServiceServer.bindTo(restTemplate).build();
    client = new HttpClassifyClient("http://classifier.test/", "key-1", restTemplate);
  }

  @Test
  @DisplayName("Should post the request with the API key and read the response")
  void shouldClassify() {
    server
        .expect(requestTo("http://classifier.test/classify"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header(ApiKeyFilter.API_KEY_HEADER, "key-1"))
        .andExpect(jsonPath("$.text").value("hello"))
        .andExpect(jsonPath("$.num_examples").value(3))
        .andRespond(
            withSuccess(
                "{\"category\": \"clean\", \"outcome\": \"ok\", \"timing\": {\"generation_ms\": 12.5}}",
                MediaType.APPLICATION_JSON));

    ClassifyOutcome outcome =
        client.classify(ClassifyRequest.builder().text("hello").numExamples(3).build());

    assertThat(outcome.isSuccess()).isTrue();
    assertThat(outcome.getResponse().getCategory()).isEqualTo("clean");
    assertThat(outcome.getResponse().getTiming().getGenerationMs()).isEqualTo(12.5);
    server.verify();
  }

  @Test
  @DisplayName("Should turn an error status into a failed outcome with the code")
  void shouldReportErrorStatus() {
    server
        .expect(requestTo("http://classifier.test/classify"))
        .andRespond(withStatus(HttpStatus.GATEWAY_TIMEOUT).body("{\"stage\": \"generation\"}"));

    ClassifyOutcome outcome = client.classify(ClassifyRequest.builder().text("hello").build());

    assertThat(outcome.isSuccess()).isFalse();
    assertThat(outcome.getStatusCode()).isEqualTo(504);
    assertThat(outcome.getError()).contains("generation");
  }

  @Test
  @DisplayName("Should report healthy only for a healthy status")
  void shouldCheckHealth() {
    server
        .expect(requestTo("http://classifier.test/health"))
        .andRespond(
            withSuccess(
                "{\"status\": \"healthy\", \"index_loaded\": true}", MediaType.APPLICATION_JSON));
    server
        .expect(requestTo("http://classifier.test/health"))
        .andRespond(
            withSuccess(
                "{\"status\": \"degraded\", \"index_loaded\": false}",
                MediaType.APPLICATION_JSON));
    server.expect(requestTo("http://classifier.test/health")).andRespond(withServerError());

    assertThat(client.isHealthy()).isTrue();
    assertThat(client.isHealthy()).isFalse();
    assertThat(client.isHealthy()).isFalse();
  }
}
