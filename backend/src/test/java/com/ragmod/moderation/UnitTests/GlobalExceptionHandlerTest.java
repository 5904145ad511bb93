package com.ragmod.moderation.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.ragmod.moderation.service.classification.ClassificationException;
import com.ragmod.moderation.service.classification.ClassificationStage;
import com.ragmod.moderation.service.classification.StageTiming;

@ExtendWith(MockitoExtension.class)
@DisplayName("GlobalExceptionHandler Unit Tests")
public class GlobalExceptionHandlerTest {

  @Mock private WebRequest webRequest;

  @Mock private BindingResult bindingResult;

  @InjectMocks private GlobalExceptionHandler exceptionHandler;

  @BeforeEach
  void setUp() {
    ReflectionTestUtils.setField(exceptionHandler, "environment", "test");
    ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", false);
  }

  private static ClassificationException failedAt(
      ClassificationStage stage, RuntimeException cause) {
    return new ClassificationException(stage, cause, List.of(new StageTiming(stage, 1.0, 0)));
  }

  @Nested
  @DisplayName("Classification Failure Tests")
  class ClassificationFailureTests {

    @Test
    @DisplayName("Should answer 504 with stage, kind and attempts for an unreachable upstream")
    void shouldMapUnreachableToGatewayTimeout() {
      // Given
      when(webRequest.getDescription(false)).thenReturn("uri=/classify");
      ClassificationException exception =
          failedAt(
              ClassificationStage.GENERATE,
              new UpstreamUnreachableException("generation", "read timed out", null)
                  .withAttempts(3));

      // When
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleClassificationException(exception, webRequest);

      // Then
      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
      GlobalExceptionHandler.ErrorResponse body = response.getBody();
      assertThat(body).isNotNull();
      assertThat(body.getStage()).isEqualTo("generation");
      assertThat(body.getErrorKind()).isEqualTo("unreachable");
      assertThat(body.getAttempts()).isEqualTo(3);
      assertThat(body.getPath()).isEqualTo("/classify");
    }

    @Test
    @DisplayName("Should answer 502 for a rejected or malformed upstream")
    void shouldMapRejectedAndMalformedToBadGateway() {
      when(webRequest.getDescription(false)).thenReturn("uri=/classify");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> rejected =
          exceptionHandler.handleClassificationException(
              failedAt(
                  ClassificationStage.EMBED_QUERY,
                  new UpstreamRejectedException("embedding", 429, "quota exceeded", null)),
              webRequest);
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> malformed =
          exceptionHandler.handleClassificationException(
              failedAt(
                  ClassificationStage.GENERATE,
                  new MalformedUpstreamResponseException("generation", "no choices")),
              webRequest);

      assertThat(rejected.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
      assertThat(rejected.getBody().getErrorKind()).isEqualTo("rejected");
      assertThat(malformed.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
      assertThat(malformed.getBody().getErrorKind()).isEqualTo("malformed");
    }

    @Test
    @DisplayName("Should answer 503 when retrieval found no index")
    void shouldMapIndexNotReadyToUnavailable() {
      when(webRequest.getDescription(false)).thenReturn("uri=/classify");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleClassificationException(
              failedAt(ClassificationStage.RETRIEVE, new IndexNotReadyException("empty")),
              webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
      assertThat(response.getBody().getErrorKind()).isEqualTo("index_not_ready");
      assertThat(response.getBody().getAttempts()).isNull();
    }

    @Test
    @DisplayName("Should map causes to statuses")
    void shouldMapStatuses() {
      assertThat(GlobalExceptionHandler.statusFor(new DimensionMismatchException(3, 4)))
          .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
      assertThat(GlobalExceptionHandler.statusFor(new IllegalArgumentException("bad")))
          .isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(GlobalExceptionHandler.statusFor(new RuntimeException("boom")))
          .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }
  }

  @Nested
  @DisplayName("Request Error Tests")
  class RequestErrorTests {

    @Test
    @DisplayName("Should handle IllegalArgumentException with proper response")
    void shouldHandleIllegalArgumentException() {
      when(webRequest.getDescription(false)).thenReturn("uri=/classify");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleIllegalArgument(
              new IllegalArgumentException("Text to classify must not be empty"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(response.getBody().getStatus()).isEqualTo(400);
      assertThat(response.getBody().getError()).isEqualTo("Bad Request");
      assertThat(response.getBody().getMessage()).isEqualTo("Text to classify must not be empty");
    }

    @Test
    @DisplayName("Should collect field errors from validation failures")
    void shouldHandleValidationErrors() throws NoSuchMethodException {
      when(webRequest.getDescription(false)).thenReturn("uri=/classify");
      when(bindingResult.getAllErrors())
          .thenReturn(
              List.of(new FieldError("classifyRequest", "text", "must not be blank")));
      MethodParameter parameter =
          new MethodParameter(Object.class.getMethod("equals", Object.class), 0);

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleValidation(
              new MethodArgumentNotValidException(parameter, bindingResult), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(response.getBody().getValidationErrors())
          .containsEntry("text", "must not be blank");
    }

    @Test
    @DisplayName("Should answer 409 for a conflicting index build")
    void shouldHandleBuildInProgress() {
      when(webRequest.getDescription(false)).thenReturn("uri=/index/build");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleBuildInProgress(new IndexBuildInProgressException(), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
      assertThat(response.getBody().getMessage()).contains("already in progress");
    }

    @Test
    @DisplayName("Should answer 500 for other illegal states")
    void shouldTreatOtherIllegalStatesAsUnexpected() {
      when(webRequest.getDescription(false)).thenReturn("uri=/index/reload");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleUnexpected(
              new IllegalStateException("No S3 bucket configured for index artifacts"),
              webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
      assertThat(response.getBody().getMessage()).isEqualTo("An unexpected error occurred");
    }

    @Test
    @DisplayName("Should answer 500 for I/O failures")
    void shouldHandleIoException() {
      when(webRequest.getDescription(false)).thenReturn("uri=/index/reload");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleIo(new IOException("disk full"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
      assertThat(response.getBody().getMessage()).isEqualTo("disk full");
    }

    @Test
    @DisplayName("Should answer 404 for unknown routes and resources")
    void shouldHandleNotFound() {
      when(webRequest.getDescription(false)).thenReturn("uri=/nope");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> noHandler =
          exceptionHandler.handleNotFound(
              new NoHandlerFoundException("GET", "/nope", new HttpHeaders()), webRequest);
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> noResource =
          exceptionHandler.handleNotFound(
              new NoResourceFoundException(HttpMethod.GET, "nope"), webRequest);

      assertThat(noHandler.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
      assertThat(noHandler.getBody().getMessage()).isEqualTo("No endpoint GET /nope");
      assertThat(noResource.getBody().getMessage())
          .isEqualTo("The requested resource was not found");
    }

    @Test
    @DisplayName("Should answer 405 for unsupported methods")
    void shouldHandleMethodNotSupported() {
      when(webRequest.getDescription(false)).thenReturn("uri=/classify");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleMethodNotSupported(
              new HttpRequestMethodNotSupportedException("DELETE"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
      assertThat(response.getBody().getMessage()).contains("DELETE");
    }
  }

  @Nested
  @DisplayName("Generic Exception Tests")
  class GenericExceptionTests {

    @Test
    @DisplayName("Should hide the cause unless debugging outside production")
    void shouldHideDebugMessageByDefault() {
      when(webRequest.getDescription(false)).thenReturn("uri=/classify");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleUnexpected(new RuntimeException("secret"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
      assertThat(response.getBody().getMessage()).isEqualTo("An unexpected error occurred");
      assertThat(response.getBody().getDebugMessage()).isNull();
    }

    @Test
    @DisplayName("Should include the debug message when enabled")
    void shouldIncludeDebugMessageWhenEnabled() {
      ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", true);
      when(webRequest.getDescription(false)).thenReturn("uri=/classify");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleUnexpected(new RuntimeException("details"), webRequest);

      assertThat(response.getBody().getDebugMessage()).isEqualTo("details");
    }

    @Test
    @DisplayName("Should never include the debug message in production")
    void shouldHideDebugMessageInProduction() {
      ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", true);
      ReflectionTestUtils.setField(exceptionHandler, "environment", "production");
      when(webRequest.getDescription(false)).thenReturn("uri=/classify");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleUnexpected(new RuntimeException("details"), webRequest);

      assertThat(response.getBody().getDebugMessage()).isNull();
    }
  }
}
