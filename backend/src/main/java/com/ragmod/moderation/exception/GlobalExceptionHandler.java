package com.ragmod.moderation.exception;

import java.io.IOException;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ragmod.moderation.service.classification.ClassificationException;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  // Browser probes that should not show up as warnings
  private static final Set<String> QUIET_NOT_FOUND =
      Set.of("favicon.ico", ".well-known/appspecific/com.chrome.devtools.json");

  @Value("${app.environment:production}")
  private String environment;

  @Value("${app.debug.enabled:false}")
  private boolean debugEnabled;

  /** Maps a failed classification to a status by what failed and where. */
  @ExceptionHandler(ClassificationException.class)
  public ResponseEntity<ErrorResponse> handleClassificationException(
      ClassificationException ex, WebRequest request) {
    Throwable cause = ex.getCause();
    HttpStatus status = statusFor(cause);
    String stage = ex.getStage().getTag();
    if (status.is5xxServerError()) {
      log.error("Classification failed at stage {}: {}", stage, ex.getMessage());
    } else {
      log.warn("Classification rejected at stage {}: {}", stage, ex.getMessage());
    }

    UpstreamException.Kind kind = ex.getUpstreamKind();
    return respond(
        status,
        cause != null ? cause.getMessage() : ex.getMessage(),
        request,
        body ->
            body.stage(stage)
                .errorKind(kind != null ? kind.name().toLowerCase(Locale.ROOT) : errorKindOf(cause))
                .attempts(kind != null ? ex.getAttempts() : null));
  }

  @ExceptionHandler(IndexNotReadyException.class)
  public ResponseEntity<ErrorResponse> handleIndexNotReady(
      IndexNotReadyException ex, WebRequest request) {
    log.warn("Index not ready: {}", ex.getMessage());
    return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), request);
  }

  @ExceptionHandler(IndexBuildInProgressException.class)
  public ResponseEntity<ErrorResponse> handleBuildInProgress(
      IndexBuildInProgressException ex, WebRequest request) {
    log.warn("Conflicting request: {}", ex.getMessage());
    return respond(HttpStatus.CONFLICT, ex.getMessage(), request);
  }

  /** Corpus or index files that could not be read or written. */
  @ExceptionHandler(IOException.class)
  public ResponseEntity<ErrorResponse> handleIo(IOException ex, WebRequest request) {
    log.error("Index or corpus I/O failed: {}", ex.getMessage(), ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(
      IllegalArgumentException ex, WebRequest request) {
    log.warn("Rejected request: {}", ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(
      MethodArgumentNotValidException ex, WebRequest request) {
    Map<String, String> fields = new LinkedHashMap<>();
    for (FieldError error : ex.getBindingResult().getFieldErrors()) {
      fields.putIfAbsent(error.getField(), error.getDefaultMessage());
    }
    log.warn("Request validation failed: {}", fields);
    return respond(
        HttpStatus.BAD_REQUEST,
        "Request validation failed",
        request,
        body -> body.validationErrors(fields));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadableBody(
      HttpMessageNotReadableException ex, WebRequest request) {
    log.warn("Unreadable request body: {}", ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, "Malformed JSON request", request);
  }

  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<ErrorResponse> handleNotFound(Exception ex, WebRequest request) {
    String message = "The requested resource was not found";
    if (ex instanceof NoHandlerFoundException) {
      NoHandlerFoundException noHandler = (NoHandlerFoundException) ex;
      message =
          String.format("No endpoint %s %s", noHandler.getHttpMethod(), noHandler.getRequestURL());
    }

    String path = pathOf(request);
    if (QUIET_NOT_FOUND.stream().noneMatch(path::contains)) {
      log.warn("Not found: {}", message);
    }
    return respond(HttpStatus.NOT_FOUND, message, request);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {
    String message = String.format("%s is not supported on %s", ex.getMethod(), pathOf(request));
    log.warn("Method not allowed: {}", message);
    return respond(HttpStatus.METHOD_NOT_ALLOWED, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, WebRequest request) {
    log.error("Unexpected error occurred", ex);
    boolean exposeDetail = debugEnabled && !"production".equals(environment);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "An unexpected error occurred",
        request,
        body -> body.debugMessage(exposeDetail ? ex.getMessage() : null));
  }

  static HttpStatus statusFor(Throwable cause) {
    if (cause instanceof UpstreamException) {
      return ((UpstreamException) cause).getKind() == UpstreamException.Kind.UNREACHABLE
          ? HttpStatus.GATEWAY_TIMEOUT
          : HttpStatus.BAD_GATEWAY;
    }
    if (cause instanceof IndexNotReadyException) {
      return HttpStatus.SERVICE_UNAVAILABLE;
    }
    if (cause instanceof IllegalArgumentException) {
      return HttpStatus.BAD_REQUEST;
    }
    return HttpStatus.INTERNAL_SERVER_ERROR;
  }

  private static String errorKindOf(Throwable cause) {
    if (cause instanceof IndexNotReadyException) {
      return "index_not_ready";
    }
    if (cause instanceof DimensionMismatchException) {
      return "dimension_mismatch";
    }
    return "internal";
  }

  private ResponseEntity<ErrorResponse> respond(
      HttpStatus status, String message, WebRequest request) {
    return respond(status, message, request, body -> {});
  }

  private ResponseEntity<ErrorResponse> respond(
      HttpStatus status,
      String message,
      WebRequest request,
      Consumer<ErrorResponse.ErrorResponseBuilder> details) {
    ErrorResponse.ErrorResponseBuilder body = ErrorResponse.of(status, message, pathOf(request));
    details.accept(body);
    return ResponseEntity.status(status).body(body.build());
  }

  private static String pathOf(WebRequest request) {
    return request.getDescription(false).replace("uri=", "");
  }

  /** Error body shared by every failing endpoint and the API key filter. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  @Schema(description = "Error response")
  public static class ErrorResponse {
    private Instant timestamp;
    private int status;
    private String error;
    private String message;
    private String path;

    /** Classification stage that failed, e.g. "embedding" or "generation". */
    private String stage;

    @JsonProperty("error_kind")
    private String errorKind;

    private Integer attempts;

    @JsonProperty("validation_errors")
    private Map<String, String> validationErrors;

    @JsonProperty("debug_message")
    private String debugMessage;

    public static ErrorResponseBuilder of(HttpStatus status, String message, String path) {
      return builder()
          .timestamp(Instant.now())
          .status(status.value())
          .error(status.getReasonPhrase())
          .message(message)
          .path(path);
    }

    public Map<String, String> getValidationErrors() {
      return validationErrors == null ? null : Collections.unmodifiableMap(validationErrors);
    }
  }
}
