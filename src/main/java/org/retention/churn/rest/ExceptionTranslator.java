package org.retention.churn.rest;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.retention.churn.domain.TransitionResult;
import org.retention.churn.exception.CustomerConflictException;
import org.retention.churn.exception.CustomerNotFoundException;
import org.retention.churn.exception.CustomerServiceException;
import org.retention.churn.exception.CustomerValidationException;
import org.retention.churn.exception.InvalidTransitionException;
import org.retention.churn.exception.ServiceUnavailableException;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Renders every exception leaving a controller as an RFC 7807 Problem Detail with an
 * {@code errorCode}, a {@code timestamp} and request metadata. The {@code dev} profile adds the
 * exception class and a truncated stack trace.
 */
@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
@RequestMapping(
    produces = {MediaType.APPLICATION_JSON_VALUE, MediaType.APPLICATION_PROBLEM_JSON_VALUE})
public class ExceptionTranslator {

  static final String ERROR_BASE_URL = "https://api.example.com/errors/";
  private static final String ERROR_CODE = "errorCode";
  private static final String TIMESTAMP = "timestamp";
  private static final int MAX_STACK_TRACE_LENGTH = 5000;
  private final Environment env;

  // ---- Service layer exceptions ----

  @ExceptionHandler(CustomerNotFoundException.class)
  public ResponseEntity<ProblemDetail> handleCustomerNotFound(
      RuntimeException ex, HttpServletRequest request) {
    return buildErrorResponse(HttpStatus.NOT_FOUND, "Customer Not Found", ex, request);
  }

  @ExceptionHandler(CustomerConflictException.class)
  public ResponseEntity<ProblemDetail> handleCustomerConflict(
      RuntimeException ex, HttpServletRequest request) {
    return buildErrorResponse(HttpStatus.CONFLICT, "Customer Conflict", ex, request);
  }

  /** Every broken rule is listed under {@code errors}, in check order. */
  @ExceptionHandler(CustomerValidationException.class)
  public ResponseEntity<ProblemDetail> handleCustomerValidation(
      CustomerValidationException ex, HttpServletRequest request) {
    ProblemDetail problemDetail =
        createBaseProblemDetail(HttpStatus.BAD_REQUEST, "Customer Validation Failed", ex, request);
    problemDetail.setProperty("errors", ex.getErrors());
    return ResponseEntity.badRequest().body(problemDetail);
  }

  /** Reports where the customer is and where it may go from there. */
  @ExceptionHandler(InvalidTransitionException.class)
  public ResponseEntity<ProblemDetail> handleInvalidTransition(
      InvalidTransitionException ex, HttpServletRequest request) {
    ProblemDetail problemDetail =
        createBaseProblemDetail(HttpStatus.CONFLICT, "Invalid Transition", ex, request);
    TransitionResult result = ex.getResult();
    problemDetail.setProperty("currentStatus", result.previousStatus());
    problemDetail.setProperty("attemptedStatus", result.attemptedStatus());
    problemDetail.setProperty("allowedTransitions", result.allowedTransitions());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problemDetail);
  }

  @ExceptionHandler(ServiceUnavailableException.class)
  public ResponseEntity<ProblemDetail> handleServiceUnavailable(
      RuntimeException ex, HttpServletRequest request) {
    return buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", ex, request);
  }

  @ExceptionHandler(CustomerServiceException.class)
  public ResponseEntity<ProblemDetail> handleServiceGeneric(
      RuntimeException ex, HttpServletRequest request) {
    return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Error", ex, request);
  }

  // ---- Request binding and validation ----

  /** Bean validation failures on a request body, one entry per rejected field. */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ProblemDetail> handleValidationException(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    ProblemDetail problemDetail =
        createBaseProblemDetail(HttpStatus.BAD_REQUEST, "Validation Error", ex, request);
    problemDetail.setProperty(
        "errors",
        ex.getBindingResult().getFieldErrors().stream()
            .map(
                error ->
                    Map.of(
                        "field", error.getField(),
                        "rejectedValue", String.valueOf(error.getRejectedValue()),
                        "message",
                            Optional.ofNullable(error.getDefaultMessage()).orElse("No message")))
            .toList());
    return ResponseEntity.badRequest().body(problemDetail);
  }

  /**
   * Malformed bodies, unknown status/category/severity values and fail-fast constructors that
   * reject their input all surface here.
   */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ProblemDetail> handleUnreadableBody(
      HttpMessageNotReadableException ex, HttpServletRequest request) {
    ProblemDetail problemDetail =
        createBaseProblemDetail(HttpStatus.BAD_REQUEST, "Malformed JSON", ex, request);
    String errorDetail =
        Optional.ofNullable(ex.getMostSpecificCause())
            .map(cause -> "JSON parsing error: " + cause.getMessage())
            .orElse("Malformed JSON input: " + ex.getMessage());
    problemDetail.setDetail(errorDetail);
    return ResponseEntity.badRequest().body(problemDetail);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ProblemDetail> handleConstraintViolation(
      ConstraintViolationException ex, HttpServletRequest request) {
    return buildErrorResponse(HttpStatus.BAD_REQUEST, "Constraint Violation", ex, request);
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ProblemDetail> handleMethodValidation(
      HandlerMethodValidationException ex, HttpServletRequest request) {
    ProblemDetail problemDetail =
        createBaseProblemDetail(HttpStatus.BAD_REQUEST, "Method Validation Error", ex, request);

    List<Map<String, Object>> errors =
        ex.getAllValidationResults().stream()
            .map(
                result -> {
                  Map<String, Object> errorDetails = new LinkedHashMap<>();
                  errorDetails.put(
                      "parameter",
                      Optional.ofNullable(result.getMethodParameter().getParameterName())
                          .orElse("unknown"));
                  errorDetails.put("rejectedValue", String.valueOf(result.getArgument()));
                  errorDetails.put(
                      "messages",
                      result.getResolvableErrors().stream()
                          .map(MessageSourceResolvable::getDefaultMessage)
                          .filter(Objects::nonNull)
                          .toList());
                  return errorDetails;
                })
            .toList();
    problemDetail.setProperty("validationErrors", errors);
    return ResponseEntity.badRequest().body(problemDetail);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ProblemDetail> handleMissingParams(
      MissingServletRequestParameterException ex, HttpServletRequest request) {
    ProblemDetail problemDetail =
        createBaseProblemDetail(HttpStatus.BAD_REQUEST, "Missing Parameter", ex, request);
    problemDetail.setProperty("parameter", ex.getParameterName());
    problemDetail.setProperty("parameterType", ex.getParameterType());
    return ResponseEntity.badRequest().body(problemDetail);
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ProblemDetail> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
    ProblemDetail problemDetail =
        createBaseProblemDetail(HttpStatus.BAD_REQUEST, "Invalid Parameter", ex, request);
    problemDetail.setProperty("parameter", ex.getName());
    problemDetail.setProperty(
        "expectedType",
        ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "Unknown");
    problemDetail.setProperty("invalidValue", String.valueOf(ex.getValue()));
    return ResponseEntity.badRequest().body(problemDetail);
  }

  /** Precondition failures, including an unknown status in the path. */
  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ProblemDetail> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {
    return buildErrorResponse(HttpStatus.BAD_REQUEST, "Invalid Argument", ex, request);
  }

  // ---- Protocol errors ----

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ProblemDetail> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
    return buildErrorResponse(HttpStatus.METHOD_NOT_ALLOWED, "Method Not Allowed", ex, request);
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<ProblemDetail> handleMediaTypeNotSupported(
      HttpMediaTypeNotSupportedException ex, HttpServletRequest request) {
    return buildErrorResponse(
        HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported Media Type", ex, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(
      Exception ex, HttpServletRequest request) {
    log.error("Unexpected error occurred", ex);
    return buildErrorResponse(
        HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", ex, request);
  }

  private ResponseEntity<ProblemDetail> buildErrorResponse(
      HttpStatus status, String title, Exception ex, HttpServletRequest request) {
    return ResponseEntity.status(status).body(createBaseProblemDetail(status, title, ex, request));
  }

  private ProblemDetail createBaseProblemDetail(
      HttpStatus status, String title, Exception ex, HttpServletRequest request) {
    if (status.is5xxServerError()) {
      log.error("{} {} -> {}: {}", request.getMethod(), request.getRequestURI(), status.value(),
          ex.getMessage());
    } else {
      log.debug("{} {} -> {}: {}", request.getMethod(), request.getRequestURI(), status.value(),
          ex.getMessage());
    }
    ProblemDetail problemDetail = ProblemDetail.forStatus(status);
    problemDetail.setTitle(title);
    problemDetail.setDetail(ex.getMessage());
    problemDetail.setType(URI.create(ERROR_BASE_URL + status.value()));
    problemDetail.setInstance(URI.create(request.getRequestURI()));
    problemDetail.setProperty(ERROR_CODE, errorCode(title));
    problemDetail.setProperty(TIMESTAMP, Instant.now());

    addDebugInfo(problemDetail, ex);
    addRequestMetadata(problemDetail, request);
    return problemDetail;
  }

  static String errorCode(String title) {
    return StringUtils.upperCase(title).replaceAll("[^A-Z0-9]+", "_");
  }

  private void addDebugInfo(ProblemDetail detail, Exception ex) {
    if (!env.acceptsProfiles(Profiles.of("dev"))) {
      return;
    }
    detail.setProperty("exception", ex.getClass().getName());
    detail.setProperty(
        "stackTrace",
        StringUtils.abbreviate(ExceptionUtils.getStackTrace(ex), MAX_STACK_TRACE_LENGTH));
  }

  private void addRequestMetadata(ProblemDetail detail, HttpServletRequest request) {
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("httpMethod", request.getMethod());
    metadata.put("requestPath", request.getRequestURI());
    metadata.put("clientIp", request.getRemoteAddr());
    metadata.put("requestId", Objects.toString(request.getHeader("X-Request-Id"), ""));
    metadata.put("userAgent", Objects.toString(request.getHeader("User-Agent"), ""));
    detail.setProperty("request", metadata);
  }
}
