package com.mk.fx.qa.lode.api.resource;

import com.mk.fx.qa.lode.api.cfg.ErrorResponse;
import com.mk.fx.qa.lode.api.service.InvalidRequestException;
import com.mk.fx.qa.lode.core.config.InvalidConfigException;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

  private final ApiResponseFactory responseFactory;

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException ex) {
    log.warn("{}: {}", ex.getTitle(), ex.getMessage());
    return responseFactory.badRequest(ex.getTitle(), ex.getMessage());
  }

  @ExceptionHandler(InvalidConfigException.class)
  public ResponseEntity<ErrorResponse> handleInvalidConfig(InvalidConfigException ex) {
    log.warn("Invalid load test configuration: {}", ex.getMessage());
    return responseFactory.badRequest("Invalid configuration", ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    String details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining("; "));
    log.warn("Request validation failed: {}", details);
    return responseFactory.badRequest("Validation failed", details);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    log.warn("Unreadable request body: {}", ex.getMessage());
    return responseFactory.badRequest(
        "Malformed request", "Request body is missing or is not valid JSON");
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleMediaType(HttpMediaTypeNotSupportedException ex) {
    return responseFactory.error(
        HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported media type", ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Invalid argument: {}", ex.getMessage());
    return responseFactory.badRequest("Invalid argument", ex.getMessage());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
    log.error("Unhandled exception", ex);
    return responseFactory.error(
        HttpStatus.INTERNAL_SERVER_ERROR, "Server error", ex.getMessage());
  }
}
