package com.mk.fx.qa.lode.api.resource;

import com.mk.fx.qa.lode.api.cfg.ErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

@Component
public class ApiResponseFactory {

  public ResponseEntity<ErrorResponse> error(HttpStatus status, String title, String details) {
    return ResponseEntity.status(status).body(new ErrorResponse(title, details));
  }

  public ResponseEntity<ErrorResponse> badRequest(String title, String details) {
    return error(HttpStatus.BAD_REQUEST, title, details);
  }

  public <T> ResponseEntity<T> ok(T body) {
    return ResponseEntity.ok(body);
  }

  public <T> ResponseEntity<T> unavailable(T body) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
  }
}
