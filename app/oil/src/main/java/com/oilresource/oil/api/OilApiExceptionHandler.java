/*
 * どこで: Oil API
 * 何を: 認証/認可・業務・ストレージの例外を {code, message} 形式へ変換する
 * なぜ: フィルタで止めたリクエストもハンドラ内の失敗も同じ契約で返すため
 */
package com.oilresource.oil.api;

import com.oilresource.oil.auth.AuthException;
import com.oilresource.oil.auth.KeySetUnavailableException;
import com.oilresource.oil.service.InvalidOilRequestException;
import com.oilresource.oil.service.OilApiMetrics;
import com.oilresource.oil.service.ResourceNotFoundException;
import com.oilresource.oil.storage.StorageOperationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
@RequiredArgsConstructor
public class OilApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(OilApiExceptionHandler.class);
  static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

  private final OilApiMetrics metrics;

  @ExceptionHandler(AuthException.class)
  public ResponseEntity<ApiErrorResponse> handleAuth(AuthException ex) {
    metrics.recordAuthFailure(ex.reason().name());
    if (ex.isForbidden()) {
      return ResponseEntity.status(HttpStatus.FORBIDDEN)
          .body(new ApiErrorResponse("AUTH_FORBIDDEN", ex.reason().message()));
    }
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
        .body(new ApiErrorResponse("AUTH_UNAUTHORIZED", ex.reason().message()));
  }

  @ExceptionHandler(KeySetUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleKeySetUnavailable(KeySetUnavailableException ex) {
    metrics.recordAuthFailure("KEY_SET_UNAVAILABLE");
    logger.warn("authentication unavailable: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            new ApiErrorResponse("AUTH_SERVICE_UNAVAILABLE", KeySetUnavailableException.MESSAGE));
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(ResourceNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("OIL_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(InvalidOilRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(InvalidOilRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("OIL_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler({
    MethodArgumentNotValidException.class,
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
    logger.info("request rejected: {}", ex.getClass().getSimpleName());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("OIL_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(StorageOperationException.class)
  public ResponseEntity<ApiErrorResponse> handleStorage(StorageOperationException ex) {
    metrics.recordStorageError("STORAGE_ERROR");
    logger.error("storage operation failed: {}", ex.getMessage(), ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("STORAGE_ERROR", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled exception", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("INTERNAL_ERROR", INTERNAL_ERROR_MESSAGE));
  }
}
