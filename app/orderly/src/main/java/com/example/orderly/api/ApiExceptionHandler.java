/*
 * どこで: Orderly API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: 失敗の種類ごとにステータスとエラーコードを統一するため
 */
package com.example.orderly.api;

import com.example.orderly.repository.StorageUnavailableException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);
  static final String RETRY_AFTER_SECONDS = "1";

  @ExceptionHandler(LocationNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleLocationNotFound(LocationNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.LOCATION_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(TicketNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleTicketNotFound(TicketNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.TICKET_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(ContentionException.class)
  public ResponseEntity<ApiErrorResponse> handleContention(ContentionException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
        .body(new ApiErrorResponse(ApiErrorCode.CONTENTION_RETRYABLE, ex.getMessage()));
  }

  @ExceptionHandler(InvalidTicketTransitionException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidTransition(
      InvalidTicketTransitionException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.INVALID_TRANSITION, ex.getMessage());
  }

  @ExceptionHandler(LocationInUseException.class)
  public ResponseEntity<ApiErrorResponse> handleLocationInUse(LocationInUseException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.LOCATION_IN_USE, ex.getMessage());
  }

  @ExceptionHandler(TicketNumberExhaustedException.class)
  public ResponseEntity<ApiErrorResponse> handleTicketNumberExhausted(
      TicketNumberExhaustedException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.TICKET_NUMBERS_EXHAUSTED, ex.getMessage());
  }

  @ExceptionHandler(StorageUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleStorageUnavailable(
      StorageUnavailableException ex) {
    logger.warn("storage unavailable", ex);
    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        ApiErrorCode.STORAGE_UNAVAILABLE,
        "storage is temporarily unavailable");
  }

  @ExceptionHandler({InvalidQueueRequestException.class, IllegalArgumentException.class})
  public ResponseEntity<ApiErrorResponse> handleBadRequest(RuntimeException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, ex.getName() + " is invalid");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先し、クライアントに最短で伝える。
    final String message =
        Optional.ofNullable(ex)
            .flatMap(
                error ->
                    error.getBindingResult().getFieldErrors().stream()
                        .map(DefaultMessageSourceResolvable::getDefaultMessage)
                        .filter(value -> value != null && !value.isBlank())
                        .findFirst())
            .orElse("request validation failed");
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.VALIDATION_ERROR, message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSONパーサの内部文言は露出しない。
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, "request body is invalid");
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled api error", ex);
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR, ApiErrorCode.INTERNAL_ERROR, "internal error");
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }
}
