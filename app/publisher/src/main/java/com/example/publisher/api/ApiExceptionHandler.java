/*
 * どこで: Publisher API
 * 何を: ドメイン例外を HTTP レスポンスへ変換する
 * なぜ: 再試行できる失敗とユーザー操作が必要な失敗をアダプタが区別できるようにするため
 */
package com.example.publisher.api;

import com.example.publisher.service.AccountNotFoundException;
import com.example.publisher.service.AccountOwnershipException;
import com.example.publisher.service.CredentialException;
import com.example.publisher.service.GrantJobNotFoundException;
import com.example.publisher.service.InsufficientCreditsException;
import com.example.publisher.service.MediaException;
import com.example.publisher.service.WebhookPayloadException;
import com.example.publisher.service.WebhookSignatureException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(CredentialException.class)
  public ResponseEntity<ApiErrorResponse> handleCredential(CredentialException ex) {
    return switch (ex.reason()) {
      case NOT_CONNECTED -> error(HttpStatus.NOT_FOUND, ApiErrorCode.NOT_CONNECTED, ex);
      case AUTH_EXPIRED -> error(HttpStatus.UNAUTHORIZED, ApiErrorCode.AUTH_EXPIRED, ex);
      case UPSTREAM_UNAVAILABLE ->
          error(HttpStatus.SERVICE_UNAVAILABLE, ApiErrorCode.UPSTREAM_UNAVAILABLE, ex);
    };
  }

  @ExceptionHandler(InsufficientCreditsException.class)
  public ResponseEntity<ApiErrorResponse> handleInsufficientCredits(
      InsufficientCreditsException ex) {
    return error(HttpStatus.PAYMENT_REQUIRED, ApiErrorCode.INSUFFICIENT_CREDITS, ex);
  }

  @ExceptionHandler(AccountOwnershipException.class)
  public ResponseEntity<ApiErrorResponse> handleAccountOwnership(AccountOwnershipException ex) {
    return error(HttpStatus.FORBIDDEN, ApiErrorCode.ACCOUNT_FORBIDDEN, ex);
  }

  @ExceptionHandler(AccountNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleAccountNotFound(AccountNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.ACCOUNT_NOT_FOUND, ex);
  }

  @ExceptionHandler(GrantJobNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleGrantJobNotFound(GrantJobNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.GRANT_JOB_NOT_FOUND, ex);
  }

  @ExceptionHandler(WebhookSignatureException.class)
  public ResponseEntity<ApiErrorResponse> handleWebhookSignature(WebhookSignatureException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.INVALID_SIGNATURE, ex);
  }

  @ExceptionHandler(WebhookPayloadException.class)
  public ResponseEntity<ApiErrorResponse> handleWebhookPayload(WebhookPayloadException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.INVALID_PAYLOAD, ex);
  }

  @ExceptionHandler(MediaException.class)
  public ResponseEntity<ApiErrorResponse> handleMedia(MediaException ex) {
    final ApiErrorCode code =
        ex.reason() == MediaException.Reason.DOWNLOAD_FAILED
            ? ApiErrorCode.DOWNLOAD_FAILED
            : ApiErrorCode.REHOST_FAILED;
    return error(HttpStatus.BAD_GATEWAY, code, ex);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return badRequest(ex.getHeaderName() + " is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSON パーサの内部文言は露出しない
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, RuntimeException ex) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, ex.getMessage()));
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
