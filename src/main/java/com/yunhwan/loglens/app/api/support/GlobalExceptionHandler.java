package com.yunhwan.loglens.app.api.support;

import com.yunhwan.loglens.common.exception.ErrorKind;
import com.yunhwan.loglens.common.exception.TriageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 모든 실패를 {success:false, kind, error, suggestion} 으로 통일한다.
 * 응답에는 safeMessage 만, 상세 원인은 로그에만.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(TriageException.class)
    public ResponseEntity<ErrorResponse> handleTriage(TriageException e) {
        ErrorKind kind = e.kind();
        if (kind.getStatus().is5xxServerError()) {
            log.error("[API] request failed kind={}, err={}", kind.code(), e.getMessage());
        } else {
            log.warn("[API] request rejected kind={}, err={}", kind.code(), e.getMessage());
        }
        return ResponseEntity.status(kind.getStatus())
                .body(ErrorResponse.of(kind.code(), e.safeMessage(), e.suggestion()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String message = fieldError == null
                ? ErrorKind.INVALID_INPUT.getMessage()
                : "Invalid " + jsonFieldName(fieldError.getField()) + ": " + fieldError.getDefaultMessage();
        log.warn("[API] validation failed: {}", message);
        return invalidInput(message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("[API] unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return invalidInput("Invalid request body");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("[API] unexpected error", e);
        ErrorKind kind = ErrorKind.INTERNAL;
        return ResponseEntity.status(kind.getStatus())
                .body(ErrorResponse.of(kind.code(), kind.getMessage(), kind.getSuggestion()));
    }

    private ResponseEntity<ErrorResponse> invalidInput(String message) {
        ErrorKind kind = ErrorKind.INVALID_INPUT;
        return ResponseEntity.status(kind.getStatus())
                .body(ErrorResponse.of(kind.code(), message, kind.getSuggestion()));
    }

    private static String jsonFieldName(String field) {
        return "customerId".equals(field) ? "customer_id" : field;
    }
}
