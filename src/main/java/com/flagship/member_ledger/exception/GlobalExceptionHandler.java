package com.flagship.member_ledger.exception;

import com.flagship.member_ledger.fee.condition.FeeConditionException;
import com.flagship.member_ledger.ledger.LedgerConsistencyException;
import com.flagship.member_ledger.membership.MoneyTransferBatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions to error responses.
 *
 * Validation problems are 400, state conflicts 409, broken ledger invariants 500.
 * Batch endpoints report per-item problems in their response body and only end up
 * here when the whole batch is rejected.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header",
            "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> fields = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                FieldError::getField,
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (first, second) -> first
            ));
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", fields);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception e) {
        log.warn("Unreadable request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "Request could not be read", null);
    }

    @ExceptionHandler(FeeConditionException.class)
    public ResponseEntity<ErrorResponse> handleFeeCondition(FeeConditionException e) {
        log.warn("Invalid fee condition: {}", e.getMessage());
        Map<String, String> details = e.getPosition() >= 0
            ? Map.of("position", Integer.toString(e.getPosition()))
            : null;
        return respond(HttpStatus.BAD_REQUEST, "Invalid Fee Condition", e.getMessage(), details);
    }

    @ExceptionHandler(MoneyTransferBatchException.class)
    public ResponseEntity<ErrorResponse> handleMoneyTransferBatch(MoneyTransferBatchException e) {
        log.warn("Money transfer batch rejected at line {}: {}", e.getLineIndex() + 1, e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Batch Rejected", e.getMessage(),
            Map.of("line", Integer.toString(e.getLineIndex() + 1)));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), null);
    }

    // two admins finalizing or editing the same mandate/transaction at once
    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentModification(ObjectOptimisticLockingFailureException e) {
        log.warn("Concurrent modification of {}: {}", e.getPersistentClassName(), e.getMessage());
        return respond(HttpStatus.CONFLICT, "Concurrent Modification",
            "The resource was changed by another request, please retry", null);
    }

    @ExceptionHandler(LedgerConsistencyException.class)
    public ResponseEntity<ErrorResponse> handleLedgerConsistency(LedgerConsistencyException e) {
        log.error("Ledger consistency violated: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Ledger Inconsistency", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         Map<String, String> details) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build());
    }

    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
