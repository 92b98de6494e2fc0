package com.flagship.altyn_ledger.api.exception;

import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.flagship.altyn_ledger.error.ErrorCode;
import com.flagship.altyn_ledger.error.LedgerException;
import com.flagship.altyn_ledger.settlement.SettlementException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger errors and request problems to one JSON error shape.
 *
 * Business rejections are logged at WARN; anything unexpected at ERROR.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(SettlementException.class)
    public ResponseEntity<ErrorResponse> handleSettlement(SettlementException e) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("listing_id", e.getListingId());
        details.put("payment_type", e.getPaymentType().name());
        return ledgerError(e, details);
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedger(LedgerException e) {
        return ledgerError(e, null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header", null,
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Parameter", null,
                "Required parameter '" + e.getParameterName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> errors = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        error -> error.getField(),
                        error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                        (existing, replacement) -> existing,
                        LinkedHashMap::new));
        log.warn("Validation failed: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", null, "Request validation failed", errors);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid value for parameter {}: {}", e.getName(), e.getValue());
        ErrorCode code = BigDecimal.class.equals(e.getRequiredType()) ? ErrorCode.INVALID_AMOUNT : null;
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", code,
                "Invalid value for '" + e.getName() + "'", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        if (e.getCause() instanceof InvalidFormatException
                && BigDecimal.class.equals(((InvalidFormatException) e.getCause()).getTargetType())) {
            InvalidFormatException format = (InvalidFormatException) e.getCause();
            log.warn("Non-numeric amount in request body: {}", format.getValue());
            return respond(HttpStatus.BAD_REQUEST, "Invalid Amount", ErrorCode.INVALID_AMOUNT,
                    "Amount must be numeric: " + format.getValue(), null);
        }
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed Request", null, "Request body could not be parsed", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", null, e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", null, e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", null,
                "An unexpected error occurred", null);
    }

    private ResponseEntity<ErrorResponse> ledgerError(LedgerException e, Map<String, String> details) {
        HttpStatus status = statusFor(e.getErrorCode());
        log.warn("Ledger operation rejected: code={}, message={}", e.getErrorCode(), e.getMessage());
        return respond(status, status.getReasonPhrase(), e.getErrorCode(), e.getMessage(), details);
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case INVALID_AMOUNT, SELF_TRANSFER_NOT_ALLOWED -> HttpStatus.BAD_REQUEST;
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INSUFFICIENT_FUNDS, NOTHING_TO_DISTRIBUTE -> HttpStatus.CONFLICT;
        };
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, ErrorCode code,
                                                         String message, Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
                .error(error)
                .code(code != null ? code.name() : null)
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(body);
    }

    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String code;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
