package com.staybook.reservation.api.exception;

import com.staybook.common.dto.BaseResponse;
import com.staybook.reservation.exception.AmountMismatchException;
import com.staybook.reservation.exception.DatesUnavailableException;
import com.staybook.reservation.exception.ExpiredHoldException;
import com.staybook.reservation.exception.InvalidReservationStateException;
import com.staybook.reservation.exception.InvalidWebhookSignatureException;
import com.staybook.reservation.exception.LedgerHolderMismatchException;
import com.staybook.reservation.exception.MaxAttemptsExceededException;
import com.staybook.reservation.exception.ReconciliationConflictException;
import com.staybook.reservation.exception.ReservationAccessDeniedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP mapping of the reservation error taxonomy. Runs before the shared
 * GlobalExceptionHandler, which would otherwise answer 400 for every BusinessException.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ReservationExceptionHandler {

    @ExceptionHandler(DatesUnavailableException.class)
    public ResponseEntity<BaseResponse<Void>> handleDatesUnavailable(DatesUnavailableException ex) {
        log.warn("Dates unavailable for {}: {}", ex.getRequested(), ex.getConflictingDates());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("conflictingDates", ex.getConflictingDates());
        details.put("alternatives", ex.getAlternatives().stream()
                .map(range -> Map.of("checkIn", range.checkIn(), "checkOut", range.checkOut()))
                .toList());
        return error(HttpStatus.CONFLICT, ex.getMessage(), ex.getErrorCode(), details);
    }

    @ExceptionHandler(ExpiredHoldException.class)
    public ResponseEntity<BaseResponse<Void>> handleExpiredHold(ExpiredHoldException ex) {
        log.warn("Expired hold: {}", ex.getReservationId());
        return error(HttpStatus.GONE, ex.getMessage(), ex.getErrorCode(), null);
    }

    @ExceptionHandler(MaxAttemptsExceededException.class)
    public ResponseEntity<BaseResponse<Void>> handleMaxAttempts(MaxAttemptsExceededException ex) {
        log.warn("Max payment attempts reached for {}", ex.getReservationId());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), ex.getErrorCode(),
                Map.of("maxAttempts", ex.getMaxAttempts(), "action", "CONTACT_SUPPORT"));
    }

    @ExceptionHandler(AmountMismatchException.class)
    public ResponseEntity<BaseResponse<Void>> handleAmountMismatch(AmountMismatchException ex) {
        log.warn("Amount mismatch: {}", ex.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("expectedAmountCents", ex.getExpectedAmountCents());
        details.put("actualAmountCents", ex.getActualAmountCents());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), ex.getErrorCode(), details);
    }

    @ExceptionHandler(ReservationAccessDeniedException.class)
    public ResponseEntity<BaseResponse<Void>> handleAccessDenied(ReservationAccessDeniedException ex) {
        return error(HttpStatus.FORBIDDEN, ex.getMessage(), ex.getErrorCode(), null);
    }

    @ExceptionHandler(ReconciliationConflictException.class)
    public ResponseEntity<BaseResponse<Void>> handleReconciliationConflict(ReconciliationConflictException ex) {
        log.warn("Reconciliation conflict {}: {}", ex.getConflictId(), ex.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reservationId", ex.getReservationId());
        details.put("paymentAttemptId", ex.getPaymentAttemptId());
        details.put("reason", ex.getReason());
        details.put("conflictId", ex.getConflictId());
        return error(HttpStatus.CONFLICT, ex.getMessage(), ex.getErrorCode(), details);
    }

    @ExceptionHandler(InvalidWebhookSignatureException.class)
    public ResponseEntity<BaseResponse<Void>> handleInvalidWebhookSignature(InvalidWebhookSignatureException ex) {
        log.warn("Payment webhook rejected: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getErrorCode(), null);
    }

    @ExceptionHandler(InvalidReservationStateException.class)
    public ResponseEntity<BaseResponse<Void>> handleInvalidState(InvalidReservationStateException ex) {
        log.warn("Invalid reservation state: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getMessage(), ex.getErrorCode(),
                Map.of("currentStatus", ex.getCurrentStatus()));
    }

    @ExceptionHandler(LedgerHolderMismatchException.class)
    public ResponseEntity<BaseResponse<Void>> handleLedgerHolderMismatch(LedgerHolderMismatchException ex) {
        log.error("Ledger out of step with reservation: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getMessage(), ex.getErrorCode(), null);
    }

    private ResponseEntity<BaseResponse<Void>> error(HttpStatus status, String message, String code, Object details) {
        return ResponseEntity.status(status).body(BaseResponse.error(message, code, details));
    }
}
