package com.staybook.reservation.api.controller;

import com.staybook.common.dto.BaseResponse;
import com.staybook.common.util.Constants;
import com.staybook.reservation.api.dto.CancelReservationRequest;
import com.staybook.reservation.api.dto.CancellationResponse;
import com.staybook.reservation.api.dto.CreateReservationRequest;
import com.staybook.reservation.api.dto.ModifyReservationRequest;
import com.staybook.reservation.api.dto.PaymentAttemptResponse;
import com.staybook.reservation.api.dto.PaymentHistoryResponse;
import com.staybook.reservation.api.dto.ReservationResponse;
import com.staybook.reservation.api.dto.ReservationStatusResponse;
import com.staybook.reservation.domain.service.ReservationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Guest commands. The caller's identity arrives verified in {@code X-Guest-Id}; mutating
 * commands accept an optional {@code Idempotency-Key}.
 */
@RestController
@RequestMapping("/api/v1/reservations")
@RequiredArgsConstructor
public class ReservationController {

    private final ReservationService reservationService;

    @PostMapping
    public ResponseEntity<BaseResponse<ReservationResponse>> createReservation(
            @RequestHeader(Constants.HEADER_GUEST_ID) String guestId,
            @RequestHeader(value = Constants.HEADER_IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody CreateReservationRequest request) {
        ReservationResponse response = reservationService.createReservation(guestId, request, idempotencyKey);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Dates held, complete payment before the hold expires", response));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<List<ReservationResponse>>> getMyReservations(
            @RequestHeader(Constants.HEADER_GUEST_ID) String guestId) {
        return ResponseEntity.ok(BaseResponse.success(reservationService.getReservationsForGuest(guestId)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<ReservationResponse>> getReservation(
            @RequestHeader(Constants.HEADER_GUEST_ID) String guestId,
            @PathVariable String id) {
        return ResponseEntity.ok(BaseResponse.success(reservationService.getReservation(id, guestId)));
    }

    @PutMapping("/{id}/dates")
    public ResponseEntity<BaseResponse<ReservationResponse>> modifyReservation(
            @RequestHeader(Constants.HEADER_GUEST_ID) String guestId,
            @RequestHeader(value = Constants.HEADER_IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @PathVariable String id,
            @Valid @RequestBody ModifyReservationRequest request) {
        ReservationResponse response = reservationService.modifyReservation(id, guestId, request, idempotencyKey);
        return ResponseEntity.ok(BaseResponse.success("Reservation dates updated", response));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BaseResponse<CancellationResponse>> cancelReservation(
            @RequestHeader(Constants.HEADER_GUEST_ID) String guestId,
            @RequestHeader(value = Constants.HEADER_IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @PathVariable String id,
            @Valid @RequestBody(required = false) CancelReservationRequest request) {
        String reason = request == null ? null : request.reason();
        CancellationResponse response = reservationService.cancelReservation(id, guestId, reason, idempotencyKey);
        return ResponseEntity.ok(BaseResponse.success("Reservation cancelled", response));
    }

    @GetMapping("/{id}/status")
    public ResponseEntity<BaseResponse<ReservationStatusResponse>> getReservationStatus(
            @RequestHeader(Constants.HEADER_GUEST_ID) String guestId,
            @PathVariable String id) {
        return ResponseEntity.ok(BaseResponse.success(reservationService.getReservationStatus(id, guestId)));
    }

    @PostMapping("/{id}/payment-attempts")
    public ResponseEntity<BaseResponse<PaymentAttemptResponse>> createPaymentAttempt(
            @RequestHeader(Constants.HEADER_GUEST_ID) String guestId,
            @RequestHeader(value = Constants.HEADER_IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @PathVariable String id) {
        PaymentAttemptResponse response = reservationService.createPaymentAttempt(id, guestId, idempotencyKey);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Checkout session created", response));
    }

    @GetMapping("/{id}/payments")
    public ResponseEntity<BaseResponse<PaymentHistoryResponse>> getPaymentHistory(
            @RequestHeader(Constants.HEADER_GUEST_ID) String guestId,
            @PathVariable String id) {
        return ResponseEntity.ok(BaseResponse.success(reservationService.getPaymentHistory(id, guestId)));
    }
}
