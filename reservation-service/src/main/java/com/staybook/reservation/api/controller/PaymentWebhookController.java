package com.staybook.reservation.api.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.staybook.common.dto.BaseResponse;
import com.staybook.common.exception.BusinessException;
import com.staybook.common.util.Constants;
import com.staybook.reservation.api.dto.PaymentWebhookRequest;
import com.staybook.reservation.api.dto.WebhookAckResponse;
import com.staybook.reservation.api.security.WebhookSignatureVerifier;
import com.staybook.reservation.domain.service.ReconciliationResult;
import com.staybook.reservation.domain.service.StatusReconciler;
import com.staybook.reservation.exception.AmountMismatchException;
import com.staybook.reservation.exception.ReconciliationConflictException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Push channel for gateway outcomes. The signature is checked over the raw body before
 * anything is parsed. Processing is synchronous: a 2xx means the event is durably recorded.
 * A conflict is acknowledged with 200 because it is already stored and redelivery would
 * change nothing.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/webhooks/payments")
@RequiredArgsConstructor
public class PaymentWebhookController {

    private static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    private final StatusReconciler statusReconciler;
    private final WebhookSignatureVerifier signatureVerifier;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    @PostMapping
    public ResponseEntity<BaseResponse<WebhookAckResponse>> receive(
            @RequestHeader(value = Constants.HEADER_PAYMENT_SIGNATURE, required = false) String signature,
            @RequestBody String payload) {
        signatureVerifier.verify(payload, signature);
        PaymentWebhookRequest request = parse(payload);
        try {
            ReconciliationResult result = statusReconciler.ingest(request.toEvent(), StatusReconciler.Channel.WEBHOOK);
            return ResponseEntity.ok(BaseResponse.success(WebhookAckResponse.from(result)));
        } catch (ReconciliationConflictException e) {
            log.warn("Webhook {} recorded as conflict {}: {}", request.eventId(), e.getConflictId(), e.getMessage());
            return ResponseEntity.ok(BaseResponse.success("Payment recorded as reconciliation conflict",
                    WebhookAckResponse.conflict(request.eventId(), e.getReservationId(), e.getConflictId())));
        } catch (AmountMismatchException e) {
            log.warn("Webhook {} recorded as amount mismatch: {}", request.eventId(), e.getMessage());
            return ResponseEntity.ok(BaseResponse.success("Payment recorded as reconciliation conflict",
                    WebhookAckResponse.conflict(request.eventId(), null, null)));
        }
    }

    private PaymentWebhookRequest parse(String payload) {
        PaymentWebhookRequest request;
        try {
            request = objectMapper.readValue(payload, PaymentWebhookRequest.class);
        } catch (JsonProcessingException e) {
            throw new BusinessException("Malformed webhook payload", e, VALIDATION_ERROR);
        }
        if (request == null) {
            throw new BusinessException("Empty webhook payload", VALIDATION_ERROR);
        }
        Set<ConstraintViolation<PaymentWebhookRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String reasons = violations.stream()
                    .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new BusinessException("Invalid webhook payload: " + reasons, VALIDATION_ERROR);
        }
        return request;
    }
}
