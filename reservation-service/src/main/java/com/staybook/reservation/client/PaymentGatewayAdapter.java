package com.staybook.reservation.client;

import com.staybook.common.exception.BusinessException;
import com.staybook.reservation.client.dto.CheckoutSessionResponse;
import com.staybook.reservation.client.dto.CreateCheckoutSessionRequest;
import com.staybook.reservation.client.dto.CreateRefundRequest;
import com.staybook.reservation.client.dto.RefundResponse;
import com.staybook.reservation.client.dto.SessionStatusResponse;
import com.staybook.reservation.exception.GatewayUnavailableException;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Resilient front of {@link PaymentGatewayClient}.
 *
 * Retry wraps the circuit breaker (Resilience4j default aspect order), both named
 * {@code payment-gateway} in application.yml. Once retries are exhausted, or the circuit
 * is open, the fallback turns the failure into {@link GatewayUnavailableException}.
 * A 4xx answer means the gateway rejected the request itself; it is not retried and
 * surfaces as a {@link BusinessException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentGatewayAdapter {

    static final String GATEWAY_NAME = "payment-gateway";
    public static final String GATEWAY_REJECTED = "GATEWAY_REJECTED";

    private final PaymentGatewayClient client;

    @Retry(name = GATEWAY_NAME, fallbackMethod = "createCheckoutSessionFallback")
    @CircuitBreaker(name = GATEWAY_NAME)
    public CheckoutSessionResponse createCheckoutSession(CreateCheckoutSessionRequest request) {
        log.debug("Requesting checkout session for attempt {} ({} {})",
                request.paymentAttemptId(), request.amountCents(), request.currency());
        return client.createCheckoutSession(request);
    }

    @Retry(name = GATEWAY_NAME, fallbackMethod = "getSessionStatusFallback")
    @CircuitBreaker(name = GATEWAY_NAME)
    public SessionStatusResponse getSessionStatus(String sessionId) {
        return client.getSessionStatus(sessionId);
    }

    @Retry(name = GATEWAY_NAME, fallbackMethod = "createRefundFallback")
    @CircuitBreaker(name = GATEWAY_NAME)
    public RefundResponse createRefund(CreateRefundRequest request) {
        log.info("Requesting refund of {} cents for reservation {}", request.amountCents(), request.reservationId());
        return client.createRefund(request);
    }

    CheckoutSessionResponse createCheckoutSessionFallback(CreateCheckoutSessionRequest request, Throwable t) {
        throw translate("create checkout session for attempt " + request.paymentAttemptId(), t);
    }

    SessionStatusResponse getSessionStatusFallback(String sessionId, Throwable t) {
        throw translate("read status of session " + sessionId, t);
    }

    RefundResponse createRefundFallback(CreateRefundRequest request, Throwable t) {
        throw translate("refund reservation " + request.reservationId(), t);
    }

    private RuntimeException translate(String operation, Throwable t) {
        if (t instanceof BusinessException businessException) {
            return businessException;
        }
        if (isClientError(t)) {
            log.warn("Payment gateway rejected request to {}: {}", operation, t.getMessage());
            return new BusinessException("Payment gateway rejected request to " + operation, t, GATEWAY_REJECTED);
        }
        log.error("Payment gateway unavailable, could not {}", operation, t);
        return new GatewayUnavailableException("Payment gateway unavailable, could not " + operation, t);
    }

    /** 4xx other than 408/429 is the gateway telling us the request itself is wrong. */
    private boolean isClientError(Throwable t) {
        if (t instanceof FeignException fe) {
            int status = fe.status();
            return status >= 400 && status < 500 && status != 408 && status != 429;
        }
        return false;
    }
}
