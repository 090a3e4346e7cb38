package com.staybook.reservation.client;

import com.staybook.reservation.client.dto.CheckoutSessionResponse;
import com.staybook.reservation.client.dto.CreateCheckoutSessionRequest;
import com.staybook.reservation.client.dto.CreateRefundRequest;
import com.staybook.reservation.client.dto.RefundResponse;
import com.staybook.reservation.client.dto.SessionStatusResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Feign client for the hosted payment gateway. Do not call directly; go through
 * {@link PaymentGatewayAdapter}, which adds retry and circuit breaking.
 */
@FeignClient(name = "payment-gateway", url = "${stay.payment.gateway-url}", path = "/v1")
public interface PaymentGatewayClient {

    @PostMapping("/checkout/sessions")
    CheckoutSessionResponse createCheckoutSession(@RequestBody CreateCheckoutSessionRequest request);

    @GetMapping("/checkout/sessions/{sessionId}")
    SessionStatusResponse getSessionStatus(@PathVariable("sessionId") String sessionId);

    @PostMapping("/refunds")
    RefundResponse createRefund(@RequestBody CreateRefundRequest request);
}
