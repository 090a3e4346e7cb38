package com.staybook.reservation.config;

import com.staybook.reservation.client.PaymentGatewayClient;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

/**
 * Kept off the application class so that slice tests do not try to build Feign clients.
 */
@Configuration
@EnableFeignClients(basePackageClasses = PaymentGatewayClient.class)
public class FeignConfig {
}
