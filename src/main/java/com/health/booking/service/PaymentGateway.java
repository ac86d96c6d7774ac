package com.health.booking.service;

import com.health.booking.dto.PaymentOrder;
import com.health.booking.dto.RefundReceipt;
import com.health.booking.exception.PaymentGatewayException;

import java.math.BigDecimal;

/**
 * Payment provider used by the booking engine. Calls are not retried here; a failed call
 * surfaces as {@link PaymentGatewayException}.
 */
public interface PaymentGateway {

    PaymentOrder createOrder(BigDecimal amount, String currency, Long appointmentId);

    RefundReceipt refund(String paymentId, BigDecimal amount, String reason);

    /**
     * Checks the checkout callback signature over {@code orderId|paymentId}.
     */
    boolean verifySignature(String orderId, String paymentId, String signature);
}
