package com.health.booking.dto;

/**
 * Checkout callback payload: the gateway's payment id, the order it belongs to and the
 * signature over both.
 */
public record PaymentConfirmationRequest(String paymentId, String orderId, String signature, String method) {
}
