package com.health.booking.dto;

public record PaymentOrder(String orderId, String paymentUrl) {
}
