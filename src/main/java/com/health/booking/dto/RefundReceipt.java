package com.health.booking.dto;

public record RefundReceipt(String refundId, String status) {
}
