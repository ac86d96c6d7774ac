package com.health.booking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Embeddable
@Getter
@Setter(AccessLevel.PACKAGE)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaymentInfo {

    public enum Status { PENDING, PAID, FAILED, REFUNDED, PARTIALLY_REFUNDED }

    @Column(name = "payment_id", length = 64)
    private String paymentId;

    @Column(name = "payment_order_id", length = 64)
    private String orderId;

    @Column(name = "payment_amount", precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "payment_currency", length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", length = 20)
    private Status status;

    /** RAZORPAY, CARD, UPI ... as reported by the gateway */
    @Column(name = "payment_method", length = 30)
    private String method;

    @Column(name = "paid_at")
    private Instant paidAt;

    public static PaymentInfo pending(BigDecimal amount, String currency) {
        return PaymentInfo.builder()
                .amount(amount)
                .currency(currency)
                .status(Status.PENDING)
                .build();
    }

    public boolean isPaid() {
        return status == Status.PAID;
    }
}
