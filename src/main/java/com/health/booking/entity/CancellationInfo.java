package com.health.booking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Populated only once the appointment is cancelled.
 */
@Embeddable
@Getter
@Setter(AccessLevel.PACKAGE)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CancellationInfo {

    public enum Reason { PATIENT_REQUEST, DOCTOR_UNAVAILABLE, EMERGENCY, TECHNICAL_ISSUE, WEATHER, OTHER }

    @Enumerated(EnumType.STRING)
    @Column(name = "cancellation_reason", length = 30)
    private Reason reason;

    @Column(name = "cancellation_description", length = 500)
    private String description;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "cancelled_by", length = 64)
    private String cancelledBy;

    @Column(name = "refund_amount", precision = 12, scale = 2)
    private BigDecimal refundAmount;

    @Column(name = "refund_id", length = 64)
    private String refundId;

    @Column(name = "refund_processed")
    private boolean refundProcessed;
}
