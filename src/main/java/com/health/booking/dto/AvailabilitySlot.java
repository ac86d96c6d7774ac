package com.health.booking.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record AvailabilitySlot(Instant start, Instant end, BigDecimal fee, Long doctorId, Long clinicId) {
}
