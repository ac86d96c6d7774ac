package com.health.booking.dto;

import java.time.Instant;

public record RescheduleRequest(Long appointmentId, Instant newStartTime, String reason) {
}
