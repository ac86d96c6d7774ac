package com.health.booking.dto;

public record QueueStatus(Long appointmentId, int position, long estimatedWaitMinutes) {
}
