package com.health.booking.dto;

import java.time.Instant;

/**
 * {@code prescriptionId} is optional and is linked to the parent appointment when present.
 */
public record FollowUpRequest(Instant preferredStartTime, String notes, String prescriptionId) {
}
