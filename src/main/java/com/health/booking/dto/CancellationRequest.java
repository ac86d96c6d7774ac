package com.health.booking.dto;

import com.health.booking.entity.CancellationInfo;

public record CancellationRequest(Long appointmentId,
                                  CancellationInfo.Reason reason,
                                  String description,
                                  String cancelledBy) {
}
