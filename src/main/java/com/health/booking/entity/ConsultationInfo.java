package com.health.booking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Embeddable
@Getter
@Setter(AccessLevel.PACKAGE)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConsultationInfo {

    @Column(name = "meeting_id", length = 32)
    private String meetingId;

    @Column(name = "video_call_link", length = 255)
    private String link;

    @Column(name = "call_started_at")
    private Instant callStartedAt;

    @Column(name = "call_ended_at")
    private Instant callEndedAt;

    @Column(name = "call_duration_minutes")
    private Integer durationMinutes;

    public boolean isCallActive() {
        return callStartedAt != null && callEndedAt == null;
    }
}
