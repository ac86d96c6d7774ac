package com.health.booking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalTime;

/**
 * Opening hours of a clinic for one day of the week, with an optional lunch break.
 */
@Entity
@Table(name = "clinic_working_hours")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClinicWorkingHours {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "clinic_id", nullable = false)
    private Long clinicId;

    /** 1 = Monday, 7 = Sunday */
    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;

    @Column(name = "open_time")
    private LocalTime openTime;

    @Column(name = "close_time")
    private LocalTime closeTime;

    @Column(nullable = false)
    private boolean closed;

    @Column(name = "break_start")
    private LocalTime breakStart;

    @Column(name = "break_end")
    private LocalTime breakEnd;

    public boolean hasBreak() {
        return breakStart != null && breakEnd != null && breakStart.isBefore(breakEnd);
    }
}
