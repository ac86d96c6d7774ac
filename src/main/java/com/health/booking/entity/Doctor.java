package com.health.booking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Set;

@Entity
@Table(name = "doctor", indexes = {
        @Index(name = "idx_doctor_city", columnList = "city")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Doctor {

    public enum Status { PENDING_VERIFICATION, VERIFIED, SUSPENDED, INACTIVE }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 100)
    private String specialization;

    @Column(length = 100)
    private String city;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private Status status = Status.PENDING_VERIFICATION;

    @Column(name = "accepting_bookings", nullable = false)
    @Builder.Default
    private boolean acceptingBookings = true;

    @Column(name = "emergency_available", nullable = false)
    private boolean emergencyAvailable;

    @Column(name = "consultation_fee", precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal consultationFee = BigDecimal.ZERO;

    @Column(name = "consultation_duration_minutes", nullable = false)
    @Builder.Default
    private int consultationDurationMinutes = 30;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "doctor_consultation_type", joinColumns = @JoinColumn(name = "doctor_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "consultation_type", length = 10)
    @Builder.Default
    private Set<Appointment.Type> consultationTypes = EnumSet.noneOf(Appointment.Type.class);

    /** Home clinic used for offline visits when the request names none. */
    @Column(name = "clinic_id")
    private Long clinicId;

    public boolean isVerified() {
        return status == Status.VERIFIED;
    }

    public boolean supports(Appointment.Type type) {
        return consultationTypes != null && consultationTypes.contains(type);
    }
}
