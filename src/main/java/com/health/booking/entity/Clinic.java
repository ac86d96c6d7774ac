package com.health.booking.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "clinic")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Clinic {

    public enum Status { ACTIVE, INACTIVE, PENDING_VERIFICATION, SUSPENDED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 150)
    private String name;

    @Column(length = 100)
    private String city;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private Status status = Status.PENDING_VERIFICATION;

    @Column(name = "emergency_services", nullable = false)
    private boolean emergencyServices;

    public boolean isOperational() {
        return status == Status.ACTIVE;
    }
}
