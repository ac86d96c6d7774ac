package com.health.booking.auth;

/**
 * The caller an operation runs on behalf of. For a doctor the id is the doctor id,
 * for a patient the patient id.
 */
public record Actor(Long id, Role role) {

    public enum Role { PATIENT, DOCTOR, ADMIN, SYSTEM }

    public Actor {
        if (role == null) {
            throw new IllegalArgumentException("role is required");
        }
    }

    public static Actor patient(Long id) {
        return new Actor(id, Role.PATIENT);
    }

    public static Actor doctor(Long id) {
        return new Actor(id, Role.DOCTOR);
    }

    public static Actor admin(Long id) {
        return new Actor(id, Role.ADMIN);
    }

    /** Internal callers such as reconciliation jobs. */
    public static Actor system() {
        return new Actor(null, Role.SYSTEM);
    }

    public boolean isPrivileged() {
        return role == Role.ADMIN || role == Role.SYSTEM;
    }

    public String describe() {
        return role + (id != null ? ":" + id : "");
    }
}
