package com.health.booking.auth;

import com.health.booking.entity.Appointment;

import java.util.Objects;

/**
 * Authorization rules for appointment operations, evaluated once per request.
 */
public final class AppointmentAccessPolicy {

    private AppointmentAccessPolicy() {
    }

    /**
     * Admins see everything, patients their own appointments, doctors the appointments booked with them.
     */
    public static boolean canAccessAppointment(Actor actor, Appointment appointment) {
        return canAccess(actor, appointment.getUserId(), appointment.getDoctorId());
    }

    public static boolean canAccess(Actor actor, Long userId, Long doctorId) {
        if (actor == null) return false;
        if (actor.isPrivileged()) return true;
        return switch (actor.role()) {
            case PATIENT -> actor.id() != null && Objects.equals(actor.id(), userId);
            case DOCTOR -> actor.id() != null && Objects.equals(actor.id(), doctorId);
            default -> false;
        };
    }

    /** Starting, completing and no-show marking belong to the treating doctor. */
    public static boolean canManageConsultation(Actor actor, Appointment appointment) {
        if (actor == null) return false;
        if (actor.isPrivileged()) return true;
        return actor.role() == Actor.Role.DOCTOR && Objects.equals(actor.id(), appointment.getDoctorId());
    }

    /** Patients book for themselves; admins and internal callers for anyone. */
    public static boolean canBookFor(Actor actor, Long userId) {
        if (actor == null) return false;
        if (actor.isPrivileged()) return true;
        return actor.role() == Actor.Role.PATIENT && Objects.equals(actor.id(), userId);
    }

    public static boolean canDelete(Actor actor) {
        return actor != null && actor.isPrivileged();
    }
}
