package com.health.booking.exception;

import com.health.booking.entity.Appointment;

import java.util.Set;

/**
 * Raised when an appointment operation is attempted from a status that does not allow it.
 * The appointment is left untouched.
 */
public class InvalidStateTransitionException extends RuntimeException {

    private final Appointment.Status currentStatus;
    private final String operation;
    private final Set<Appointment.Status> allowedFrom;

    public InvalidStateTransitionException(Appointment.Status currentStatus,
                                           String operation,
                                           Set<Appointment.Status> allowedFrom) {
        this(currentStatus, operation, allowedFrom, null);
    }

    public InvalidStateTransitionException(Appointment.Status currentStatus,
                                           String operation,
                                           Set<Appointment.Status> allowedFrom,
                                           String detail) {
        super("Cannot " + operation + " appointment in status " + currentStatus
                + " (allowed from " + allowedFrom + ")"
                + (detail != null ? ": " + detail : ""));
        this.currentStatus = currentStatus;
        this.operation = operation;
        this.allowedFrom = Set.copyOf(allowedFrom);
    }

    public Appointment.Status getCurrentStatus() {
        return currentStatus;
    }

    public String getOperation() {
        return operation;
    }

    public Set<Appointment.Status> getAllowedFrom() {
        return allowedFrom;
    }
}
