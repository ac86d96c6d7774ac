package com.health.booking.dto;

import com.health.booking.entity.Appointment;

import java.time.Instant;

/**
 * @param doctorId            required except for emergency bookings
 * @param clinicId            optional; offline visits fall back to the doctor's clinic
 * @param city                used by emergency bookings to find a doctor
 * @param preferredStartTime  required except for emergency bookings, which default to now
 */
public record BookingRequest(Long userId,
                             Long doctorId,
                             Long clinicId,
                             String city,
                             Instant preferredStartTime,
                             Appointment.Type type,
                             String symptoms,
                             String notes,
                             boolean emergency) {
}
