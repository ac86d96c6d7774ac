package com.health.booking.dto;

import com.health.booking.entity.Appointment;

/**
 * Typed outcome of a booking operation. Expected business-rule violations are reported
 * here instead of being thrown.
 */
public record BookingResult(BookingError error, String message, Appointment appointment, String paymentUrl) {

    public static BookingResult success(Appointment appointment) {
        return new BookingResult(BookingError.SUCCESS, null, appointment, null);
    }

    public static BookingResult success(Appointment appointment, String paymentUrl) {
        return new BookingResult(BookingError.SUCCESS, null, appointment, paymentUrl);
    }

    public static BookingResult failure(BookingError error, String message) {
        return new BookingResult(error, message, null, null);
    }

    /** A failure that still carries the appointment, e.g. cancelled but not yet refunded. */
    public static BookingResult partial(BookingError error, String message, Appointment appointment) {
        return new BookingResult(error, message, appointment, null);
    }

    public boolean isSuccess() {
        return error == BookingError.SUCCESS;
    }
}
