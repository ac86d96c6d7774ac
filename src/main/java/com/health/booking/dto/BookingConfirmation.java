package com.health.booking.dto;

/**
 * Response body of a new booking; {@code paymentUrl} is null for free or not yet payable appointments.
 */
public record BookingConfirmation(AppointmentDto appointment, String paymentUrl) {

    public static BookingConfirmation from(BookingResult result) {
        return new BookingConfirmation(AppointmentDto.from(result.appointment()), result.paymentUrl());
    }
}
