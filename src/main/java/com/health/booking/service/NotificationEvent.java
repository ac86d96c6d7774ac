package com.health.booking.service;

public enum NotificationEvent {
    BOOKING_CREATED,
    BOOKING_CONFIRMED,
    BOOKING_RESCHEDULED,
    BOOKING_CANCELLED,
    PAYMENT_RECEIVED,
    REFUND_PROCESSED,
    CONSULTATION_STARTED,
    CONSULTATION_COMPLETED,
    NO_SHOW,
    FOLLOW_UP_BOOKED
}
