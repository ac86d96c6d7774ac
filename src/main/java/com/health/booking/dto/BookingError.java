package com.health.booking.dto;

import org.springframework.http.HttpStatus;

/**
 * Outcome codes of booking operations. Each code belongs to a category that decides the
 * HTTP status reported to API clients.
 */
public enum BookingError {

    SUCCESS(Category.NONE),
    DOCTOR_NOT_FOUND(Category.NOT_FOUND),
    USER_NOT_FOUND(Category.NOT_FOUND),
    CLINIC_NOT_FOUND(Category.NOT_FOUND),
    APPOINTMENT_NOT_FOUND(Category.NOT_FOUND),
    TIME_SLOT_OCCUPIED(Category.CONFLICT),
    BOOKING_CONFLICT(Category.CONFLICT),
    CANNOT_CANCEL(Category.STATE_VIOLATION),
    CANNOT_RESCHEDULE(Category.STATE_VIOLATION),
    INVALID_STATE_TRANSITION(Category.STATE_VIOLATION),
    DOCTOR_NOT_AVAILABLE(Category.BUSINESS_RULE),
    DOCTOR_NOT_VERIFIED(Category.BUSINESS_RULE),
    CLINIC_CLOSED(Category.BUSINESS_RULE),
    FOLLOW_UP_NOT_ALLOWED(Category.BUSINESS_RULE),
    EMERGENCY_BOOKING_FAILED(Category.BUSINESS_RULE),
    BOOKING_LIMIT_EXCEEDED(Category.BUSINESS_RULE),
    UNAUTHORIZED_ACCESS(Category.AUTHORIZATION),
    VALIDATION_ERROR(Category.VALIDATION),
    INVALID_TIME_SLOT(Category.VALIDATION),
    PAYMENT_FAILED(Category.GATEWAY),
    REFUND_FAILED(Category.GATEWAY),
    DATABASE_ERROR(Category.STORAGE);

    public enum Category {
        NONE(HttpStatus.OK),
        NOT_FOUND(HttpStatus.NOT_FOUND),
        CONFLICT(HttpStatus.CONFLICT),
        STATE_VIOLATION(HttpStatus.UNPROCESSABLE_ENTITY),
        BUSINESS_RULE(HttpStatus.UNPROCESSABLE_ENTITY),
        AUTHORIZATION(HttpStatus.FORBIDDEN),
        VALIDATION(HttpStatus.BAD_REQUEST),
        GATEWAY(HttpStatus.BAD_GATEWAY),
        STORAGE(HttpStatus.INTERNAL_SERVER_ERROR);

        private final HttpStatus httpStatus;

        Category(HttpStatus httpStatus) {
            this.httpStatus = httpStatus;
        }
    }

    private final Category category;

    BookingError(Category category) {
        this.category = category;
    }

    public HttpStatus getHttpStatus() {
        return category.httpStatus;
    }
}
