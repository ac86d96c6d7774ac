package com.health.booking.controller;

import com.health.booking.dto.ApiResponse;
import com.health.booking.dto.AppointmentDto;
import com.health.booking.dto.BookingResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.function.Function;

/**
 * Turns a {@link BookingResult} into an HTTP response using the status of its error.
 */
final class ResultResponses {

    private ResultResponses() {
    }

    static <T> ResponseEntity<ApiResponse<T>> respond(BookingResult result, HttpStatus successStatus,
                                                      String successMessage, Function<BookingResult, T> body) {
        if (result.isSuccess()) {
            return ResponseEntity.status(successStatus).body(ApiResponse.ok(successMessage, body.apply(result)));
        }
        T data = result.appointment() != null ? body.apply(result) : null;
        return ResponseEntity.status(result.error().getHttpStatus())
                .body(ApiResponse.error(result.error(), result.message(), data));
    }

    static ResponseEntity<ApiResponse<AppointmentDto>> respond(BookingResult result, String successMessage) {
        return respond(result, HttpStatus.OK, successMessage, r -> AppointmentDto.from(r.appointment()));
    }
}
