package com.health.booking.controller;

import com.health.booking.auth.Actor;
import com.health.booking.auth.AppointmentAccessPolicy;
import com.health.booking.auth.CurrentActor;
import com.health.booking.config.BookingProperties;
import com.health.booking.dto.ApiResponse;
import com.health.booking.dto.AppointmentDto;
import com.health.booking.dto.AvailabilitySlot;
import com.health.booking.dto.BookingError;
import com.health.booking.entity.Appointment;
import com.health.booking.entity.Doctor;
import com.health.booking.service.AvailabilityService;
import com.health.booking.service.BookingService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

@RestController
@RequestMapping("/doctors")
public class DoctorController {

    private static final int DEFAULT_RANGE_DAYS = 7;
    private static final int MAX_RANGE_DAYS = 31;

    private final AvailabilityService availabilityService;
    private final BookingService bookingService;
    private final BookingProperties properties;
    private final Clock clock;

    public DoctorController(AvailabilityService availabilityService,
                            BookingService bookingService,
                            BookingProperties properties,
                            Clock clock) {
        this.availabilityService = availabilityService;
        this.bookingService = bookingService;
        this.properties = properties;
        this.clock = clock;
    }

    @GetMapping("/{id}/availability")
    public ResponseEntity<ApiResponse<List<AvailabilitySlot>>> availability(
            @PathVariable("id") Long id,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "type", required = false) Appointment.Type type) {
        Optional<Doctor> doctor = availabilityService.findDoctor(id);
        if (doctor.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiResponse.error(BookingError.DOCTOR_NOT_FOUND, "Doctor " + id + " not found"));
        }
        LocalDate start = from != null ? from : today();
        LocalDate end = to != null ? to : start.plusDays(DEFAULT_RANGE_DAYS - 1L);
        if (end.isBefore(start) || end.isAfter(start.plusDays(MAX_RANGE_DAYS))) {
            return ResponseEntity.badRequest()
                    .body(ApiResponse.error(BookingError.VALIDATION_ERROR,
                            "'to' must be on or after 'from' and at most " + MAX_RANGE_DAYS + " days later"));
        }
        try (Stream<AvailabilitySlot> slots = availabilityService.getDoctorAvailability(doctor.get(), start, end, type)) {
            return ResponseEntity.ok(ApiResponse.ok(slots.toList()));
        }
    }

    @GetMapping("/{id}/next-slots")
    public ResponseEntity<ApiResponse<List<AvailabilitySlot>>> nextSlots(
            @PathVariable("id") Long id,
            @RequestParam(value = "count", defaultValue = "5") int count) {
        if (availabilityService.findDoctor(id).isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiResponse.error(BookingError.DOCTOR_NOT_FOUND, "Doctor " + id + " not found"));
        }
        return ResponseEntity.ok(ApiResponse.ok(availabilityService.getNextAvailableSlots(id, Math.min(count, 50))));
    }

    @GetMapping("/{id}/appointments")
    public ResponseEntity<ApiResponse<List<AppointmentDto>>> appointments(
            @PathVariable("id") Long id,
            @RequestParam(value = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @CurrentActor Actor actor) {
        if (!AppointmentAccessPolicy.canAccess(actor, null, id)) {
            return forbidden(id);
        }
        List<AppointmentDto> result = bookingService.getDoctorAppointments(id, date != null ? date : today()).stream()
                .map(AppointmentDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(result));
    }

    @GetMapping("/{id}/queue")
    public ResponseEntity<ApiResponse<List<AppointmentDto>>> queue(
            @PathVariable("id") Long id,
            @RequestParam(value = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @CurrentActor Actor actor) {
        if (!AppointmentAccessPolicy.canAccess(actor, null, id)) {
            return forbidden(id);
        }
        List<AppointmentDto> result = bookingService.getAppointmentQueue(id, date != null ? date : today()).stream()
                .map(AppointmentDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(result));
    }

    private LocalDate today() {
        return clock.instant().atZone(properties.getZoneId()).toLocalDate();
    }

    private static <T> ResponseEntity<ApiResponse<T>> forbidden(Long doctorId) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(ApiResponse.error(BookingError.UNAUTHORIZED_ACCESS,
                        "Not allowed to view the schedule of doctor " + doctorId));
    }
}
