package com.health.booking.controller;

import com.health.booking.auth.Actor;
import com.health.booking.auth.AppointmentAccessPolicy;
import com.health.booking.auth.CurrentActor;
import com.health.booking.dto.ApiResponse;
import com.health.booking.dto.AppointmentDto;
import com.health.booking.dto.BookingConfirmation;
import com.health.booking.dto.BookingError;
import com.health.booking.dto.BookingRequest;
import com.health.booking.dto.BookingResult;
import com.health.booking.dto.CancellationRequest;
import com.health.booking.dto.FollowUpRequest;
import com.health.booking.dto.PaymentConfirmationRequest;
import com.health.booking.dto.QueueStatus;
import com.health.booking.dto.RescheduleRequest;
import com.health.booking.entity.Appointment;
import com.health.booking.service.BookingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;

@RestController
@RequestMapping("/appointments")
public class AppointmentController {

    private static final Logger log = LoggerFactory.getLogger(AppointmentController.class);

    private final BookingService bookingService;

    public AppointmentController(BookingService bookingService) {
        this.bookingService = bookingService;
    }

    // =========================================================
    // BOOKING
    // =========================================================

    @PostMapping
    public ResponseEntity<ApiResponse<BookingConfirmation>> book(@RequestBody BookingRequest request,
                                                                 @CurrentActor Actor actor) {
        log.debug("Booking request from {}: doctor={} start={}", actor.describe(),
                request.doctorId(), request.preferredStartTime());
        return ResultResponses.respond(bookingService.bookAppointment(request, actor),
                HttpStatus.CREATED, "Appointment booked", BookingConfirmation::from);
    }

    @PostMapping("/emergency")
    public ResponseEntity<ApiResponse<BookingConfirmation>> bookEmergency(@RequestBody BookingRequest request,
                                                                          @CurrentActor Actor actor) {
        return ResultResponses.respond(bookingService.bookEmergencyAppointment(request, actor),
                HttpStatus.CREATED, "Emergency appointment booked", BookingConfirmation::from);
    }

    @PostMapping("/{id}/follow-up")
    public ResponseEntity<ApiResponse<BookingConfirmation>> bookFollowUp(@PathVariable("id") Long id,
                                                                         @RequestBody FollowUpRequest request,
                                                                         @CurrentActor Actor actor) {
        return ResultResponses.respond(bookingService.bookFollowUpAppointment(id, request, actor),
                HttpStatus.CREATED, "Follow-up appointment booked", BookingConfirmation::from);
    }

    // =========================================================
    // QUERIES
    // =========================================================

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<AppointmentDto>> get(@PathVariable("id") Long id, @CurrentActor Actor actor) {
        return ResultResponses.respond(bookingService.getAppointment(id, actor), null);
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<AppointmentDto>>> listForUser(
            @RequestParam("userId") Long userId,
            @RequestParam(value = "status", required = false) Appointment.Status status,
            @CurrentActor Actor actor) {
        if (!AppointmentAccessPolicy.canAccess(actor, userId, null)) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .body(ApiResponse.error(BookingError.UNAUTHORIZED_ACCESS, "Not allowed to list appointments of " + userId));
        }
        List<AppointmentDto> appointments = bookingService.getUserAppointments(userId, status).stream()
                .map(AppointmentDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.ok(appointments));
    }

    @GetMapping("/{id}/queue")
    public ResponseEntity<ApiResponse<QueueStatus>> queue(@PathVariable("id") Long id, @CurrentActor Actor actor) {
        BookingResult loaded = bookingService.getAppointment(id, actor);
        if (!loaded.isSuccess()) {
            return ResponseEntity.status(loaded.error().getHttpStatus())
                    .body(ApiResponse.error(loaded.error(), loaded.message()));
        }
        OptionalInt position = bookingService.getQueuePosition(id);
        long waitMinutes = bookingService.getEstimatedWaitTime(id).map(Duration::toMinutes).orElse(0L);
        return ResponseEntity.ok(ApiResponse.ok(new QueueStatus(id, position.orElse(0), waitMinutes)));
    }

    // =========================================================
    // CHANGES
    // =========================================================

    @PutMapping("/{id}/reschedule")
    public ResponseEntity<ApiResponse<AppointmentDto>> reschedule(@PathVariable("id") Long id,
                                                                  @RequestBody RescheduleRequest request,
                                                                  @CurrentActor Actor actor) {
        RescheduleRequest scoped = new RescheduleRequest(id, request.newStartTime(), request.reason());
        return ResultResponses.respond(bookingService.rescheduleAppointment(scoped, actor), "Appointment rescheduled");
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse<AppointmentDto>> cancel(@PathVariable("id") Long id,
                                                              @RequestBody(required = false) CancellationRequest request,
                                                              @CurrentActor Actor actor) {
        CancellationRequest scoped = request == null
                ? new CancellationRequest(id, null, null, null)
                : new CancellationRequest(id, request.reason(), request.description(), request.cancelledBy());
        return ResultResponses.respond(bookingService.cancelAppointment(scoped, actor), "Appointment cancelled");
    }

    @PostMapping("/{id}/confirm")
    public ResponseEntity<ApiResponse<AppointmentDto>> confirm(@PathVariable("id") Long id, @CurrentActor Actor actor) {
        return ResultResponses.respond(bookingService.confirmAppointment(id, actor), "Appointment confirmed");
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<ApiResponse<AppointmentDto>> start(@PathVariable("id") Long id, @CurrentActor Actor actor) {
        return ResultResponses.respond(bookingService.startAppointment(id, actor), "Consultation started");
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<ApiResponse<AppointmentDto>> complete(@PathVariable("id") Long id, @CurrentActor Actor actor) {
        return ResultResponses.respond(bookingService.completeAppointment(id, actor), "Consultation completed");
    }

    @PostMapping("/{id}/no-show")
    public ResponseEntity<ApiResponse<AppointmentDto>> noShow(@PathVariable("id") Long id, @CurrentActor Actor actor) {
        return ResultResponses.respond(bookingService.markNoShow(id, actor), "Appointment marked as no-show");
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<AppointmentDto>> delete(@PathVariable("id") Long id, @CurrentActor Actor actor) {
        return ResultResponses.respond(bookingService.deleteAppointment(id, actor), "Appointment deleted");
    }

    // =========================================================
    // PAYMENT
    // =========================================================

    @PostMapping("/{id}/payment-order")
    public ResponseEntity<ApiResponse<BookingConfirmation>> createPaymentOrder(@PathVariable("id") Long id,
                                                                               @CurrentActor Actor actor) {
        return ResultResponses.respond(bookingService.createPaymentOrder(id, actor),
                HttpStatus.OK, "Payment order created", BookingConfirmation::from);
    }

    @PostMapping("/{id}/payment")
    public ResponseEntity<ApiResponse<AppointmentDto>> confirmPayment(@PathVariable("id") Long id,
                                                                      @RequestBody PaymentConfirmationRequest request,
                                                                      @CurrentActor Actor actor) {
        return ResultResponses.respond(bookingService.confirmPayment(id, request, actor), "Payment received");
    }

    @PostMapping("/{id}/refund")
    public ResponseEntity<ApiResponse<AppointmentDto>> retryRefund(@PathVariable("id") Long id,
                                                                   @CurrentActor Actor actor) {
        return ResultResponses.respond(bookingService.retryRefund(id, actor), "Refund processed");
    }
}
