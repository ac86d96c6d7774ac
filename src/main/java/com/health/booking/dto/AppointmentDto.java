package com.health.booking.dto;

import com.health.booking.entity.Appointment;
import com.health.booking.entity.CancellationInfo;
import com.health.booking.entity.ConsultationInfo;
import com.health.booking.entity.PaymentInfo;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * API view of an appointment.
 */
public record AppointmentDto(Long id,
                             Long userId,
                             Long doctorId,
                             Long clinicId,
                             Long parentAppointmentId,
                             LocalDate appointmentDate,
                             Instant startTime,
                             Instant endTime,
                             Appointment.Type type,
                             Appointment.Status status,
                             boolean emergency,
                             String symptoms,
                             BigDecimal consultationFee,
                             String confirmationCode,
                             Instant bookedAt,
                             Instant confirmedAt,
                             Payment payment,
                             Cancellation cancellation,
                             Consultation consultation,
                             String prescriptionId,
                             LocalDate followUpDate) {

    public record Payment(String paymentId, String orderId, BigDecimal amount, String currency,
                          PaymentInfo.Status status, String method, Instant paidAt) {
    }

    public record Cancellation(CancellationInfo.Reason reason, String description, Instant cancelledAt,
                               String cancelledBy, BigDecimal refundAmount, String refundId,
                               boolean refundProcessed) {
    }

    public record Consultation(String meetingId, String link, Instant callStartedAt, Instant callEndedAt,
                               Integer durationMinutes) {
    }

    public static AppointmentDto from(Appointment a) {
        PaymentInfo p = a.getPaymentInfo();
        CancellationInfo c = a.getStatus() == Appointment.Status.CANCELLED ? a.getCancellationInfo() : null;
        ConsultationInfo v = a.getConsultationInfo();
        return new AppointmentDto(
                a.getId(),
                a.getUserId(),
                a.getDoctorId(),
                a.getClinicId(),
                a.getParentAppointmentId(),
                a.getAppointmentDate(),
                a.getStartTime(),
                a.getEndTime(),
                a.getType(),
                a.getStatus(),
                a.isEmergency(),
                a.getSymptoms(),
                a.getConsultationFee(),
                a.getConfirmationCode(),
                a.getBookedAt(),
                a.getConfirmedAt(),
                p == null ? null : new Payment(p.getPaymentId(), p.getOrderId(), p.getAmount(), p.getCurrency(),
                        p.getStatus(), p.getMethod(), p.getPaidAt()),
                c == null ? null : new Cancellation(c.getReason(), c.getDescription(), c.getCancelledAt(),
                        c.getCancelledBy(), c.getRefundAmount(), c.getRefundId(), c.isRefundProcessed()),
                v == null ? null : new Consultation(v.getMeetingId(), v.getLink(), v.getCallStartedAt(),
                        v.getCallEndedAt(), v.getDurationMinutes()),
                a.getPrescriptionId(),
                a.getFollowUpDate()
        );
    }
}
