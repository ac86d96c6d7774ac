package com.health.booking.entity;

import com.health.booking.exception.InvalidStateTransitionException;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.SQLRestriction;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Set;

/**
 * A booked consultation between a patient and a doctor.
 * <p>
 * Status, payment and cancellation state only change through the named operations below;
 * an operation attempted from the wrong status throws {@link InvalidStateTransitionException}
 * before touching any field. Rows are soft-deleted and every query skips deleted rows.
 */
@Entity
@Table(name = "appointment", indexes = {
        @Index(name = "idx_appointment_doctor_start", columnList = "doctor_id, start_time"),
        @Index(name = "idx_appointment_user", columnList = "user_id"),
        @Index(name = "idx_appointment_status", columnList = "status")
})
@SQLRestriction("deleted = false")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(access = AccessLevel.PRIVATE)
public class Appointment {

    public enum Status { PENDING, CONFIRMED, IN_PROGRESS, COMPLETED, CANCELLED, NO_SHOW, RESCHEDULED }

    public enum Type { ONLINE, OFFLINE }


    private static final Set<Status> CONFIRMABLE = EnumSet.of(Status.PENDING);
    private static final Set<Status> STARTABLE = EnumSet.of(Status.CONFIRMED, Status.RESCHEDULED);
    private static final Set<Status> ONLINE_COMPLETABLE = EnumSet.of(Status.IN_PROGRESS);
    private static final Set<Status> OFFLINE_COMPLETABLE =
            EnumSet.of(Status.IN_PROGRESS, Status.CONFIRMED, Status.RESCHEDULED);
    private static final Set<Status> CANCELLABLE =
            EnumSet.of(Status.PENDING, Status.CONFIRMED, Status.RESCHEDULED, Status.IN_PROGRESS);
    private static final Set<Status> NO_SHOW_ELIGIBLE =
            EnumSet.of(Status.PENDING, Status.CONFIRMED, Status.RESCHEDULED);
    private static final Set<Status> RESCHEDULABLE =
            EnumSet.of(Status.PENDING, Status.CONFIRMED, Status.RESCHEDULED);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Long version;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "doctor_id", nullable = false)
    private Long doctorId;

    @Column(name = "clinic_id")
    private Long clinicId;

    @Column(name = "parent_appointment_id")
    private Long parentAppointmentId;

    @Column(name = "appointment_date", nullable = false)
    private LocalDate appointmentDate;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "appointment_type", nullable = false, length = 10)
    private Type type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Status status;

    @Column(length = 1000)
    private String symptoms;

    @Column(length = 1000)
    private String notes;

    @Column(nullable = false)
    private boolean emergency;

    @Column(name = "consultation_fee", precision = 12, scale = 2)
    private BigDecimal consultationFee;

    @Embedded
    private PaymentInfo paymentInfo;

    @Embedded
    private CancellationInfo cancellationInfo;

    @Embedded
    private ConsultationInfo consultationInfo;

    @Column(name = "confirmation_code", nullable = false, unique = true, length = 12)
    private String confirmationCode;

    @Column(name = "booked_at", nullable = false)
    private Instant bookedAt;

    @Column(name = "confirmed_at")
    private Instant confirmedAt;

    @Column(name = "prescription_id", length = 64)
    private String prescriptionId;

    @Column(name = "follow_up_date")
    private LocalDate followUpDate;

    @Column(name = "follow_up_notes", length = 1000)
    private String followUpNotes;

    @Column(nullable = false)
    private boolean deleted;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Creates a new PENDING appointment. The minimum length is a booking rule and is
     * checked by the caller against {@code booking.minimum-slot-minutes}.
     */
    public static Appointment book(Long userId,
                                   Long doctorId,
                                   Long clinicId,
                                   Type type,
                                   Instant startTime,
                                   Instant endTime,
                                   ZoneId zone,
                                   BigDecimal consultationFee,
                                   String confirmationCode,
                                   Instant now) {
        if (startTime == null || endTime == null || !startTime.isBefore(endTime)) {
            throw new IllegalArgumentException("startTime must be before endTime");
        }
        return Appointment.builder()
                .userId(userId)
                .doctorId(doctorId)
                .clinicId(clinicId)
                .type(type)
                .startTime(startTime)
                .endTime(endTime)
                .appointmentDate(startTime.atZone(zone).toLocalDate())
                .status(Status.PENDING)
                .consultationFee(consultationFee)
                .confirmationCode(confirmationCode)
                .bookedAt(now)
                .build();
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    // =========================================================
    // BOOKING DETAILS
    // =========================================================

    public void describePatient(String symptoms, String notes, boolean emergency) {
        this.symptoms = symptoms;
        this.notes = notes;
        this.emergency = emergency;
    }

    public void linkParent(Long parentAppointmentId) {
        this.parentAppointmentId = parentAppointmentId;
    }

    public void attachVideoCall(String meetingId, String link) {
        if (type != Type.ONLINE) {
            throw new IllegalStateException("Video calls are only attached to online appointments");
        }
        consultation().setMeetingId(meetingId);
        consultation().setLink(link);
    }

    // =========================================================
    // STATUS TRANSITIONS
    // =========================================================

    public void confirm(Instant now) {
        require(CONFIRMABLE, "confirm");
        status = Status.CONFIRMED;
        confirmedAt = now;
    }

    public void startConsultation(Instant now) {
        require(STARTABLE, "start");
        status = Status.IN_PROGRESS;
        consultation().setCallStartedAt(now);
    }

    /**
     * Offline visits may be completed straight from CONFIRMED/RESCHEDULED since check-in
     * is not tracked for them.
     */
    public void complete(Instant now) {
        require(type == Type.OFFLINE ? OFFLINE_COMPLETABLE : ONLINE_COMPLETABLE, "complete");
        status = Status.COMPLETED;
        ConsultationInfo info = consultation();
        if (info.getCallStartedAt() != null) {
            info.setCallEndedAt(now);
            info.setDurationMinutes((int) Duration.between(info.getCallStartedAt(), now).toMinutes());
        }
    }

    public void cancel(CancellationInfo.Reason reason, String description, String cancelledBy, Instant now) {
        if (!canBeCancelled(now)) {
            throw new InvalidStateTransitionException(status, "cancel", CANCELLABLE,
                    "appointment must not have started yet");
        }
        status = Status.CANCELLED;
        cancellationInfo = CancellationInfo.builder()
                .reason(reason != null ? reason : CancellationInfo.Reason.OTHER)
                .description(description)
                .cancelledAt(now)
                .cancelledBy(cancelledBy)
                .refundProcessed(false)
                .build();
    }

    public void markNoShow(Instant now) {
        if (!NO_SHOW_ELIGIBLE.contains(status) || now.isBefore(startTime)) {
            throw new InvalidStateTransitionException(status, "mark no-show", NO_SHOW_ELIGIBLE,
                    "start time must have passed");
        }
        status = Status.NO_SHOW;
    }

    /**
     * Moves the appointment to {@code newStartTime}, keeping its duration.
     */
    public void reschedule(Instant newStartTime, ZoneId zone, Instant now, Duration minimumNotice) {
        if (!canBeRescheduled(now, minimumNotice)) {
            throw new InvalidStateTransitionException(status, "reschedule", RESCHEDULABLE,
                    "requires at least " + minimumNotice.toMinutes() + " minutes notice");
        }
        Duration duration = getDuration();
        status = Status.RESCHEDULED;
        startTime = newStartTime;
        endTime = newStartTime.plus(duration);
        appointmentDate = newStartTime.atZone(zone).toLocalDate();
    }

    // =========================================================
    // PAYMENT
    // =========================================================

    public void attachPaymentOrder(String orderId, BigDecimal amount, String currency) {
        PaymentInfo info = payment();
        info.setOrderId(orderId);
        info.setAmount(amount);
        info.setCurrency(currency);
        if (info.getStatus() == null) {
            info.setStatus(PaymentInfo.Status.PENDING);
        }
    }

    public void markPaid(String paymentId, String method, Instant paidAt) {
        if (status == Status.CANCELLED) {
            throw new InvalidStateTransitionException(status, "record payment",
                    EnumSet.complementOf(EnumSet.of(Status.CANCELLED)));
        }
        PaymentInfo info = payment();
        info.setPaymentId(paymentId);
        info.setMethod(method);
        info.setPaidAt(paidAt);
        info.setStatus(PaymentInfo.Status.PAID);
        if (info.getAmount() == null) {
            info.setAmount(consultationFee);
        }
    }

    public void markPaymentFailed() {
        if (payment().isPaid()) {
            throw new IllegalStateException("Payment already captured for appointment " + id);
        }
        payment().setStatus(PaymentInfo.Status.FAILED);
    }

    /**
     * Records a gateway refund. Only legal once per cancellation; a second call throws and
     * changes nothing.
     */
    public void processRefund(BigDecimal amount, String refundId) {
        if (!requiresRefund()) {
            throw new InvalidStateTransitionException(status, "refund", EnumSet.of(Status.CANCELLED),
                    "requires a paid, cancelled appointment without a processed refund");
        }
        cancellationInfo.setRefundAmount(amount);
        cancellationInfo.setRefundId(refundId);
        cancellationInfo.setRefundProcessed(true);
        BigDecimal paid = paymentInfo.getAmount();
        boolean partial = paid != null && amount != null && amount.compareTo(paid) < 0;
        paymentInfo.setStatus(partial ? PaymentInfo.Status.PARTIALLY_REFUNDED : PaymentInfo.Status.REFUNDED);
    }

    // =========================================================
    // FOLLOW-UP
    // =========================================================

    public void linkPrescription(String prescriptionId) {
        this.prescriptionId = prescriptionId;
    }

    public void scheduleFollowUp(LocalDate date, String notes) {
        if (status != Status.COMPLETED) {
            throw new InvalidStateTransitionException(status, "schedule follow-up", EnumSet.of(Status.COMPLETED));
        }
        this.followUpDate = date;
        this.followUpNotes = notes;
    }

    public void markDeleted() {
        this.deleted = true;
    }

    // =========================================================
    // QUERIES
    // =========================================================

    public boolean canBeCancelled(Instant now) {
        return CANCELLABLE.contains(status) && startTime.isAfter(now);
    }

    public boolean canBeRescheduled(Instant now, Duration minimumNotice) {
        return RESCHEDULABLE.contains(status)
                && Duration.between(now, startTime).compareTo(minimumNotice) >= 0;
    }

    public boolean requiresRefund() {
        return status == Status.CANCELLED
                && paymentInfo != null && paymentInfo.isPaid()
                && cancellationInfo != null && !cancellationInfo.isRefundProcessed();
    }

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return startTime.isBefore(otherEnd) && endTime.isAfter(otherStart);
    }

    public Duration getDuration() {
        return Duration.between(startTime, endTime);
    }

    private void require(Set<Status> allowed, String operation) {
        if (!allowed.contains(status)) {
            throw new InvalidStateTransitionException(status, operation, allowed);
        }
    }

    private PaymentInfo payment() {
        if (paymentInfo == null) {
            paymentInfo = new PaymentInfo();
        }
        return paymentInfo;
    }

    private ConsultationInfo consultation() {
        if (consultationInfo == null) {
            consultationInfo = new ConsultationInfo();
        }
        return consultationInfo;
    }
}
