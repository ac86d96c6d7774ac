package com.health.booking.entity;

import com.health.booking.exception.InvalidStateTransitionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static com.health.booking.entity.Appointment.Status.CANCELLED;
import static com.health.booking.entity.Appointment.Status.COMPLETED;
import static com.health.booking.entity.Appointment.Status.CONFIRMED;
import static com.health.booking.entity.Appointment.Status.IN_PROGRESS;
import static com.health.booking.entity.Appointment.Status.PENDING;
import static com.health.booking.entity.Appointment.Status.RESCHEDULED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AppointmentTest {

    private static final ZoneId UTC = ZoneOffset.UTC;
    private static final Instant NOW = Instant.parse("2025-02-28T09:00:00Z");
    private static final Instant START = Instant.parse("2025-03-01T10:00:00Z");
    private static final Duration NOTICE = Duration.ofHours(2);

    private static Appointment booked(Appointment.Type type, Instant start) {
        return Appointment.book(1L, 10L, type == Appointment.Type.OFFLINE ? 100L : null, type,
                start, start.plus(Duration.ofMinutes(30)), UTC, new BigDecimal("500.00"), "APT123456", NOW);
    }

    private static Appointment booked() {
        return booked(Appointment.Type.ONLINE, START);
    }

    private static Appointment inStatus(Appointment.Status status) {
        return inStatus(Appointment.Type.ONLINE, status, false);
    }

    private static Appointment inStatus(Appointment.Type type, Appointment.Status status, boolean paid) {
        Appointment a = booked(type, START);
        if (paid) {
            a.attachPaymentOrder("order_1", new BigDecimal("500.00"), "INR");
            a.markPaid("pay_1", "UPI", NOW);
        }
        switch (status) {
            case PENDING -> { }
            case CONFIRMED -> a.confirm(NOW);
            case IN_PROGRESS -> {
                a.confirm(NOW);
                a.startConsultation(START);
            }
            case COMPLETED -> {
                a.confirm(NOW);
                a.startConsultation(START);
                a.complete(START.plus(Duration.ofMinutes(25)));
            }
            case CANCELLED -> a.cancel(null, "changed plans", "PATIENT:1", NOW);
            case NO_SHOW -> a.markNoShow(START.plusSeconds(60));
            case RESCHEDULED -> a.reschedule(START.plus(Duration.ofDays(1)), UTC, NOW, NOTICE);
        }
        return a;
    }

    /**
     * Every lifecycle operation with the statuses it may start from. Each one runs at a
     * time that satisfies its time guard, so only the status decides.
     */
    private enum Operation {
        CONFIRM(Appointment.Type.ONLINE, EnumSet.of(PENDING), a -> a.confirm(NOW)),
        BEGIN_CONSULTATION(Appointment.Type.ONLINE, EnumSet.of(CONFIRMED, RESCHEDULED),
                a -> a.startConsultation(START)),
        COMPLETE_ONLINE(Appointment.Type.ONLINE, EnumSet.of(IN_PROGRESS),
                a -> a.complete(START.plus(Duration.ofMinutes(20)))),
        COMPLETE_OFFLINE(Appointment.Type.OFFLINE, EnumSet.of(IN_PROGRESS, CONFIRMED, RESCHEDULED),
                a -> a.complete(START.plus(Duration.ofMinutes(20)))),
        CANCEL(Appointment.Type.ONLINE, EnumSet.of(PENDING, CONFIRMED, RESCHEDULED, IN_PROGRESS),
                a -> a.cancel(CancellationInfo.Reason.OTHER, null, "ADMIN:1", NOW)),
        MARK_NO_SHOW(Appointment.Type.ONLINE, EnumSet.of(PENDING, CONFIRMED, RESCHEDULED),
                a -> a.markNoShow(START.plus(Duration.ofDays(2)))),
        RESCHEDULE(Appointment.Type.ONLINE, EnumSet.of(PENDING, CONFIRMED, RESCHEDULED),
                a -> a.reschedule(START.plus(Duration.ofDays(3)), UTC, NOW, NOTICE)),
        REFUND(Appointment.Type.ONLINE, EnumSet.of(CANCELLED),
                a -> a.processRefund(new BigDecimal("500.00"), "rfnd_1")),
        FOLLOW_UP(Appointment.Type.ONLINE, EnumSet.of(COMPLETED),
                a -> a.scheduleFollowUp(LocalDate.of(2025, 3, 10), "review"));

        private final Appointment.Type type;
        private final Set<Appointment.Status> allowedFrom;
        private final Consumer<Appointment> action;

        Operation(Appointment.Type type, Set<Appointment.Status> allowedFrom, Consumer<Appointment> action) {
            this.type = type;
            this.allowedFrom = allowedFrom;
            this.action = action;
        }
    }

    private static Stream<Arguments> transitions(boolean legal) {
        return Arrays.stream(Operation.values())
                .flatMap(op -> Arrays.stream(Appointment.Status.values())
                        .filter(status -> op.allowedFrom.contains(status) == legal)
                        .map(status -> Arguments.of(status, op)));
    }

    static Stream<Arguments> legalTransitions() {
        return transitions(true);
    }

    static Stream<Arguments> illegalTransitions() {
        return transitions(false);
    }

    /** Everything a transition may touch, captured by value. */
    private record Snapshot(Appointment.Status status, Instant start, Instant end, LocalDate date,
                            Instant confirmedAt, LocalDate followUpDate, Object paymentStatus,
                            Object refundProcessed, Object refundId, Object cancelledAt,
                            Object callStartedAt, Object callEndedAt) {

        static Snapshot of(Appointment a) {
            PaymentInfo p = a.getPaymentInfo();
            CancellationInfo c = a.getCancellationInfo();
            ConsultationInfo v = a.getConsultationInfo();
            return new Snapshot(a.getStatus(), a.getStartTime(), a.getEndTime(), a.getAppointmentDate(),
                    a.getConfirmedAt(), a.getFollowUpDate(),
                    p != null ? p.getStatus() : null,
                    c != null ? c.isRefundProcessed() : null,
                    c != null ? c.getRefundId() : null,
                    c != null ? c.getCancelledAt() : null,
                    v != null ? v.getCallStartedAt() : null,
                    v != null ? v.getCallEndedAt() : null);
        }
    }

    @Test
    void bookCreatesPendingAppointment() {
        Appointment a = booked();

        assertThat(a.getStatus()).isEqualTo(Appointment.Status.PENDING);
        assertThat(a.getEndTime()).isEqualTo(Instant.parse("2025-03-01T10:30:00Z"));
        assertThat(a.getAppointmentDate()).isEqualTo(LocalDate.of(2025, 3, 1));
        assertThat(a.getConfirmationCode()).isNotBlank();
        assertThat(a.getBookedAt()).isEqualTo(NOW);
    }

    @Test
    void bookRejectsEmptyOrInvertedIntervals() {
        assertThatThrownBy(() -> Appointment.book(1L, 10L, null, Appointment.Type.ONLINE,
                START, START, UTC, BigDecimal.ZERO, "APT000001", NOW))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Appointment.book(1L, 10L, null, Appointment.Type.ONLINE,
                START, START.minusSeconds(60), UTC, BigDecimal.ZERO, "APT000001", NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shortAppointmentsAreLeftToTheBookingRules() {
        Appointment a = Appointment.book(1L, 10L, null, Appointment.Type.ONLINE,
                START, START.plus(Duration.ofMinutes(10)), UTC, BigDecimal.ZERO, "APT000001", NOW);

        assertThat(a.getDuration()).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void confirmRecordsTimestamp() {
        Appointment a = booked();

        a.confirm(NOW.plusSeconds(5));

        assertThat(a.getStatus()).isEqualTo(Appointment.Status.CONFIRMED);
        assertThat(a.getConfirmedAt()).isEqualTo(NOW.plusSeconds(5));
    }

    @ParameterizedTest(name = "{1} from {0} is allowed")
    @MethodSource("legalTransitions")
    void legalTransitionsSucceed(Appointment.Status from, Operation operation) {
        Appointment a = inStatus(operation.type, from, true);

        assertThatCode(() -> operation.action.accept(a)).doesNotThrowAnyException();
    }

    @ParameterizedTest(name = "{1} from {0} is rejected")
    @MethodSource("illegalTransitions")
    void illegalTransitionsThrowAndLeaveStateUnchanged(Appointment.Status from, Operation operation) {
        Appointment a = inStatus(operation.type, from, true);
        Snapshot before = Snapshot.of(a);

        assertThatThrownBy(() -> operation.action.accept(a))
                .isInstanceOf(InvalidStateTransitionException.class)
                .extracting("currentStatus").isEqualTo(from);

        assertThat(Snapshot.of(a)).isEqualTo(before);
    }

    @Test
    void refundOfUnpaidCancellationIsRejected() {
        Appointment a = inStatus(Appointment.Status.CANCELLED);
        Snapshot before = Snapshot.of(a);

        assertThat(a.requiresRefund()).isFalse();
        assertThatThrownBy(() -> a.processRefund(new BigDecimal("500.00"), "rfnd_1"))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThat(Snapshot.of(a)).isEqualTo(before);
    }

    @Test
    void cancellationWindowClosesAtStartAndStaysClosed() {
        Appointment a = inStatus(Appointment.Status.CONFIRMED);

        assertThat(a.canBeCancelled(START.minusSeconds(1))).isTrue();
        assertThat(a.canBeCancelled(START)).isFalse();
        assertThat(a.canBeCancelled(START.plus(Duration.ofHours(1)))).isFalse();
    }

    @Test
    void lateCancellationIsRejected() {
        Instant now = START.plus(Duration.ofMinutes(1));
        Appointment a = inStatus(Appointment.Status.CONFIRMED);

        assertThat(a.canBeCancelled(now)).isFalse();
        assertThatThrownBy(() -> a.cancel(CancellationInfo.Reason.PATIENT_REQUEST, null, "PATIENT:1", now))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThat(a.getStatus()).isEqualTo(Appointment.Status.CONFIRMED);
        assertThat(a.getCancellationInfo()).isNull();
    }

    @Test
    void cancelRecordsDetails() {
        Appointment a = inStatus(Appointment.Status.CONFIRMED);

        a.cancel(CancellationInfo.Reason.DOCTOR_UNAVAILABLE, "doctor sick", "DOCTOR:10", NOW);

        assertThat(a.getStatus()).isEqualTo(Appointment.Status.CANCELLED);
        assertThat(a.getCancellationInfo().getReason()).isEqualTo(CancellationInfo.Reason.DOCTOR_UNAVAILABLE);
        assertThat(a.getCancellationInfo().getCancelledBy()).isEqualTo("DOCTOR:10");
        assertThat(a.getCancellationInfo().isRefundProcessed()).isFalse();
        assertThat(a.requiresRefund()).isFalse();
    }

    @Test
    void reschedulePreservesDuration() {
        Appointment a = inStatus(Appointment.Status.CONFIRMED);
        Instant newStart = Instant.parse("2025-03-03T14:15:00Z");

        a.reschedule(newStart, UTC, NOW, NOTICE);

        assertThat(a.getStatus()).isEqualTo(Appointment.Status.RESCHEDULED);
        assertThat(a.getStartTime()).isEqualTo(newStart);
        assertThat(a.getDuration()).isEqualTo(Duration.ofMinutes(30));
        assertThat(a.getAppointmentDate()).isEqualTo(LocalDate.of(2025, 3, 3));
    }

    @Test
    void rescheduledAppointmentCanBeRescheduledAgainAndStarted() {
        Appointment a = inStatus(Appointment.Status.RESCHEDULED);

        a.reschedule(START.plus(Duration.ofDays(3)), UTC, NOW, NOTICE);
        a.startConsultation(START.plus(Duration.ofDays(3)));

        assertThat(a.getStatus()).isEqualTo(Appointment.Status.IN_PROGRESS);
    }

    @Test
    void rescheduleTooCloseToStartIsRejected() {
        Instant now = START.minus(Duration.ofMinutes(90));
        Appointment a = inStatus(Appointment.Status.CONFIRMED);

        assertThat(a.canBeRescheduled(now, NOTICE)).isFalse();
        assertThatThrownBy(() -> a.reschedule(START.plus(Duration.ofDays(1)), UTC, now, NOTICE))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThat(a.getStartTime()).isEqualTo(START);
    }

    @Test
    void refundIsProcessedOnlyOnce() {
        Appointment a = inStatus(Appointment.Status.CONFIRMED);
        a.attachPaymentOrder("order_1", new BigDecimal("500.00"), "INR");
        a.markPaid("pay_1", "UPI", NOW);
        a.cancel(CancellationInfo.Reason.PATIENT_REQUEST, null, "PATIENT:1", NOW);
        assertThat(a.requiresRefund()).isTrue();

        a.processRefund(new BigDecimal("500.00"), "rfnd_1");

        assertThat(a.requiresRefund()).isFalse();
        assertThat(a.getPaymentInfo().getStatus()).isEqualTo(PaymentInfo.Status.REFUNDED);
        assertThat(a.getCancellationInfo().getRefundId()).isEqualTo("rfnd_1");

        assertThatThrownBy(() -> a.processRefund(new BigDecimal("500.00"), "rfnd_2"))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThat(a.getCancellationInfo().getRefundId()).isEqualTo("rfnd_1");
        assertThat(a.getPaymentInfo().getStatus()).isEqualTo(PaymentInfo.Status.REFUNDED);
    }

    @Test
    void smallerRefundIsPartial() {
        Appointment a = inStatus(Appointment.Status.CONFIRMED);
        a.attachPaymentOrder("order_1", new BigDecimal("500.00"), "INR");
        a.markPaid("pay_1", "CARD", NOW);
        a.cancel(CancellationInfo.Reason.OTHER, null, "ADMIN:1", NOW);

        a.processRefund(new BigDecimal("250.00"), "rfnd_1");

        assertThat(a.getPaymentInfo().getStatus()).isEqualTo(PaymentInfo.Status.PARTIALLY_REFUNDED);
    }

    @Test
    void paymentCannotBeRecordedOnCancelledAppointment() {
        Appointment a = inStatus(Appointment.Status.CANCELLED);

        assertThatThrownBy(() -> a.markPaid("pay_1", "UPI", NOW))
                .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    void failedPaymentAfterCaptureIsRejected() {
        Appointment a = booked();
        a.markPaid("pay_1", "UPI", NOW);

        assertThatThrownBy(a::markPaymentFailed).isInstanceOf(IllegalStateException.class);
        assertThat(a.getPaymentInfo().isPaid()).isTrue();
    }

    @Test
    void onlineCompletionRecordsCallDuration() {
        Appointment a = inStatus(Appointment.Status.IN_PROGRESS);

        a.complete(START.plus(Duration.ofMinutes(22)));

        assertThat(a.getStatus()).isEqualTo(Appointment.Status.COMPLETED);
        assertThat(a.getConsultationInfo().getDurationMinutes()).isEqualTo(22);
        assertThat(a.getConsultationInfo().isCallActive()).isFalse();
    }

    @Test
    void offlineVisitCompletesFromConfirmed() {
        Appointment a = booked(Appointment.Type.OFFLINE, START);
        a.confirm(NOW);

        a.complete(START.plus(Duration.ofMinutes(30)));

        assertThat(a.getStatus()).isEqualTo(Appointment.Status.COMPLETED);
    }

    @Test
    void noShowNeedsStartToHavePassed() {
        Appointment a = inStatus(Appointment.Status.CONFIRMED);

        assertThatThrownBy(() -> a.markNoShow(START.minusSeconds(1)))
                .isInstanceOf(InvalidStateTransitionException.class);

        a.markNoShow(START);
        assertThat(a.getStatus()).isEqualTo(Appointment.Status.NO_SHOW);
    }

    @Test
    void followUpOnlyAfterCompletion() {
        Appointment pending = booked();
        assertThatThrownBy(() -> pending.scheduleFollowUp(LocalDate.of(2025, 3, 10), "review"))
                .isInstanceOf(InvalidStateTransitionException.class);

        Appointment done = inStatus(Appointment.Status.COMPLETED);
        done.scheduleFollowUp(LocalDate.of(2025, 3, 10), "review");
        assertThat(done.getFollowUpDate()).isEqualTo(LocalDate.of(2025, 3, 10));
    }

    @Test
    void videoCallOnlyForOnlineAppointments() {
        Appointment offline = booked(Appointment.Type.OFFLINE, START);

        assertThatThrownBy(() -> offline.attachVideoCall("abc", "https://meet/abc"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void backToBackIntervalsDoNotOverlap() {
        Appointment a = booked();

        assertThat(a.overlaps(START.plus(Duration.ofMinutes(30)), START.plus(Duration.ofMinutes(60)))).isFalse();
        assertThat(a.overlaps(START.minus(Duration.ofMinutes(30)), START)).isFalse();
        assertThat(a.overlaps(START.plus(Duration.ofMinutes(15)), START.plus(Duration.ofMinutes(45)))).isTrue();
    }
}
