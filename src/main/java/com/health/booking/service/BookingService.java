package com.health.booking.service;

import com.health.booking.auth.Actor;
import com.health.booking.auth.AppointmentAccessPolicy;
import com.health.booking.config.BookingProperties;
import com.health.booking.dto.BookingError;
import com.health.booking.dto.BookingRequest;
import com.health.booking.dto.BookingResult;
import com.health.booking.dto.CancellationRequest;
import com.health.booking.dto.FollowUpRequest;
import com.health.booking.dto.PaymentConfirmationRequest;
import com.health.booking.dto.PaymentOrder;
import com.health.booking.dto.RefundReceipt;
import com.health.booking.dto.RescheduleRequest;
import com.health.booking.entity.Appointment;
import com.health.booking.entity.Clinic;
import com.health.booking.entity.Doctor;
import com.health.booking.entity.Patient;
import com.health.booking.exception.InvalidStateTransitionException;
import com.health.booking.exception.PaymentGatewayException;
import com.health.booking.repository.AppointmentRepository;
import com.health.booking.repository.ClinicRepository;
import com.health.booking.repository.DoctorRepository;
import com.health.booking.repository.PatientRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Booking workflows. Every operation returns a {@link BookingResult}; expected rule violations
 * never escape as exceptions. Storage work runs in a transaction, gateway calls and
 * notifications after it commits.
 */
@Service
public class BookingService {

    private static final Logger log = LoggerFactory.getLogger(BookingService.class);

    static final String RETRY_LATER = "Service temporarily unavailable, please try again later";

    private static final Set<Appointment.Status> ACTIVE_STATUSES =
            EnumSet.of(Appointment.Status.PENDING, Appointment.Status.CONFIRMED, Appointment.Status.RESCHEDULED);
    // RESCHEDULED counts as confirmed for queueing; confirm() only leaves PENDING.
    private static final Set<Appointment.Status> QUEUE_STATUSES =
            EnumSet.of(Appointment.Status.PENDING, Appointment.Status.CONFIRMED,
                    Appointment.Status.RESCHEDULED, Appointment.Status.IN_PROGRESS);

    private final AppointmentRepository appointmentRepository;
    private final DoctorRepository doctorRepository;
    private final ClinicRepository clinicRepository;
    private final PatientRepository patientRepository;
    private final ScheduleService scheduleService;
    private final PaymentGateway paymentGateway;
    private final NotificationService notificationService;
    private final ConfirmationCodeGenerator codeGenerator;
    private final BookingProperties properties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public BookingService(AppointmentRepository appointmentRepository,
                          DoctorRepository doctorRepository,
                          ClinicRepository clinicRepository,
                          PatientRepository patientRepository,
                          ScheduleService scheduleService,
                          PaymentGateway paymentGateway,
                          NotificationService notificationService,
                          ConfirmationCodeGenerator codeGenerator,
                          BookingProperties properties,
                          Clock clock,
                          PlatformTransactionManager transactionManager) {
        this.appointmentRepository = appointmentRepository;
        this.doctorRepository = doctorRepository;
        this.clinicRepository = clinicRepository;
        this.patientRepository = patientRepository;
        this.scheduleService = scheduleService;
        this.paymentGateway = paymentGateway;
        this.notificationService = notificationService;
        this.codeGenerator = codeGenerator;
        this.properties = properties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    // =========================================================
    // BOOKING
    // =========================================================

    public BookingResult bookAppointment(BookingRequest request, Actor actor) {
        Instant now = clock.instant();
        if (request == null || request.userId() == null || request.doctorId() == null
                || request.preferredStartTime() == null || request.type() == null) {
            return BookingResult.failure(BookingError.VALIDATION_ERROR,
                    "userId, doctorId, preferredStartTime and type are required");
        }
        Optional<BookingResult> badTime = checkStartTime(request.preferredStartTime(), now);
        if (badTime.isPresent()) {
            return badTime.get();
        }
        if (!AppointmentAccessPolicy.canBookFor(actor, request.userId())) {
            return unauthorized(actor, "book for patient " + request.userId());
        }

        BookingResult result = execute("bookAppointment", request.doctorId(),
                () -> placeBooking(request, request.doctorId(), request.preferredStartTime(), now, null));
        return afterBooking(result, NotificationEvent.BOOKING_CREATED);
    }

    /**
     * Books the first emergency-available doctor in the requested city without a conflict.
     * The advance-booking window does not apply and the start defaults to now.
     */
    public BookingResult bookEmergencyAppointment(BookingRequest request, Actor actor) {
        Instant now = clock.instant();
        if (request == null || request.userId() == null || request.type() == null
                || StringUtils.isBlank(request.city())) {
            return BookingResult.failure(BookingError.VALIDATION_ERROR, "userId, city and type are required");
        }
        Instant start = request.preferredStartTime() != null ? request.preferredStartTime() : now;
        if (start.isBefore(now)) {
            return BookingResult.failure(BookingError.INVALID_TIME_SLOT, "Start time must not be in the past");
        }
        if (!AppointmentAccessPolicy.canBookFor(actor, request.userId())) {
            return unauthorized(actor, "book for patient " + request.userId());
        }
        BookingRequest emergency = new BookingRequest(request.userId(), null, request.clinicId(), request.city(),
                start, request.type(), request.symptoms(), request.notes(), true);

        BookingResult result = execute("bookEmergencyAppointment", request.userId(), () -> {
            Optional<BookingResult> missingPatient = checkPatient(emergency.userId());
            if (missingPatient.isPresent()) {
                return missingPatient.get();
            }
            for (Doctor candidate : doctorRepository.findEmergencyDoctors(emergency.city())) {
                if (!candidate.supports(emergency.type())) {
                    continue;
                }
                Doctor doctor = doctorRepository.findByIdForUpdate(candidate.getId()).orElse(null);
                if (doctor == null) {
                    continue;
                }
                Long clinicId = resolveClinic(emergency.clinicId(), doctor, emergency.type());
                Instant end = start.plus(Duration.ofMinutes(doctor.getConsultationDurationMinutes()));
                Optional<BookingResult> rejected =
                        checkSlot(doctor, clinicId, emergency.type(), start, end, null, true);
                if (rejected.isEmpty()) {
                    return persist(emergency, doctor, clinicId, start, end, now, null);
                }
                log.debug("Emergency candidate {} skipped: {}", doctor.getId(), rejected.get().error());
            }
            log.info("No emergency doctor free in {} at {}", emergency.city(), start);
            return BookingResult.failure(BookingError.EMERGENCY_BOOKING_FAILED,
                    "No emergency doctor available in " + emergency.city());
        });
        return afterBooking(result, NotificationEvent.BOOKING_CREATED);
    }

    public BookingResult bookFollowUpAppointment(Long parentId, FollowUpRequest request, Actor actor) {
        Instant now = clock.instant();
        if (parentId == null || request == null || request.preferredStartTime() == null) {
            return BookingResult.failure(BookingError.VALIDATION_ERROR, "preferredStartTime is required");
        }
        Optional<BookingResult> badTime = checkStartTime(request.preferredStartTime(), now);
        if (badTime.isPresent()) {
            return badTime.get();
        }

        BookingResult result = execute("bookFollowUpAppointment", parentId, () -> {
            Appointment parent = appointmentRepository.findByIdForUpdate(parentId).orElse(null);
            if (parent == null) {
                return notFound(parentId);
            }
            if (!AppointmentAccessPolicy.canAccessAppointment(actor, parent)) {
                return unauthorized(actor, "follow up appointment " + parentId);
            }
            if (!isFollowUpAllowed(parent, now)) {
                return BookingResult.failure(BookingError.FOLLOW_UP_NOT_ALLOWED,
                        "Follow-ups are only possible within " + properties.getFollowUpWindow().toDays()
                                + " days of a completed appointment");
            }
            BookingRequest followUp = new BookingRequest(parent.getUserId(), parent.getDoctorId(),
                    parent.getClinicId(), null, request.preferredStartTime(), parent.getType(),
                    null, request.notes(), false);
            BookingResult booked = placeBooking(followUp, parent.getDoctorId(), followUp.preferredStartTime(),
                    now, parent.getId());
            if (booked.isSuccess()) {
                parent.scheduleFollowUp(request.preferredStartTime().atZone(zone()).toLocalDate(), request.notes());
                if (StringUtils.isNotBlank(request.prescriptionId())) {
                    parent.linkPrescription(request.prescriptionId());
                }
                appointmentRepository.save(parent);
            }
            return booked;
        });
        return afterBooking(result, NotificationEvent.FOLLOW_UP_BOOKED);
    }

    public boolean isFollowUpAllowed(Appointment parent, Instant now) {
        return parent.getStatus() == Appointment.Status.COMPLETED
                && !now.isAfter(parent.getEndTime().plus(properties.getFollowUpWindow()));
    }

    // Runs inside the booking transaction.
    private BookingResult placeBooking(BookingRequest request, Long doctorId, Instant start, Instant now, Long parentId) {
        Optional<BookingResult> missingPatient = checkPatient(request.userId());
        if (missingPatient.isPresent()) {
            return missingPatient.get();
        }
        Doctor doctor = doctorRepository.findByIdForUpdate(doctorId).orElse(null);
        if (doctor == null) {
            return BookingResult.failure(BookingError.DOCTOR_NOT_FOUND, "Doctor " + doctorId + " not found");
        }
        Long clinicId = resolveClinic(request.clinicId(), doctor, request.type());
        Instant end = start.plus(Duration.ofMinutes(doctor.getConsultationDurationMinutes()));

        Optional<BookingResult> rejected = checkSlot(doctor, clinicId, request.type(), start, end, null, false);
        if (rejected.isPresent()) {
            log.info("Booking rejected: doctor={} start={} reason={}", doctorId, start, rejected.get().error());
            return rejected.get();
        }

        long active = appointmentRepository.countByUserIdAndStatusInAndStartTimeAfter(
                request.userId(), ACTIVE_STATUSES, now);
        if (active >= properties.getMaxActiveBookingsPerUser()) {
            return BookingResult.failure(BookingError.BOOKING_LIMIT_EXCEEDED,
                    "A patient may hold at most " + properties.getMaxActiveBookingsPerUser() + " upcoming appointments");
        }
        return persist(request, doctor, clinicId, start, end, now, parentId);
    }

    private BookingResult persist(BookingRequest request, Doctor doctor, Long clinicId,
                                  Instant start, Instant end, Instant now, Long parentId) {
        Appointment appointment = Appointment.book(request.userId(), doctor.getId(), clinicId, request.type(),
                start, end, zone(), doctor.getConsultationFee(), codeGenerator.nextConfirmationCode(), now);
        appointment.describePatient(request.symptoms(), request.notes(), request.emergency());
        if (request.type() == Appointment.Type.ONLINE) {
            String meetingId = codeGenerator.nextMeetingId();
            appointment.attachVideoCall(meetingId, properties.getVideoCallBaseUrl() + meetingId);
        }
        if (parentId != null) {
            appointment.linkParent(parentId);
        }
        appointment = appointmentRepository.saveAndFlush(appointment);

        log.info("Booked appointment: id={} code={} patient={} doctor={} start={} emergency={}",
                appointment.getId(), appointment.getConfirmationCode(), appointment.getUserId(),
                appointment.getDoctorId(), appointment.getStartTime(), appointment.isEmergency());
        return BookingResult.success(appointment);
    }

    /**
     * Doctor, clinic and conflict checks for placing [start, end) with the doctor row locked.
     */
    private Optional<BookingResult> checkSlot(Doctor doctor, Long clinicId, Appointment.Type type,
                                              Instant start, Instant end, Long excludeId, boolean emergency) {
        if (!doctor.isVerified()) {
            return Optional.of(BookingResult.failure(BookingError.DOCTOR_NOT_VERIFIED,
                    "Doctor " + doctor.getId() + " is not verified"));
        }
        if (!doctor.isAcceptingBookings() || !doctor.supports(type)) {
            return Optional.of(BookingResult.failure(BookingError.DOCTOR_NOT_AVAILABLE,
                    "Doctor " + doctor.getId() + " does not take " + type + " bookings"));
        }
        if (!emergency && scheduleService.hasConfiguredHours(doctor.getId())
                && !scheduleService.doctorHours(doctor.getId()).covers(start, end, zone())) {
            return Optional.of(BookingResult.failure(BookingError.DOCTOR_NOT_AVAILABLE,
                    "Requested time is outside the doctor's working hours"));
        }
        if (type == Appointment.Type.OFFLINE && clinicId != null) {
            Clinic clinic = clinicRepository.findById(clinicId).orElse(null);
            if (clinic == null) {
                return Optional.of(BookingResult.failure(BookingError.CLINIC_NOT_FOUND,
                        "Clinic " + clinicId + " not found"));
            }
            boolean open = emergency && clinic.isEmergencyServices()
                    || scheduleService.clinicHours(clinicId).covers(start, end, zone());
            if (!clinic.isOperational() || !open) {
                return Optional.of(BookingResult.failure(BookingError.CLINIC_CLOSED,
                        "Clinic " + clinicId + " is closed at the requested time"));
            }
        }
        if (Duration.between(start, end).compareTo(properties.getMinimumSlotDuration()) < 0) {
            return Optional.of(BookingResult.failure(BookingError.INVALID_TIME_SLOT,
                    "Appointments must last at least " + properties.getMinimumSlotDuration().toMinutes() + " minutes"));
        }
        if (!appointmentRepository.findConflictingAppointments(doctor.getId(), start, end, excludeId).isEmpty()) {
            return Optional.of(BookingResult.failure(BookingError.TIME_SLOT_OCCUPIED,
                    "The requested time slot is already booked"));
        }
        return Optional.empty();
    }

    private Optional<BookingResult> checkPatient(Long userId) {
        Patient patient = patientRepository.findById(userId).orElse(null);
        if (patient == null || !patient.isActive()) {
            return Optional.of(BookingResult.failure(BookingError.USER_NOT_FOUND, "Patient " + userId + " not found"));
        }
        return Optional.empty();
    }

    private Optional<BookingResult> checkStartTime(Instant start, Instant now) {
        if (!start.isAfter(now)) {
            return Optional.of(BookingResult.failure(BookingError.INVALID_TIME_SLOT, "Start time must be in the future"));
        }
        if (start.isAfter(now.plus(properties.getAdvanceBookingWindow()))) {
            return Optional.of(BookingResult.failure(BookingError.INVALID_TIME_SLOT,
                    "Appointments can be booked at most " + properties.getAdvanceBookingWindow().toDays()
                            + " days ahead"));
        }
        return Optional.empty();
    }

    private static Long resolveClinic(Long requested, Doctor doctor, Appointment.Type type) {
        if (requested != null) {
            return requested;
        }
        return type == Appointment.Type.OFFLINE ? doctor.getClinicId() : null;
    }

    private BookingResult afterBooking(BookingResult result, NotificationEvent event) {
        if (!result.isSuccess()) {
            return result;
        }
        BookingResult outcome = result;
        Appointment appointment = result.appointment();
        if (properties.isChargeable(appointment.getConsultationFee())) {
            outcome = openPaymentOrder(appointment).orElse(result);
        }
        notificationService.notifyParticipants(event, outcome.appointment());
        return outcome;
    }

    // =========================================================
    // PAYMENT
    // =========================================================

    /**
     * Creates a gateway order for an unpaid appointment, for example after the order failed at booking time.
     */
    public BookingResult createPaymentOrder(Long appointmentId, Actor actor) {
        BookingResult loaded = getAppointment(appointmentId, actor);
        if (!loaded.isSuccess()) {
            return loaded;
        }
        Appointment appointment = loaded.appointment();
        if (appointment.getPaymentInfo() != null && appointment.getPaymentInfo().isPaid()) {
            return BookingResult.failure(BookingError.INVALID_STATE_TRANSITION, "Appointment is already paid");
        }
        if (appointment.getStatus() == Appointment.Status.CANCELLED) {
            return BookingResult.failure(BookingError.INVALID_STATE_TRANSITION, "Appointment is cancelled");
        }
        return openPaymentOrder(appointment)
                .orElseGet(() -> BookingResult.partial(BookingError.PAYMENT_FAILED,
                        "Payment order could not be created, please try again later", appointment));
    }

    private Optional<BookingResult> openPaymentOrder(Appointment appointment) {
        BigDecimal amount = appointment.getConsultationFee();
        String currency = properties.getDefaultCurrency();
        PaymentOrder order;
        try {
            order = paymentGateway.createOrder(amount, currency, appointment.getId());
        } catch (PaymentGatewayException e) {
            log.warn("Payment order for appointment {} not created: {}", appointment.getId(), e.getMessage());
            return Optional.empty();
        }
        BookingResult saved = execute("attachPaymentOrder", appointment.getId(), () -> {
            Appointment locked = appointmentRepository.findByIdForUpdate(appointment.getId()).orElse(null);
            if (locked == null) {
                return notFound(appointment.getId());
            }
            locked.attachPaymentOrder(order.orderId(), amount, currency);
            return BookingResult.success(appointmentRepository.save(locked));
        });
        if (!saved.isSuccess()) {
            log.warn("Payment order {} not recorded on appointment {}: {}",
                    order.orderId(), appointment.getId(), saved.error());
            return Optional.empty();
        }
        return Optional.of(BookingResult.success(saved.appointment(), order.paymentUrl()));
    }

    public BookingResult confirmPayment(Long appointmentId, PaymentConfirmationRequest request, Actor actor) {
        if (appointmentId == null || request == null
                || StringUtils.isAnyBlank(request.paymentId(), request.orderId(), request.signature())) {
            return BookingResult.failure(BookingError.VALIDATION_ERROR, "paymentId, orderId and signature are required");
        }
        Instant now = clock.instant();
        boolean verified;
        try {
            verified = paymentGateway.verifySignature(request.orderId(), request.paymentId(), request.signature());
        } catch (PaymentGatewayException e) {
            log.error("Signature check for appointment {} failed: {}", appointmentId, e.getMessage());
            return BookingResult.failure(BookingError.PAYMENT_FAILED, "Payment could not be verified");
        }

        BookingResult result = execute("confirmPayment", appointmentId, () -> {
            Appointment appointment = appointmentRepository.findByIdForUpdate(appointmentId).orElse(null);
            if (appointment == null) {
                return notFound(appointmentId);
            }
            if (!AppointmentAccessPolicy.canAccessAppointment(actor, appointment)) {
                return unauthorized(actor, "pay for appointment " + appointmentId);
            }
            if (appointment.getPaymentInfo() == null
                    || !Objects.equals(appointment.getPaymentInfo().getOrderId(), request.orderId())) {
                return BookingResult.failure(BookingError.VALIDATION_ERROR,
                        "Order " + request.orderId() + " does not belong to appointment " + appointmentId);
            }
            try {
                if (!verified) {
                    appointment.markPaymentFailed();
                    Appointment saved = appointmentRepository.save(appointment);
                    log.warn("Payment signature rejected for appointment {} order {}", appointmentId, request.orderId());
                    return BookingResult.partial(BookingError.PAYMENT_FAILED, "Payment verification failed", saved);
                }
                appointment.markPaid(request.paymentId(), request.method(), now);
                if (appointment.getStatus() == Appointment.Status.PENDING) {
                    appointment.confirm(now);
                }
            } catch (InvalidStateTransitionException | IllegalStateException e) {
                return BookingResult.failure(BookingError.INVALID_STATE_TRANSITION, e.getMessage());
            }
            Appointment saved = appointmentRepository.save(appointment);
            log.info("Payment {} recorded for appointment {}", request.paymentId(), appointmentId);
            return BookingResult.success(saved);
        });
        if (result.isSuccess()) {
            notificationService.notifyParticipants(NotificationEvent.PAYMENT_RECEIVED, result.appointment());
        }
        return result;
    }

    // =========================================================
    // RESCHEDULE / CANCEL
    // =========================================================

    public BookingResult rescheduleAppointment(RescheduleRequest request, Actor actor) {
        if (request == null || request.appointmentId() == null || request.newStartTime() == null) {
            return BookingResult.failure(BookingError.VALIDATION_ERROR, "appointmentId and newStartTime are required");
        }
        Instant now = clock.instant();
        Long id = request.appointmentId();

        BookingResult result = execute("rescheduleAppointment", id, () -> {
            Appointment appointment = appointmentRepository.findByIdForUpdate(id).orElse(null);
            if (appointment == null) {
                return notFound(id);
            }
            if (!AppointmentAccessPolicy.canAccessAppointment(actor, appointment)) {
                return unauthorized(actor, "reschedule appointment " + id);
            }
            if (!appointment.canBeRescheduled(now, properties.getRescheduleNotice())) {
                return BookingResult.failure(BookingError.CANNOT_RESCHEDULE,
                        "Appointments in status " + appointment.getStatus() + " or starting within "
                                + properties.getRescheduleNotice().toMinutes() + " minutes cannot be rescheduled");
            }
            Optional<BookingResult> badTime = checkStartTime(request.newStartTime(), now);
            if (badTime.isPresent()) {
                return badTime.get();
            }
            Doctor doctor = doctorRepository.findByIdForUpdate(appointment.getDoctorId()).orElse(null);
            if (doctor == null) {
                return BookingResult.failure(BookingError.DOCTOR_NOT_FOUND,
                        "Doctor " + appointment.getDoctorId() + " not found");
            }
            Instant newEnd = request.newStartTime().plus(appointment.getDuration());
            Optional<BookingResult> rejected = checkSlot(doctor, appointment.getClinicId(), appointment.getType(),
                    request.newStartTime(), newEnd, appointment.getId(), appointment.isEmergency());
            if (rejected.isPresent()) {
                return rejected.get();
            }
            Instant previous = appointment.getStartTime();
            appointment.reschedule(request.newStartTime(), zone(), now, properties.getRescheduleNotice());
            Appointment saved = appointmentRepository.save(appointment);
            log.info("Rescheduled appointment {} from {} to {} ({})", id, previous, saved.getStartTime(),
                    StringUtils.defaultIfBlank(request.reason(), "no reason given"));
            return BookingResult.success(saved);
        });
        if (result.isSuccess()) {
            notificationService.notifyParticipants(NotificationEvent.BOOKING_RESCHEDULED, result.appointment());
        }
        return result;
    }

    /**
     * Cancels and, for a paid appointment, refunds in full. The cancellation stands even when the
     * refund fails; the result then carries REFUND_FAILED and the cancelled appointment.
     */
    public BookingResult cancelAppointment(CancellationRequest request, Actor actor) {
        if (request == null || request.appointmentId() == null) {
            return BookingResult.failure(BookingError.VALIDATION_ERROR, "appointmentId is required");
        }
        Instant now = clock.instant();
        Long id = request.appointmentId();

        BookingResult result = execute("cancelAppointment", id, () -> {
            Appointment appointment = appointmentRepository.findByIdForUpdate(id).orElse(null);
            if (appointment == null) {
                return notFound(id);
            }
            if (!AppointmentAccessPolicy.canAccessAppointment(actor, appointment)) {
                return unauthorized(actor, "cancel appointment " + id);
            }
            if (!appointment.canBeCancelled(now)) {
                return BookingResult.failure(BookingError.CANNOT_CANCEL,
                        "Appointment in status " + appointment.getStatus() + " starting at "
                                + appointment.getStartTime() + " can no longer be cancelled");
            }
            String cancelledBy = StringUtils.defaultIfBlank(request.cancelledBy(), actor.describe());
            appointment.cancel(request.reason(), request.description(), cancelledBy, now);
            Appointment saved = appointmentRepository.save(appointment);
            log.info("Cancelled appointment {} by {} reason={}", id, cancelledBy,
                    saved.getCancellationInfo().getReason());
            return BookingResult.success(saved);
        });
        if (!result.isSuccess()) {
            return result;
        }
        notificationService.notifyParticipants(NotificationEvent.BOOKING_CANCELLED, result.appointment());
        return result.appointment().requiresRefund() ? refund(result.appointment()) : result;
    }

    /**
     * Retries the refund of a cancelled, paid appointment whose refund did not go through.
     */
    public BookingResult retryRefund(Long appointmentId, Actor actor) {
        if (actor == null || !actor.isPrivileged()) {
            return unauthorized(actor, "refund appointment " + appointmentId);
        }
        BookingResult loaded = getAppointment(appointmentId, actor);
        if (!loaded.isSuccess()) {
            return loaded;
        }
        if (!loaded.appointment().requiresRefund()) {
            return BookingResult.failure(BookingError.INVALID_STATE_TRANSITION,
                    "Appointment " + appointmentId + " has no outstanding refund");
        }
        return refund(loaded.appointment());
    }

    private BookingResult refund(Appointment appointment) {
        BigDecimal amount = appointment.getPaymentInfo().getAmount() != null
                ? appointment.getPaymentInfo().getAmount()
                : appointment.getConsultationFee();
        RefundReceipt receipt;
        try {
            receipt = paymentGateway.refund(appointment.getPaymentInfo().getPaymentId(), amount,
                    "Appointment " + appointment.getConfirmationCode() + " cancelled");
        } catch (PaymentGatewayException e) {
            log.error("Refund for appointment {} failed, left for reconciliation: {}", appointment.getId(), e.getMessage());
            return BookingResult.partial(BookingError.REFUND_FAILED,
                    "Appointment cancelled; the refund could not be processed yet", appointment);
        }

        BookingResult recorded = execute("processRefund", appointment.getId(), () -> {
            Appointment locked = appointmentRepository.findByIdForUpdate(appointment.getId()).orElse(null);
            if (locked == null) {
                return notFound(appointment.getId());
            }
            if (!locked.requiresRefund()) {
                return BookingResult.success(locked);
            }
            locked.processRefund(amount, receipt.refundId());
            return BookingResult.success(appointmentRepository.save(locked));
        });
        if (!recorded.isSuccess()) {
            log.error("Refund {} for appointment {} issued but not recorded: {}",
                    receipt.refundId(), appointment.getId(), recorded.error());
            return BookingResult.partial(BookingError.REFUND_FAILED,
                    "Appointment cancelled; the refund is being reconciled", appointment);
        }
        log.info("Refunded {} for appointment {} refundId={}", amount, appointment.getId(), receipt.refundId());
        notificationService.notify(NotificationEvent.REFUND_PROCESSED, appointment.getId(), appointment.getUserId());
        return recorded;
    }

    // =========================================================
    // STATUS TRANSITIONS
    // =========================================================

    public BookingResult confirmAppointment(Long appointmentId, Actor actor) {
        return transition("confirmAppointment", appointmentId, actor, false,
                Appointment::confirm, NotificationEvent.BOOKING_CONFIRMED);
    }

    public BookingResult startAppointment(Long appointmentId, Actor actor) {
        return transition("startAppointment", appointmentId, actor, true,
                Appointment::startConsultation, NotificationEvent.CONSULTATION_STARTED);
    }

    public BookingResult completeAppointment(Long appointmentId, Actor actor) {
        return transition("completeAppointment", appointmentId, actor, true,
                Appointment::complete, NotificationEvent.CONSULTATION_COMPLETED);
    }

    public BookingResult markNoShow(Long appointmentId, Actor actor) {
        return transition("markNoShow", appointmentId, actor, true,
                Appointment::markNoShow, NotificationEvent.NO_SHOW);
    }

    public BookingResult deleteAppointment(Long appointmentId, Actor actor) {
        if (!AppointmentAccessPolicy.canDelete(actor)) {
            return unauthorized(actor, "delete appointment " + appointmentId);
        }
        return execute("deleteAppointment", appointmentId, () -> {
            Appointment appointment = appointmentRepository.findByIdForUpdate(appointmentId).orElse(null);
            if (appointment == null) {
                return notFound(appointmentId);
            }
            appointment.markDeleted();
            Appointment saved = appointmentRepository.save(appointment);
            log.info("Soft-deleted appointment {} by {}", appointmentId, actor.describe());
            return BookingResult.success(saved);
        });
    }

    private BookingResult transition(String operation, Long appointmentId, Actor actor, boolean doctorOnly,
                                     BiConsumer<Appointment, Instant> change, NotificationEvent event) {
        Instant now = clock.instant();
        BookingResult result = execute(operation, appointmentId, () -> {
            Appointment appointment = appointmentRepository.findByIdForUpdate(appointmentId).orElse(null);
            if (appointment == null) {
                return notFound(appointmentId);
            }
            boolean allowed = doctorOnly
                    ? AppointmentAccessPolicy.canManageConsultation(actor, appointment)
                    : AppointmentAccessPolicy.canAccessAppointment(actor, appointment);
            if (!allowed) {
                return unauthorized(actor, operation + " " + appointmentId);
            }
            try {
                change.accept(appointment, now);
            } catch (InvalidStateTransitionException e) {
                log.debug("{} rejected for appointment {}: {}", operation, appointmentId, e.getMessage());
                return BookingResult.failure(BookingError.INVALID_STATE_TRANSITION, e.getMessage());
            }
            Appointment saved = appointmentRepository.save(appointment);
            log.info("{}: appointment {} is now {}", operation, appointmentId, saved.getStatus());
            return BookingResult.success(saved);
        });
        if (result.isSuccess()) {
            notificationService.notifyParticipants(event, result.appointment());
        }
        return result;
    }

    // =========================================================
    // QUERIES
    // =========================================================

    public BookingResult getAppointment(Long appointmentId, Actor actor) {
        return execute("getAppointment", appointmentId, () -> {
            Appointment appointment = appointmentRepository.findById(appointmentId).orElse(null);
            if (appointment == null) {
                return notFound(appointmentId);
            }
            if (!AppointmentAccessPolicy.canAccessAppointment(actor, appointment)) {
                return unauthorized(actor, "view appointment " + appointmentId);
            }
            return BookingResult.success(appointment);
        });
    }

    public List<Appointment> getUserAppointments(Long userId, Appointment.Status status) {
        return status == null
                ? appointmentRepository.findByUserIdOrderByStartTimeDesc(userId)
                : appointmentRepository.findByUserIdAndStatusOrderByStartTimeDesc(userId, status);
    }

    public List<Appointment> getDoctorAppointments(Long doctorId, LocalDate date) {
        return appointmentRepository.findByDoctorIdAndAppointmentDateOrderByStartTimeAsc(doctorId, date);
    }

    /** Appointments still waiting to be seen, in start-time order. */
    public List<Appointment> getAppointmentQueue(Long doctorId, LocalDate date) {
        return appointmentRepository.findByDoctorIdAndAppointmentDateAndStatusInOrderByStartTimeAsc(
                doctorId, date, QUEUE_STATUSES);
    }

    /**
     * Number of queued appointments of the same doctor and day that start earlier; 0 means next in line.
     */
    public OptionalInt getQueuePosition(Long appointmentId) {
        return appointmentRepository.findById(appointmentId)
                .map(a -> OptionalInt.of((int) appointmentRepository.countQueuedBefore(
                        a.getDoctorId(), a.getAppointmentDate(), a.getStartTime(), QUEUE_STATUSES)))
                .orElse(OptionalInt.empty());
    }

    public Optional<Duration> getEstimatedWaitTime(Long appointmentId) {
        Appointment appointment = appointmentRepository.findById(appointmentId).orElse(null);
        if (appointment == null) {
            return Optional.empty();
        }
        long position = appointmentRepository.countQueuedBefore(appointment.getDoctorId(),
                appointment.getAppointmentDate(), appointment.getStartTime(), QUEUE_STATUSES);
        long minutes = doctorRepository.findById(appointment.getDoctorId())
                .map(d -> (long) d.getConsultationDurationMinutes())
                .orElse(appointment.getDuration().toMinutes());
        return Optional.of(Duration.ofMinutes(position * minutes));
    }

    // =========================================================
    // HELPERS
    // =========================================================

    /**
     * Runs {@code work} in a transaction and maps storage failures to typed results.
     */
    private BookingResult execute(String operation, Object id, Supplier<BookingResult> work) {
        long started = System.currentTimeMillis();
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (OptimisticLockingFailureException | PessimisticLockingFailureException e) {
            log.info("{} for {} lost a concurrent update: {}", operation, id, e.getMessage());
            return BookingResult.failure(BookingError.BOOKING_CONFLICT,
                    "The appointment was changed concurrently, please retry");
        } catch (DataIntegrityViolationException e) {
            log.warn("{} for {} violated a constraint: {}", operation, id, e.getMostSpecificCause().getMessage());
            return BookingResult.failure(BookingError.BOOKING_CONFLICT, "The booking conflicts with an existing record");
        } catch (DataAccessException | TransactionException e) {
            log.error("{} failed for {} after {} ms", operation, id, System.currentTimeMillis() - started, e);
            return BookingResult.failure(BookingError.DATABASE_ERROR, RETRY_LATER);
        }
    }

    private static BookingResult notFound(Long appointmentId) {
        return BookingResult.failure(BookingError.APPOINTMENT_NOT_FOUND, "Appointment " + appointmentId + " not found");
    }

    private static BookingResult unauthorized(Actor actor, String action) {
        log.info("Denied: {} may not {}", actor != null ? actor.describe() : "anonymous", action);
        return BookingResult.failure(BookingError.UNAUTHORIZED_ACCESS, "Not allowed to " + action);
    }

    private ZoneId zone() {
        return properties.getZoneId();
    }
}
