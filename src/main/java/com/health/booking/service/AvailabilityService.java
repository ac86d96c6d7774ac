package com.health.booking.service;

import com.health.booking.config.BookingProperties;
import com.health.booking.dto.AvailabilitySlot;
import com.health.booking.entity.Appointment;
import com.health.booking.entity.Clinic;
import com.health.booking.entity.Doctor;
import com.health.booking.repository.AppointmentRepository;
import com.health.booking.repository.ClinicRepository;
import com.health.booking.repository.DoctorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Free consultation slots of a doctor, computed from working hours minus booked appointments.
 * Nothing is stored; the appointment table is the only source of truth.
 */
@Service
public class AvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);

    private final DoctorRepository doctorRepository;
    private final ClinicRepository clinicRepository;
    private final AppointmentRepository appointmentRepository;
    private final ScheduleService scheduleService;
    private final BookingProperties properties;
    private final Clock clock;

    public AvailabilityService(DoctorRepository doctorRepository,
                               ClinicRepository clinicRepository,
                               AppointmentRepository appointmentRepository,
                               ScheduleService scheduleService,
                               BookingProperties properties,
                               Clock clock) {
        this.doctorRepository = doctorRepository;
        this.clinicRepository = clinicRepository;
        this.appointmentRepository = appointmentRepository;
        this.scheduleService = scheduleService;
        this.properties = properties;
        this.clock = clock;
    }

    public Optional<Doctor> findDoctor(Long doctorId) {
        return doctorRepository.findById(doctorId);
    }

    /**
     * Slots between the two dates (inclusive) in the booking zone. Booked intervals are read once;
     * slots are generated day by day as the stream is consumed. A null type ignores clinic hours.
     */
    public Stream<AvailabilitySlot> getDoctorAvailability(Long doctorId, LocalDate from, LocalDate to, Appointment.Type type) {
        return findDoctor(doctorId)
                .map(doctor -> getDoctorAvailability(doctor, from, to, type))
                .orElseGet(Stream::empty);
    }

    public Stream<AvailabilitySlot> getDoctorAvailability(Doctor doctor, LocalDate from, LocalDate to, Appointment.Type type) {
        if (from == null || to == null || to.isBefore(from)) {
            return Stream.empty();
        }
        if (!doctor.isVerified() || !doctor.isAcceptingBookings()) {
            log.debug("Doctor {} is not bookable ({})", doctor.getId(), doctor.getStatus());
            return Stream.empty();
        }
        if (type != null && !doctor.supports(type)) {
            return Stream.empty();
        }
        Duration slotLength = Duration.ofMinutes(doctor.getConsultationDurationMinutes());
        if (slotLength.compareTo(properties.getMinimumSlotDuration()) < 0) {
            return Stream.empty();
        }

        ZoneId zone = properties.getZoneId();
        Instant now = clock.instant();
        Instant horizon = now.plus(properties.getAdvanceBookingWindow());

        Long clinicId = type == Appointment.Type.OFFLINE ? doctor.getClinicId() : null;
        WeeklyHours clinicHours = null;
        if (clinicId != null) {
            Clinic clinic = clinicRepository.findById(clinicId).orElse(null);
            if (clinic == null || !clinic.isOperational()) {
                return Stream.empty();
            }
            clinicHours = scheduleService.clinicHours(clinicId);
        }
        WeeklyHours doctorHours = scheduleService.doctorHours(doctor.getId());

        Instant rangeStart = from.atStartOfDay(zone).toInstant();
        Instant rangeEnd = to.plusDays(1).atStartOfDay(zone).toInstant();
        List<TimeWindow> busy = appointmentRepository
                .findConflictingAppointments(doctor.getId(), rangeStart, rangeEnd, null)
                .stream()
                .map(a -> new TimeWindow(a.getStartTime(), a.getEndTime()))
                .collect(Collectors.toList());

        WeeklyHours clinicFilter = clinicHours;
        return from.datesUntil(to.plusDays(1))
                .flatMap(date -> {
                    List<TimeWindow> open = doctorHours.windowsOn(date, zone);
                    if (clinicFilter != null) {
                        open = TimeWindow.intersect(open, clinicFilter.windowsOn(date, zone));
                    }
                    return TimeWindow.subtract(open, busy).stream();
                })
                .flatMap(window -> window.slice(slotLength).stream())
                .filter(slot -> slot.start().isAfter(now) && !slot.start().isAfter(horizon))
                .map(slot -> new AvailabilitySlot(slot.start(), slot.end(), doctor.getConsultationFee(),
                        doctor.getId(), clinicId));
    }

    /**
     * The earliest {@code count} free slots within the advance-booking window.
     */
    public List<AvailabilitySlot> getNextAvailableSlots(Long doctorId, int count) {
        if (count <= 0) {
            return List.of();
        }
        LocalDate today = clock.instant().atZone(properties.getZoneId()).toLocalDate();
        LocalDate last = clock.instant().plus(properties.getAdvanceBookingWindow())
                .atZone(properties.getZoneId()).toLocalDate();
        try (Stream<AvailabilitySlot> slots = getDoctorAvailability(doctorId, today, last, null)) {
            return slots.limit(count).collect(Collectors.toList());
        }
    }

    public boolean isTimeSlotAvailable(Long doctorId, Instant start, Instant end) {
        return appointmentRepository.isTimeSlotAvailable(doctorId, start, end);
    }
}
