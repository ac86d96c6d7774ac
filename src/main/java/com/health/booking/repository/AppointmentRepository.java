package com.health.booking.repository;

import com.health.booking.entity.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    /**
     * Appointments of a doctor whose [start, end) interval overlaps [start, end).
     * Back-to-back intervals do not overlap.
     */
    @Query("SELECT a FROM Appointment a WHERE a.doctorId = :doctorId"
            + " AND a.status <> :ignored"
            + " AND a.startTime < :end AND a.endTime > :start"
            + " AND a.id <> :excludeId"
            + " ORDER BY a.startTime ASC")
    List<Appointment> findOverlapping(@Param("doctorId") Long doctorId,
                                      @Param("start") Instant start,
                                      @Param("end") Instant end,
                                      @Param("excludeId") Long excludeId,
                                      @Param("ignored") Appointment.Status ignored);

    /**
     * Non-cancelled appointments of the doctor overlapping the requested interval.
     * {@code excludeId} is the appointment being rescheduled, or null.
     */
    default List<Appointment> findConflictingAppointments(Long doctorId, Instant start, Instant end, Long excludeId) {
        // generated ids start at 1
        long exclude = excludeId != null ? excludeId : -1L;
        return findOverlapping(doctorId, start, end, exclude, Appointment.Status.CANCELLED);
    }

    default boolean isTimeSlotAvailable(Long doctorId, Instant start, Instant end) {
        return findConflictingAppointments(doctorId, start, end, null).isEmpty();
    }

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Appointment a WHERE a.id = :id")
    Optional<Appointment> findByIdForUpdate(@Param("id") Long id);

    Optional<Appointment> findByConfirmationCode(String confirmationCode);

    boolean existsByConfirmationCode(String confirmationCode);

    List<Appointment> findByUserIdOrderByStartTimeDesc(Long userId);

    List<Appointment> findByUserIdAndStatusOrderByStartTimeDesc(Long userId, Appointment.Status status);

    List<Appointment> findByDoctorIdAndAppointmentDateOrderByStartTimeAsc(Long doctorId, LocalDate appointmentDate);

    List<Appointment> findByDoctorIdAndAppointmentDateAndStatusInOrderByStartTimeAsc(
            Long doctorId,
            LocalDate appointmentDate,
            Collection<Appointment.Status> statuses
    );

    @Query("SELECT COUNT(a) FROM Appointment a WHERE a.doctorId = :doctorId"
            + " AND a.appointmentDate = :date"
            + " AND a.startTime < :before"
            + " AND a.status IN :statuses")
    long countQueuedBefore(@Param("doctorId") Long doctorId,
                           @Param("date") LocalDate date,
                           @Param("before") Instant before,
                           @Param("statuses") Collection<Appointment.Status> statuses);

    long countByUserIdAndStatusInAndStartTimeAfter(Long userId,
                                                   Collection<Appointment.Status> statuses,
                                                   Instant after);
}
