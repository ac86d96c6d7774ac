package com.health.booking.repository;

import com.health.booking.entity.Doctor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

public interface DoctorRepository extends JpaRepository<Doctor, Long> {

    /**
     * Locks the doctor row so that conflict check and insert for this doctor run one at a time.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Doctor d WHERE d.id = :id")
    Optional<Doctor> findByIdForUpdate(@Param("id") Long id);

    List<Doctor> findByCityIgnoreCaseAndEmergencyAvailableTrueAndAcceptingBookingsTrueAndStatusOrderByIdAsc(
            String city,
            Doctor.Status status
    );

    default List<Doctor> findEmergencyDoctors(String city) {
        return findByCityIgnoreCaseAndEmergencyAvailableTrueAndAcceptingBookingsTrueAndStatusOrderByIdAsc(
                city, Doctor.Status.VERIFIED);
    }
}
