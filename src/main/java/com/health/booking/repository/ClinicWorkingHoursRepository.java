package com.health.booking.repository;

import com.health.booking.entity.ClinicWorkingHours;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ClinicWorkingHoursRepository extends JpaRepository<ClinicWorkingHours, Long> {
    List<ClinicWorkingHours> findByClinicIdOrderByDayOfWeekAsc(Long clinicId);
}
