package com.health.booking.service;

import com.health.booking.entity.ClinicWorkingHours;
import com.health.booking.entity.DoctorWorkingHours;
import com.health.booking.repository.ClinicWorkingHoursRepository;
import com.health.booking.repository.DoctorWorkingHoursRepository;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;

/**
 * Weekly working hours of doctors and opening hours of clinics.
 */
@Service
public class ScheduleService {

    // Default 8h/day: 9-13 and 14-18 (two 4-hour blocks), Mon-Sat
    private static final LocalTime BLOCK1_START = LocalTime.of(9, 0);
    private static final LocalTime BLOCK1_END = LocalTime.of(13, 0);
    private static final LocalTime BLOCK2_START = LocalTime.of(14, 0);
    private static final LocalTime BLOCK2_END = LocalTime.of(18, 0);

    private final DoctorWorkingHoursRepository doctorHoursRepository;
    private final ClinicWorkingHoursRepository clinicHoursRepository;

    public ScheduleService(DoctorWorkingHoursRepository doctorHoursRepository,
                           ClinicWorkingHoursRepository clinicHoursRepository) {
        this.doctorHoursRepository = doctorHoursRepository;
        this.clinicHoursRepository = clinicHoursRepository;
    }

    public boolean hasConfiguredHours(Long doctorId) {
        return !doctorHoursRepository.findByDoctorIdOrderByDayOfWeekAscStartTimeAsc(doctorId).isEmpty();
    }

    /**
     * Configured hours of the doctor; without any, Mon-Sat 9-13 and 14-18.
     */
    public WeeklyHours doctorHours(Long doctorId) {
        List<DoctorWorkingHours> rows = doctorHoursRepository.findByDoctorIdOrderByDayOfWeekAscStartTimeAsc(doctorId);
        WeeklyHours.Builder builder = WeeklyHours.builder();
        if (!rows.isEmpty()) {
            rows.forEach(w -> builder.add(DayOfWeek.of(w.getDayOfWeek()), w.getStartTime(), w.getEndTime()));
            return builder.build();
        }
        for (DayOfWeek day : DayOfWeek.values()) {
            if (day != DayOfWeek.SUNDAY) {
                builder.add(day, BLOCK1_START, BLOCK1_END);
                builder.add(day, BLOCK2_START, BLOCK2_END);
            }
        }
        return builder.build();
    }

    /**
     * Opening hours of the clinic with breaks cut out. Days without a row are closed.
     */
    public WeeklyHours clinicHours(Long clinicId) {
        WeeklyHours.Builder builder = WeeklyHours.builder();
        for (ClinicWorkingHours row : clinicHoursRepository.findByClinicIdOrderByDayOfWeekAsc(clinicId)) {
            if (row.isClosed() || row.getOpenTime() == null || row.getCloseTime() == null) {
                continue;
            }
            DayOfWeek day = DayOfWeek.of(row.getDayOfWeek());
            if (row.hasBreak()) {
                builder.add(day, row.getOpenTime(), row.getBreakStart());
                builder.add(day, row.getBreakEnd(), row.getCloseTime());
            } else {
                builder.add(day, row.getOpenTime(), row.getCloseTime());
            }
        }
        return builder.build();
    }
}
