package com.health.booking.config;

import com.health.booking.entity.Appointment;
import com.health.booking.entity.Clinic;
import com.health.booking.entity.ClinicWorkingHours;
import com.health.booking.entity.Doctor;
import com.health.booking.entity.DoctorWorkingHours;
import com.health.booking.entity.Patient;
import com.health.booking.repository.ClinicRepository;
import com.health.booking.repository.ClinicWorkingHoursRepository;
import com.health.booking.repository.DoctorRepository;
import com.health.booking.repository.DoctorWorkingHoursRepository;
import com.health.booking.repository.PatientRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.List;

/**
 * Idempotent demo seeder: inserts a clinic, doctors with working hours and a patient
 * when the doctor table is empty. Enabled with {@code booking.seed-data=true}.
 */
@Component
@ConditionalOnProperty(name = "booking.seed-data", havingValue = "true")
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final DoctorRepository doctorRepository;
    private final DoctorWorkingHoursRepository workingHoursRepository;
    private final ClinicRepository clinicRepository;
    private final ClinicWorkingHoursRepository clinicHoursRepository;
    private final PatientRepository patientRepository;

    public DataInitializer(DoctorRepository doctorRepository,
                           DoctorWorkingHoursRepository workingHoursRepository,
                           ClinicRepository clinicRepository,
                           ClinicWorkingHoursRepository clinicHoursRepository,
                           PatientRepository patientRepository) {
        this.doctorRepository = doctorRepository;
        this.workingHoursRepository = workingHoursRepository;
        this.clinicRepository = clinicRepository;
        this.clinicHoursRepository = clinicHoursRepository;
        this.patientRepository = patientRepository;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void seed() {
        if (doctorRepository.count() > 0) {
            log.info("Doctors already seeded, skipping");
            return;
        }

        Clinic clinic = clinicRepository.save(Clinic.builder()
                .name("City Care Clinic")
                .city("Bengaluru")
                .status(Clinic.Status.ACTIVE)
                .emergencyServices(true)
                .build());
        for (int day = 1; day <= 6; day++) {
            clinicHoursRepository.save(ClinicWorkingHours.builder()
                    .clinicId(clinic.getId())
                    .dayOfWeek(day)
                    .openTime(LocalTime.of(9, 0))
                    .closeTime(LocalTime.of(18, 0))
                    .breakStart(LocalTime.of(13, 0))
                    .breakEnd(LocalTime.of(14, 0))
                    .build());
        }
        clinicHoursRepository.save(ClinicWorkingHours.builder().clinicId(clinic.getId()).dayOfWeek(7).closed(true).build());

        List<Doctor> doctors = List.of(
                doctorRepository.save(doctor("Dr. Sarah Johnson", "General Practice", clinic.getId(), 30, "500",
                        EnumSet.of(Appointment.Type.ONLINE, Appointment.Type.OFFLINE), true)),
                doctorRepository.save(doctor("Dr. Michael Chen", "Cardiology", clinic.getId(), 45, "1200",
                        EnumSet.of(Appointment.Type.OFFLINE), false)),
                doctorRepository.save(doctor("Dr. Emily Davis", "Pediatrics", null, 20, "400",
                        EnumSet.of(Appointment.Type.ONLINE), true))
        );

        for (Doctor d : doctors) {
            for (int day = 1; day <= 6; day++) {
                workingHoursRepository.save(DoctorWorkingHours.builder().doctorId(d.getId()).dayOfWeek(day).startTime(LocalTime.of(9, 0)).endTime(LocalTime.of(13, 0)).build());
                workingHoursRepository.save(DoctorWorkingHours.builder().doctorId(d.getId()).dayOfWeek(day).startTime(LocalTime.of(14, 0)).endTime(LocalTime.of(18, 0)).build());
            }
            log.info("Added working hours for {}", d.getName());
        }

        patientRepository.save(Patient.builder().name("Demo Patient").phone("+910000000000").email("demo@healthcare.example").build());
        log.info("DataInitializer: clinic={}, doctors={}", clinic.getName(), doctors.size());
    }

    private static Doctor doctor(String name, String specialization, Long clinicId, int durationMinutes,
                                 String fee, EnumSet<Appointment.Type> types, boolean emergency) {
        return Doctor.builder()
                .name(name)
                .specialization(specialization)
                .city("Bengaluru")
                .clinicId(clinicId)
                .status(Doctor.Status.VERIFIED)
                .consultationDurationMinutes(durationMinutes)
                .consultationFee(new BigDecimal(fee))
                .consultationTypes(types)
                .emergencyAvailable(emergency)
                .build();
    }
}
