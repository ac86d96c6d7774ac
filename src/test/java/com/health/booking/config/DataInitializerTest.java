package com.health.booking.config;

import com.health.booking.repository.ClinicRepository;
import com.health.booking.repository.ClinicWorkingHoursRepository;
import com.health.booking.repository.DoctorRepository;
import com.health.booking.repository.DoctorWorkingHoursRepository;
import com.health.booking.repository.PatientRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(DataInitializer.class)
@TestPropertySource(properties = "booking.seed-data=true")
class DataInitializerTest {

    @Autowired
    private DataInitializer dataInitializer;

    @Autowired
    private DoctorRepository doctorRepository;

    @Autowired
    private DoctorWorkingHoursRepository workingHoursRepository;

    @Autowired
    private ClinicRepository clinicRepository;

    @Autowired
    private ClinicWorkingHoursRepository clinicHoursRepository;

    @Autowired
    private PatientRepository patientRepository;

    @Test
    void seedsOnceAndSkipsWhenDoctorsExist() {
        dataInitializer.seed();
        dataInitializer.seed();

        assertThat(doctorRepository.count()).isEqualTo(3);
        assertThat(workingHoursRepository.count()).isEqualTo(36);
        assertThat(clinicRepository.count()).isEqualTo(1);
        assertThat(clinicHoursRepository.count()).isEqualTo(7);
        assertThat(patientRepository.count()).isEqualTo(1);
    }
}
