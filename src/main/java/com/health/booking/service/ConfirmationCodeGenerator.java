package com.health.booking.service;

import com.health.booking.repository.AppointmentRepository;
import org.apache.commons.lang3.RandomStringUtils;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Human-shareable booking codes ("APT" + 6 digits) and meeting ids for online consultations.
 */
@Component
public class ConfirmationCodeGenerator {

    private static final String PREFIX = "APT";
    private static final int MAX_ATTEMPTS = 10;

    private final AppointmentRepository appointmentRepository;

    public ConfirmationCodeGenerator(AppointmentRepository appointmentRepository) {
        this.appointmentRepository = appointmentRepository;
    }

    public String nextConfirmationCode() {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String code = PREFIX + RandomStringUtils.randomNumeric(6);
            if (!appointmentRepository.existsByConfirmationCode(code)) {
                return code;
            }
        }
        throw new IllegalStateException("Could not generate a unique confirmation code after " + MAX_ATTEMPTS + " attempts");
    }

    public String nextMeetingId() {
        return RandomStringUtils.randomAlphanumeric(10).toLowerCase(Locale.ROOT);
    }
}
