package com.health.booking.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Business constants of the booking engine, read from the {@code booking.*} keys.
 */
@Getter
@Component
public class BookingProperties {

    private final ZoneId zoneId;
    private final Duration minimumSlotDuration;
    private final Duration rescheduleNotice;
    private final Duration advanceBookingWindow;
    private final int maxActiveBookingsPerUser;
    private final Duration followUpWindow;
    private final String defaultCurrency;
    private final String videoCallBaseUrl;

    public BookingProperties(@Value("${booking.zone-id:UTC}") String zoneId,
                             @Value("${booking.minimum-slot-minutes:15}") long minimumSlotMinutes,
                             @Value("${booking.reschedule-notice-minutes:120}") long rescheduleNoticeMinutes,
                             @Value("${booking.advance-booking-days:90}") long advanceBookingDays,
                             @Value("${booking.max-active-bookings-per-user:5}") int maxActiveBookingsPerUser,
                             @Value("${booking.follow-up-window-days:30}") long followUpWindowDays,
                             @Value("${booking.default-currency:INR}") String defaultCurrency,
                             @Value("${booking.video-call-base-url:https://meet.healthcare.example/room/}") String videoCallBaseUrl) {
        this.zoneId = ZoneId.of(zoneId);
        this.minimumSlotDuration = Duration.ofMinutes(minimumSlotMinutes);
        this.rescheduleNotice = Duration.ofMinutes(rescheduleNoticeMinutes);
        this.advanceBookingWindow = Duration.ofDays(advanceBookingDays);
        this.maxActiveBookingsPerUser = maxActiveBookingsPerUser;
        this.followUpWindow = Duration.ofDays(followUpWindowDays);
        this.defaultCurrency = defaultCurrency;
        this.videoCallBaseUrl = videoCallBaseUrl;
    }

    public boolean isChargeable(BigDecimal fee) {
        return fee != null && fee.signum() > 0;
    }
}
