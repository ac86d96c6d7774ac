package com.health.booking.service;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Recurring weekly opening blocks in local time, resolved to instants per date.
 */
public final class WeeklyHours {

    private final Map<DayOfWeek, List<LocalTime[]>> blocks;

    private WeeklyHours(Map<DayOfWeek, List<LocalTime[]>> blocks) {
        this.blocks = blocks;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<TimeWindow> windowsOn(LocalDate date, ZoneId zone) {
        List<LocalTime[]> day = blocks.getOrDefault(date.getDayOfWeek(), Collections.emptyList());
        List<TimeWindow> windows = new ArrayList<>(day.size());
        for (LocalTime[] block : day) {
            Instant start = date.atTime(block[0]).atZone(zone).toInstant();
            Instant end = date.atTime(block[1]).atZone(zone).toInstant();
            if (start.isBefore(end)) {
                windows.add(new TimeWindow(start, end));
            }
        }
        return windows;
    }

    /** True when [start, end) lies inside one block of the day that {@code start} falls on. */
    public boolean covers(Instant start, Instant end, ZoneId zone) {
        LocalDate date = start.atZone(zone).toLocalDate();
        return TimeWindow.covers(windowsOn(date, zone), start, end);
    }

    public static final class Builder {

        private final Map<DayOfWeek, List<LocalTime[]>> blocks = new EnumMap<>(DayOfWeek.class);

        public Builder add(DayOfWeek day, LocalTime start, LocalTime end) {
            if (start != null && end != null && start.isBefore(end)) {
                blocks.computeIfAbsent(day, d -> new ArrayList<>()).add(new LocalTime[]{start, end});
            }
            return this;
        }

        public WeeklyHours build() {
            blocks.values().forEach(list -> list.sort((a, b) -> a[0].compareTo(b[0])));
            return new WeeklyHours(blocks);
        }
    }
}
