package com.health.booking.service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Half-open interval [start, end) on the timeline.
 */
public record TimeWindow(Instant start, Instant end) {

    public TimeWindow {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new IllegalArgumentException("window must have start before end: " + start + " - " + end);
        }
    }

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return start.isBefore(otherEnd) && end.isAfter(otherStart);
    }

    public boolean contains(Instant otherStart, Instant otherEnd) {
        return !otherStart.isBefore(start) && !otherEnd.isAfter(end);
    }

    /** Consecutive slots of the given length; a shorter remainder at the end is dropped. */
    public List<TimeWindow> slice(Duration length) {
        List<TimeWindow> slots = new ArrayList<>();
        for (Instant t = start; !t.plus(length).isAfter(end); t = t.plus(length)) {
            slots.add(new TimeWindow(t, t.plus(length)));
        }
        return slots;
    }

    public static boolean covers(List<TimeWindow> windows, Instant start, Instant end) {
        return windows.stream().anyMatch(w -> w.contains(start, end));
    }

    /** Pairwise intersection of two window lists. */
    public static List<TimeWindow> intersect(List<TimeWindow> a, List<TimeWindow> b) {
        List<TimeWindow> result = new ArrayList<>();
        for (TimeWindow x : a) {
            for (TimeWindow y : b) {
                Instant s = x.start.isAfter(y.start) ? x.start : y.start;
                Instant e = x.end.isBefore(y.end) ? x.end : y.end;
                if (s.isBefore(e)) {
                    result.add(new TimeWindow(s, e));
                }
            }
        }
        result.sort(Comparator.comparing(TimeWindow::start));
        return result;
    }

    /** Removes every busy interval from the windows. */
    public static List<TimeWindow> subtract(List<TimeWindow> windows, List<TimeWindow> busy) {
        List<TimeWindow> remaining = new ArrayList<>(windows);
        for (TimeWindow b : busy) {
            List<TimeWindow> next = new ArrayList<>();
            for (TimeWindow w : remaining) {
                if (!w.overlaps(b.start, b.end)) {
                    next.add(w);
                    continue;
                }
                if (w.start.isBefore(b.start)) {
                    next.add(new TimeWindow(w.start, b.start));
                }
                if (w.end.isAfter(b.end)) {
                    next.add(new TimeWindow(b.end, w.end));
                }
            }
            remaining = next;
        }
        remaining.sort(Comparator.comparing(TimeWindow::start));
        return remaining;
    }
}
