package io.github.riemr.trainer.optimization.entity;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Half-open interval {@code [start, end)}. Both ends are wall-clock times already
 * normalized to the trainer's zone by the caller.
 */
public record TimeRange(LocalDateTime start, LocalDateTime end) implements Comparable<TimeRange> {

    public TimeRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("end must be after start: " + start + " - " + end);
        }
    }

    public static TimeRange ofMinutes(LocalDateTime start, long minutes) {
        return new TimeRange(start, start.plusMinutes(minutes));
    }

    public static boolean overlaps(TimeRange a, TimeRange b) {
        return a.start.isBefore(b.end) && b.start.isBefore(a.end);
    }

    /**
     * Minutes from the earlier range's end to the later range's start.
     * Negative when the two ranges overlap.
     */
    public static long gapMinutes(TimeRange a, TimeRange b) {
        TimeRange first = a.start.isAfter(b.start) ? b : a;
        TimeRange second = first == a ? b : a;
        return Duration.between(first.end, second.start).toMinutes();
    }

    public static boolean withinWindow(TimeRange range, LocalTime windowStart, LocalTime windowEnd) {
        if (!range.start.toLocalDate().equals(range.end.toLocalDate())) return false;
        return !range.start.toLocalTime().isBefore(windowStart)
                && !range.end.toLocalTime().isAfter(windowEnd);
    }

    public boolean overlaps(TimeRange other) {
        return overlaps(this, other);
    }

    public long durationMinutes() {
        return Duration.between(start, end).toMinutes();
    }

    public LocalDate date() {
        return start.toLocalDate();
    }

    @Override
    public int compareTo(TimeRange other) {
        int c = start.compareTo(other.start);
        return c != 0 ? c : end.compareTo(other.end);
    }

    @Override
    public String toString() {
        return start + " - " + end;
    }
}
