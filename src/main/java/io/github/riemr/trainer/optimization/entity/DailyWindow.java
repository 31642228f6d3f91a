package io.github.riemr.trainer.optimization.entity;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Time-of-day window taken from a client's preferred/avoided time list.
 * "HH:mm" is a point ({@code to == null}), "HH:mm-HH:mm" a range.
 */
public record DailyWindow(LocalTime from, LocalTime to) {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("H:mm");

    public static Optional<DailyWindow> parse(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        try {
            String[] parts = text.split("-");
            if (parts.length == 1) {
                return Optional.of(new DailyWindow(LocalTime.parse(parts[0].trim(), HH_MM), null));
            }
            if (parts.length == 2) {
                LocalTime from = LocalTime.parse(parts[0].trim(), HH_MM);
                LocalTime to = LocalTime.parse(parts[1].trim(), HH_MM);
                if (!to.isAfter(from)) return Optional.empty();
                return Optional.of(new DailyWindow(from, to));
            }
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    public boolean isPoint() {
        return to == null;
    }

    /** Concrete window on the given day, a point widened by {@code minutes}. */
    public TimeRange on(LocalDate date, long minutes) {
        LocalDateTime start = date.atTime(from);
        return isPoint() ? TimeRange.ofMinutes(start, minutes) : new TimeRange(start, date.atTime(to));
    }

    /**
     * Whether a session touches this window on its own day.
     * A point matches when the session is running at that instant.
     */
    public boolean touches(TimeRange session) {
        LocalDate day = session.date();
        LocalDateTime f = day.atTime(from);
        if (isPoint()) {
            return !f.isBefore(session.start()) && f.isBefore(session.end());
        }
        return session.overlaps(new TimeRange(f, day.atTime(to)));
    }
}
