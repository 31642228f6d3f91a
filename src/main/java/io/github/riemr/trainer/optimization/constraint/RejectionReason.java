package io.github.riemr.trainer.optimization.constraint;

import io.github.riemr.trainer.optimization.entity.CommittedInterval;
import io.github.riemr.trainer.optimization.entity.DailyWindow;
import io.github.riemr.trainer.optimization.entity.TimeRange;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A rejection kind plus the structured values rendered into its message.
 * Callers match on {@link #kind()}; {@link #message()} is for people.
 */
public record RejectionReason(RejectionKind kind, Map<String, Object> parameters, String message) {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    public static RejectionReason noTimeSpecified() {
        return new RejectionReason(RejectionKind.NO_TIME_SPECIFIED, Map.of(),
                RejectionKind.NO_TIME_SPECIFIED.getTemplate());
    }

    public static RejectionReason noPreferredDate() {
        return new RejectionReason(RejectionKind.NO_PREFERRED_DATE, Map.of(),
                RejectionKind.NO_PREFERRED_DATE.getTemplate());
    }

    /** The client's window cannot hold even one session of the requested length. */
    public static RejectionReason windowTooShort(DailyWindow window, long durationMinutes) {
        String text = HH_MM.format(window.from()) + "-" + HH_MM.format(window.to());
        return of(RejectionKind.WINDOW_TOO_SHORT,
                params("windowStart", window.from(), "windowEnd", window.to(), "durationMinutes", durationMinutes),
                text, durationMinutes);
    }

    public static RejectionReason noAcceptableTime() {
        return new RejectionReason(RejectionKind.NO_ACCEPTABLE_TIME, Map.of(),
                RejectionKind.NO_ACCEPTABLE_TIME.getTemplate());
    }

    public static RejectionReason dayOff(DayOfWeek day) {
        String name = day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
        return of(RejectionKind.DAY_OFF, params("dayOfWeek", day), name);
    }

    public static RejectionReason outsideWorkHours(LocalTime requested, LocalTime workStart, LocalTime workEnd) {
        return of(RejectionKind.OUTSIDE_WORK_HOURS,
                params("requestedTime", requested, "workStart", workStart, "workEnd", workEnd),
                HH_MM.format(requested), HH_MM.format(workStart), HH_MM.format(workEnd));
    }

    public static RejectionReason dailyLimit(int maxSessions, LocalDate date) {
        return of(RejectionKind.DAILY_LIMIT, params("maxSessionsPerDay", maxSessions, "date", date),
                maxSessions, date);
    }

    /** Wording depends on whether the blocking interval was booked before the run or accepted in it. */
    public static RejectionReason conflict(CommittedInterval blocking) {
        RejectionKind kind = blocking.source() == CommittedInterval.Source.EXISTING_BOOKING
                ? RejectionKind.CONFLICT_EXISTING_BOOKING
                : RejectionKind.CONFLICT_APPROVED_REQUEST;
        TimeRange r = blocking.range();
        return of(kind, params("start", r.start(), "end", r.end(), "blockingRequestId", blocking.requestId()),
                HH_MM.format(r.start()), HH_MM.format(r.end()));
    }

    public static RejectionReason breakBefore(int minBreakMinutes, CommittedInterval previous) {
        return of(RejectionKind.BREAK_BEFORE,
                params("minBreakMinutes", minBreakMinutes, "neighborEnd", previous.range().end(),
                        "blockingRequestId", previous.requestId()),
                minBreakMinutes, HH_MM.format(previous.range().end()));
    }

    public static RejectionReason breakAfter(int minBreakMinutes, CommittedInterval next) {
        return of(RejectionKind.BREAK_AFTER,
                params("minBreakMinutes", minBreakMinutes, "neighborStart", next.range().start(),
                        "blockingRequestId", next.requestId()),
                minBreakMinutes, HH_MM.format(next.range().start()));
    }

    public static RejectionReason noAvailableSlot(TimeRange unit) {
        return of(RejectionKind.NO_AVAILABLE_SLOT, params("start", unit.start(), "end", unit.end()),
                HH_MM.format(unit.start()), HH_MM.format(unit.end()));
    }

    public static RejectionReason resultLimitReached(int maxEntries) {
        return of(RejectionKind.RESULT_LIMIT_REACHED, params("maxEntries", maxEntries), maxEntries);
    }

    private static RejectionReason of(RejectionKind kind, Map<String, Object> parameters, Object... args) {
        return new RejectionReason(kind, parameters, String.format(Locale.ROOT, kind.getTemplate(), args));
    }

    // Map.of は null 値を受け付けないため LinkedHashMap で組み立てる
    private static Map<String, Object> params(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return Collections.unmodifiableMap(m);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
