package io.github.riemr.trainer.domain.model;

import java.time.LocalTime;

/**
 * 時間帯区分。[from, to) で判定する。
 */
public enum TimeBlock {
    MORNING(LocalTime.of(6, 0), LocalTime.of(12, 0)),
    AFTERNOON(LocalTime.of(12, 0), LocalTime.of(17, 0)),
    EVENING(LocalTime.of(17, 0), LocalTime.of(22, 0));

    private final LocalTime from;
    private final LocalTime to;

    TimeBlock(LocalTime from, LocalTime to) {
        this.from = from;
        this.to = to;
    }

    public LocalTime getFrom() { return from; }
    public LocalTime getTo() { return to; }

    public boolean contains(LocalTime t) {
        return !t.isBefore(from) && t.isBefore(to);
    }

    /** True when the [start, end) time-of-day range touches this block. */
    public boolean overlaps(LocalTime start, LocalTime end) {
        return start.isBefore(to) && from.isBefore(end);
    }

    public static TimeBlock fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        try {
            return TimeBlock.valueOf(code.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
