package io.github.riemr.trainer.optimization.entity;

import java.util.Objects;

/**
 * Occupied trainer time: a confirmed booking supplied by the caller, or a request
 * accepted earlier in the same placement run.
 */
public record CommittedInterval(Long trainerId, TimeRange range, Long requestId, Source source) {

    public enum Source {
        EXISTING_BOOKING,
        ACCEPTED_REQUEST
    }

    public CommittedInterval {
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(source, "source");
    }

    public static CommittedInterval existing(Long trainerId, TimeRange range, Long bookingId) {
        return new CommittedInterval(trainerId, range, bookingId, Source.EXISTING_BOOKING);
    }

    public static CommittedInterval accepted(Long trainerId, TimeRange range, Long requestId) {
        return new CommittedInterval(trainerId, range, requestId, Source.ACCEPTED_REQUEST);
    }
}
