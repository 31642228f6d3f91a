package io.github.riemr.trainer.presentation.form;

import io.github.riemr.trainer.domain.model.BookingRequest;
import io.github.riemr.trainer.domain.model.BookingRequestStatus;
import io.github.riemr.trainer.optimization.entity.CapacitySlot;
import io.github.riemr.trainer.optimization.entity.CommittedInterval;
import io.github.riemr.trainer.optimization.entity.TimeRange;
import io.github.riemr.trainer.optimization.solution.ScheduleProblem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * JSON body of {@code POST /api/trainers/{trainerId}/optimal-schedule}.
 */
@Data
public class OptimalScheduleForm {

    private LocalDate startDate;
    private LocalDate endDate;

    @Min(value = 1, message = "maxEntries must be between 1 and 100")
    @Max(value = 100, message = "maxEntries must be between 1 and 100")
    private Integer maxEntries;

    // 未指定ならサーバ側の既定値
    @Valid
    private SchedulingPreferencesForm preferences;

    @Valid
    private List<BookingRequestRow> requests = new ArrayList<>();
    @Valid
    private List<ExistingBookingRow> existingBookings = new ArrayList<>();
    @Valid
    private List<CapacitySlotRow> capacitySlots = new ArrayList<>();

    @Data
    public static class BookingRequestRow {
        @NotNull(message = "request id is required")
        private Long id;
        private Long clientId;
        private String clientName;
        private String sessionType;
        private String trainingType;

        @NotNull(message = "durationMinutes is required")
        @Min(value = 1, message = "durationMinutes must be positive")
        private Integer durationMinutes;

        private LocalDateTime startTime;
        private LocalDateTime endTime;
        private LocalDate preferredStartDate;
        private LocalDate preferredEndDate;
        private List<String> preferredTimes = new ArrayList<>(); // "HH:mm" or "HH:mm-HH:mm"
        private List<String> avoidTimes = new ArrayList<>();
        private boolean allowWeekends = true;
        private boolean allowEvenings = true;

        private boolean recurring;
        private String recurringPattern;
        private String location;
        private String locationType;
        private String specialRequests;
        private Double priorityScore;
        private String status = "pending";

        public BookingRequest toEntity(Long trainerId) {
            BookingRequestStatus st = status == null ? BookingRequestStatus.PENDING : BookingRequestStatus.fromCode(status);
            if (st == null) throw new IllegalArgumentException("Unknown status '" + status + "' on request " + id);
            return BookingRequest.builder()
                    .id(id)
                    .clientId(clientId)
                    .clientName(clientName)
                    .trainerId(trainerId)
                    .sessionType(sessionType)
                    .trainingType(trainingType)
                    .durationMinutes(durationMinutes)
                    .startTime(startTime)
                    .endTime(endTime)
                    .preferredStartDate(preferredStartDate)
                    .preferredEndDate(preferredEndDate)
                    .preferredTimes(preferredTimes == null ? new ArrayList<>() : new ArrayList<>(preferredTimes))
                    .avoidTimes(avoidTimes == null ? new ArrayList<>() : new ArrayList<>(avoidTimes))
                    .allowWeekends(allowWeekends)
                    .allowEvenings(allowEvenings)
                    .recurring(recurring)
                    .recurringPattern(recurringPattern)
                    .location(location)
                    .locationType(locationType)
                    .specialRequests(specialRequests)
                    .priorityScore(priorityScore)
                    .status(st)
                    .build();
        }
    }

    @Data
    public static class ExistingBookingRow {
        private Long id;
        @NotNull(message = "booking startTime is required")
        private LocalDateTime startTime;
        @NotNull(message = "booking endTime is required")
        private LocalDateTime endTime;

        public CommittedInterval toEntity(Long trainerId) {
            return CommittedInterval.existing(trainerId, new TimeRange(startTime, endTime), id);
        }
    }

    @Data
    public static class CapacitySlotRow {
        @NotBlank(message = "slot id is required")
        private String id;
        @NotNull(message = "slot startTime is required")
        private LocalDateTime startTime;
        @NotNull(message = "slot endTime is required")
        private LocalDateTime endTime;

        public CapacitySlot toEntity() {
            return new CapacitySlot(id, new TimeRange(startTime, endTime));
        }
    }

    public ScheduleProblem toProblem(Long trainerId) {
        return ScheduleProblem.builder()
                .trainerId(trainerId)
                .fromDate(startDate)
                .toDate(endDate)
                .maxEntries(maxEntries)
                .preferences(preferences == null ? null : preferences.toEntity(trainerId))
                .requests(map(requests, r -> r.toEntity(trainerId)))
                .existingBookings(map(existingBookings, b -> b.toEntity(trainerId)))
                .capacitySlots(map(capacitySlots, CapacitySlotRow::toEntity))
                .build();
    }

    private static <S, T> List<T> map(List<S> rows, Function<S, T> f) {
        List<T> res = new ArrayList<>();
        if (rows == null) return res;
        for (S row : rows) {
            if (row != null) res.add(f.apply(row));
        }
        return res;
    }
}
