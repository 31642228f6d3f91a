package io.github.riemr.trainer.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A client's ask for time with a trainer.
 * <p>
 * Either a fixed {@code startTime} (optionally with {@code endTime}) or a list of
 * {@code preferredTimes} ("HH:mm" or "HH:mm-HH:mm") over the preferred date range.
 * The engine only reads this object; status transitions are applied by the caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingRequest {
    private Long id;
    private Long clientId;
    private String clientName;
    private Long trainerId;

    private String sessionType;
    private String trainingType;
    private Integer durationMinutes;

    private LocalDateTime startTime;
    private LocalDateTime endTime;

    // 日付レンジ（柔軟リクエストの候補日）
    private LocalDate preferredStartDate;
    private LocalDate preferredEndDate;
    @Builder.Default
    private List<String> preferredTimes = new ArrayList<>();
    @Builder.Default
    private List<String> avoidTimes = new ArrayList<>();
    @Builder.Default
    private boolean allowWeekends = true;
    @Builder.Default
    private boolean allowEvenings = true;

    private boolean recurring;
    private String recurringPattern; // weekly / biweekly / monthly

    private String location;
    private String locationType; // home / gym / ...
    private String specialRequests;

    private Double priorityScore;

    @Builder.Default
    private BookingRequestStatus status = BookingRequestStatus.PENDING;

    public boolean hasFixedTime() {
        return startTime != null;
    }

    /** End of the fixed window; derived from the duration when only a start is given. */
    public LocalDateTime resolvedEndTime() {
        if (startTime == null) return null;
        if (endTime != null) return endTime;
        return durationMinutes == null ? null : startTime.plusMinutes(durationMinutes);
    }

    /** Earliest moment this request asks for, used as a ranking tie-break. */
    public LocalDateTime requestedStart() {
        if (startTime != null) return startTime;
        return preferredStartDate == null ? null : preferredStartDate.atStartOfDay();
    }
}
