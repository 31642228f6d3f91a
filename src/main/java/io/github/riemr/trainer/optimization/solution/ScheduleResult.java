package io.github.riemr.trainer.optimization.solution;

import io.github.riemr.trainer.domain.model.BookingRequestStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one placement run. Advisory only: nothing here has been applied to the requests.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleResult {
    private Long trainerId;
    @Builder.Default
    private List<ProposedScheduleEntry> proposedEntries = new ArrayList<>();
    @Builder.Default
    private List<RejectedEntry> rejectedEntries = new ArrayList<>();
    private ScheduleStatistics statistics;
    private String message;

    /**
     * Status each considered request should move to if the caller accepts this schedule.
     * Iteration order: accepted entries first (by start), then rejected ones (processing order).
     */
    public Map<Long, BookingRequestStatus> statusTransitions() {
        Map<Long, BookingRequestStatus> res = new LinkedHashMap<>();
        for (var e : proposedEntries) res.put(e.getBookingRequestId(), BookingRequestStatus.APPROVED);
        for (var e : rejectedEntries) res.put(e.getBookingRequestId(), BookingRequestStatus.REJECTED);
        return res;
    }
}
