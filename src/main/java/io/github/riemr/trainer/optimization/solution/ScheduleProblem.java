package io.github.riemr.trainer.optimization.solution;

import io.github.riemr.trainer.domain.model.BookingRequest;
import io.github.riemr.trainer.domain.model.SchedulingPreferences;
import io.github.riemr.trainer.optimization.entity.CapacitySlot;
import io.github.riemr.trainer.optimization.entity.CommittedInterval;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Fully materialized input of one run for a single trainer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleProblem {
    private Long trainerId;

    // 対象日レンジ（両端含む、null は無制限）
    private LocalDate fromDate;
    private LocalDate toDate;
    private Integer maxEntries;

    @Builder.Default
    private List<BookingRequest> requests = new ArrayList<>();
    /** null means "use the configured defaults". */
    private SchedulingPreferences preferences;
    @Builder.Default
    private List<CommittedInterval> existingBookings = new ArrayList<>();
    /** Optional published availability; empty means capacity is only bounded by work hours. */
    @Builder.Default
    private List<CapacitySlot> capacitySlots = new ArrayList<>();
}
