package io.github.riemr.trainer.optimization.service;

import io.github.riemr.trainer.optimization.constraint.RejectionKind;
import io.github.riemr.trainer.optimization.phase.GreedyPlacementPhase.PlacementOutcome;
import io.github.riemr.trainer.optimization.solution.ProposedScheduleEntry;
import io.github.riemr.trainer.optimization.solution.RejectedEntry;
import io.github.riemr.trainer.optimization.solution.ScheduleResult;
import io.github.riemr.trainer.optimization.solution.ScheduleStatistics;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 配置結果から統計値とメッセージを組み立てる。
 */
@Component
public class ScheduleReportBuilder {

    static final String NO_PENDING_MESSAGE = "No pending booking requests found";

    public ScheduleResult build(Long trainerId, PlacementOutcome outcome, int minBreakMinutes) {
        List<ProposedScheduleEntry> accepted = outcome.accepted();
        List<RejectedEntry> rejected = outcome.rejected();
        int total = accepted.size() + rejected.size();

        long scheduledMinutes = accepted.stream()
                .mapToLong(e -> Duration.between(e.getStartTime(), e.getEndTime()).toMinutes())
                .sum();

        Map<RejectionKind, Integer> byKind = new EnumMap<>(RejectionKind.class);
        for (RejectedEntry r : rejected) {
            byKind.merge(r.getReasonKind(), 1, Integer::sum);
        }

        ScheduleStatistics stats = ScheduleStatistics.builder()
                .totalRequests(total)
                .scheduledRequests(accepted.size())
                .unscheduledRequests(rejected.size())
                .totalHours(round2(scheduledMinutes / 60.0))
                .gapsMinimized(countBackToBack(accepted, minBreakMinutes))
                .utilizationRate(percent(scheduledMinutes, outcome.capacityMinutes()))
                .schedulingEfficiency(percent(accepted.size(), total))
                .rejectionsByKind(byKind)
                .build();

        return ScheduleResult.builder()
                .trainerId(trainerId)
                .proposedEntries(accepted)
                .rejectedEntries(rejected)
                .statistics(stats)
                .message(message(total, accepted.size()))
                .build();
    }

    public ScheduleResult empty(Long trainerId) {
        return ScheduleResult.builder()
                .trainerId(trainerId)
                .statistics(ScheduleStatistics.empty())
                .message(NO_PENDING_MESSAGE)
                .build();
    }

    static String message(int total, int scheduled) {
        if (total == 0) return NO_PENDING_MESSAGE;
        return "Generated optimal schedule with " + scheduled + " proposed sessions";
    }

    /** Same-day neighbors (entries sorted by start) separated by exactly the minimum break. */
    static int countBackToBack(List<ProposedScheduleEntry> sortedByStart, int minBreakMinutes) {
        int count = 0;
        for (int i = 1; i < sortedByStart.size(); i++) {
            ProposedScheduleEntry prev = sortedByStart.get(i - 1);
            ProposedScheduleEntry cur = sortedByStart.get(i);
            if (!prev.getEndTime().toLocalDate().equals(cur.getStartTime().toLocalDate())) continue;
            if (Duration.between(prev.getEndTime(), cur.getStartTime()).toMinutes() == minBreakMinutes) count++;
        }
        return count;
    }

    private static double percent(double part, double whole) {
        if (whole <= 0) return 0.0;
        return round2(part * 100.0 / whole);
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
