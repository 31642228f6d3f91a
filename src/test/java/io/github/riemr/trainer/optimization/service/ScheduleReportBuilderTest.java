package io.github.riemr.trainer.optimization.service;

import io.github.riemr.trainer.optimization.constraint.RejectionKind;
import io.github.riemr.trainer.optimization.constraint.RejectionReason;
import io.github.riemr.trainer.optimization.phase.GreedyPlacementPhase.PlacementOutcome;
import io.github.riemr.trainer.optimization.solution.ProposedScheduleEntry;
import io.github.riemr.trainer.optimization.solution.RejectedEntry;
import io.github.riemr.trainer.optimization.solution.ScheduleResult;
import io.github.riemr.trainer.optimization.solution.ScheduleStatistics;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleReportBuilderTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 15);

    private final ScheduleReportBuilder builder = new ScheduleReportBuilder();

    private static ProposedScheduleEntry entry(long id, LocalDate day, int h1, int m1, int h2, int m2) {
        return ProposedScheduleEntry.builder()
                .bookingRequestId(id)
                .startTime(day.atTime(h1, m1))
                .endTime(day.atTime(h2, m2))
                .build();
    }

    @Test
    void build_computesStatisticsAndMessage() {
        List<ProposedScheduleEntry> accepted = List.of(
                entry(1, DAY, 9, 0, 10, 0),
                entry(2, DAY, 10, 15, 11, 15));
        List<RejectedEntry> rejected = List.of(RejectedEntry.builder()
                .bookingRequestId(3L)
                .reason(RejectionReason.noTimeSpecified())
                .build());

        ScheduleResult result = builder.build(1L, new PlacementOutcome(accepted, rejected, 600), 15);
        ScheduleStatistics stats = result.getStatistics();

        assertThat(stats.getTotalRequests()).isEqualTo(3);
        assertThat(stats.getScheduledRequests()).isEqualTo(2);
        assertThat(stats.getUnscheduledRequests()).isEqualTo(1);
        assertThat(stats.getTotalHours()).isEqualTo(2.0);
        assertThat(stats.getGapsMinimized()).isEqualTo(1);
        assertThat(stats.getUtilizationRate()).isEqualTo(20.0);
        assertThat(stats.getSchedulingEfficiency()).isEqualTo(66.67);
        assertThat(stats.getRejectionsByKind()).containsEntry(RejectionKind.NO_TIME_SPECIFIED, 1);
        assertThat(result.getMessage()).isEqualTo("Generated optimal schedule with 2 proposed sessions");
    }

    @Test
    void backToBackCount_ignoresPairsOnDifferentDays() {
        List<ProposedScheduleEntry> accepted = List.of(
                entry(1, DAY, 16, 45, 17, 45),
                entry(2, DAY.plusDays(1), 8, 0, 9, 0));

        assertThat(ScheduleReportBuilder.countBackToBack(accepted, 15)).isZero();
    }

    @Test
    void totalHours_isRoundedToTwoDecimals() {
        List<ProposedScheduleEntry> accepted = List.of(entry(1, DAY, 9, 0, 9, 50));

        ScheduleResult result = builder.build(1L, new PlacementOutcome(accepted, List.of(), 0), 15);

        assertThat(result.getStatistics().getTotalHours()).isEqualTo(0.83);
        assertThat(result.getStatistics().getUtilizationRate()).isZero();
    }

    @Test
    void empty_usesNoPendingMessage() {
        ScheduleResult result = builder.empty(5L);

        assertThat(result.getMessage()).isEqualTo("No pending booking requests found");
        assertThat(result.getProposedEntries()).isEmpty();
        assertThat(result.getStatistics().getTotalRequests()).isZero();
    }
}
