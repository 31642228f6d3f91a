package io.github.riemr.trainer.optimization.solution;

import io.github.riemr.trainer.optimization.constraint.RejectionKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleStatistics {
    private int totalRequests;
    private int scheduledRequests;
    private int unscheduledRequests;
    private double totalHours;
    private int gapsMinimized;
    private double utilizationRate;      // %
    private double schedulingEfficiency; // %
    @Builder.Default
    private Map<RejectionKind, Integer> rejectionsByKind = new EnumMap<>(RejectionKind.class);

    public static ScheduleStatistics empty() {
        return ScheduleStatistics.builder().build();
    }
}
