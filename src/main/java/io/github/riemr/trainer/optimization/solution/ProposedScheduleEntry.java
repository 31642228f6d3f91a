package io.github.riemr.trainer.optimization.solution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProposedScheduleEntry {
    private Long bookingRequestId;
    private Long clientId;
    private String clientName;
    private String sessionType;
    private String trainingType;
    private Integer durationMinutes;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    @Builder.Default
    private List<String> slotIds = new ArrayList<>();
    private boolean contiguous; // 複数スロットに跨る
    private double priorityScore;
    private String location;
    private String specialRequests;
}
