package io.github.riemr.trainer.optimization.solution;

import io.github.riemr.trainer.optimization.constraint.RejectionKind;
import io.github.riemr.trainer.optimization.constraint.RejectionReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RejectedEntry {
    private Long bookingRequestId;
    private Long clientId;
    private String clientName;
    private String sessionType;
    private String trainingType;
    private Integer durationMinutes;
    // 依頼時点の希望時刻（柔軟リクエストは null）
    private LocalDateTime requestedStartTime;
    private LocalDateTime requestedEndTime;
    private double priorityScore;
    private RejectionReason reason;

    public RejectionKind getReasonKind() {
        return reason == null ? null : reason.kind();
    }

    public String getReasonMessage() {
        return reason == null ? null : reason.message();
    }
}
