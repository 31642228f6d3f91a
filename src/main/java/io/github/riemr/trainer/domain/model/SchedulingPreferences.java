package io.github.riemr.trainer.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Trainer-level scheduling configuration. Validated by whoever accepts it
 * (see {@code OptimalScheduleForm}); the engine assumes
 * {@code workEndTime > workStartTime} and at least one working weekday.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SchedulingPreferences {
    private Long trainerId;

    private int maxSessionsPerDay;
    private int minBreakMinutes;
    private boolean preferConsecutiveSessions;

    private LocalTime workStartTime;
    private LocalTime workEndTime;

    @Builder.Default
    private Set<DayOfWeek> daysOff = EnumSet.noneOf(DayOfWeek.class);
    @Builder.Default
    private Set<TimeBlock> preferredTimeBlocks = EnumSet.noneOf(TimeBlock.class);

    private boolean prioritizeRecurringClients;
    // null = 未設定（期間ボーナスの扱いは DurationBonusPolicy に従う）
    private Boolean prioritizeHighValueSessions;

    public boolean isDayOff(DayOfWeek day) {
        return daysOff != null && daysOff.contains(day);
    }

    public boolean isPreferredTime(LocalTime t) {
        if (preferredTimeBlocks == null) return false;
        for (TimeBlock b : preferredTimeBlocks) {
            if (b.contains(t)) return true;
        }
        return false;
    }
}
