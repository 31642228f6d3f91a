package io.github.riemr.trainer.presentation.form;

import io.github.riemr.trainer.domain.model.SchedulingPreferences;
import io.github.riemr.trainer.domain.model.TimeBlock;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Data
public class SchedulingPreferencesForm {

    private static final String HH_MM = "^([01]\\d|2[0-3]):[0-5]\\d$";

    @NotNull(message = "maxSessionsPerDay is required")
    @Min(value = 1, message = "maxSessionsPerDay must be between 1 and 15")
    @Max(value = 15, message = "maxSessionsPerDay must be between 1 and 15")
    private Integer maxSessionsPerDay = 8;

    @NotNull(message = "minBreakMinutes is required")
    @Min(value = 0, message = "minBreakMinutes must be between 0 and 60")
    @Max(value = 60, message = "minBreakMinutes must be between 0 and 60")
    private Integer minBreakMinutes = 15;

    private boolean preferConsecutiveSessions = true;

    @NotNull(message = "workStartTime is required")
    @Pattern(regexp = HH_MM, message = "workStartTime must be HH:mm")
    private String workStartTime = "08:00";

    @NotNull(message = "workEndTime is required")
    @Pattern(regexp = HH_MM, message = "workEndTime must be HH:mm")
    private String workEndTime = "18:00";

    private List<DayOfWeek> daysOff = new ArrayList<>();
    // morning / afternoon / evening
    private List<String> preferredTimeBlocks = new ArrayList<>(List.of("morning", "afternoon"));

    private boolean prioritizeRecurringClients = true;
    private Boolean prioritizeHighValueSessions;

    public boolean isWorkHoursValid() {
        try {
            return LocalTime.parse(workEndTime).isAfter(LocalTime.parse(workStartTime));
        } catch (RuntimeException e) {
            return false;
        }
    }

    public boolean isAllDaysOff() {
        if (daysOff == null) return false;
        Set<DayOfWeek> distinct = EnumSet.noneOf(DayOfWeek.class);
        distinct.addAll(nonNull(daysOff));
        return distinct.size() >= DayOfWeek.values().length;
    }

    public SchedulingPreferences toEntity(Long trainerId) {
        Set<TimeBlock> blocks = EnumSet.noneOf(TimeBlock.class);
        if (preferredTimeBlocks != null) {
            for (String code : preferredTimeBlocks) {
                TimeBlock b = TimeBlock.fromCode(code);
                if (b == null) throw new IllegalArgumentException("Unknown time block: " + code);
                blocks.add(b);
            }
        }
        Set<DayOfWeek> off = EnumSet.noneOf(DayOfWeek.class);
        if (daysOff != null) off.addAll(nonNull(daysOff));
        return SchedulingPreferences.builder()
                .trainerId(trainerId)
                .maxSessionsPerDay(maxSessionsPerDay)
                .minBreakMinutes(minBreakMinutes)
                .preferConsecutiveSessions(preferConsecutiveSessions)
                .workStartTime(LocalTime.parse(workStartTime))
                .workEndTime(LocalTime.parse(workEndTime))
                .daysOff(off)
                .preferredTimeBlocks(blocks)
                .prioritizeRecurringClients(prioritizeRecurringClients)
                .prioritizeHighValueSessions(prioritizeHighValueSessions)
                .build();
    }

    private static List<DayOfWeek> nonNull(List<DayOfWeek> days) {
        List<DayOfWeek> res = new ArrayList<>();
        for (DayOfWeek d : days) if (d != null) res.add(d);
        return res;
    }
}
