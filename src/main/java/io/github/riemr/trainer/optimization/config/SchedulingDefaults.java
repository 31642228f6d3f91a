package io.github.riemr.trainer.optimization.config;

import io.github.riemr.trainer.domain.model.SchedulingPreferences;
import io.github.riemr.trainer.domain.model.TimeBlock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * 設定を持たないトレーナー向けの既定値。
 * 既定: 1日8件、休憩15分、08:00-18:00、休日なし、午前+午後、継続顧客優先、高単価フラグ未設定
 */
@Component
@Slf4j
public class SchedulingDefaults {

    private final int maxSessionsPerDay;
    private final int minBreakMinutes;
    private final boolean preferConsecutiveSessions;
    private final LocalTime workStartTime;
    private final LocalTime workEndTime;
    private final Set<DayOfWeek> daysOff;
    private final Set<TimeBlock> preferredTimeBlocks;
    private final boolean prioritizeRecurringClients;

    public SchedulingDefaults(
            @Value("${trainer.scheduler.defaults.max-sessions-per-day:8}") int maxSessionsPerDay,
            @Value("${trainer.scheduler.defaults.min-break-minutes:15}") int minBreakMinutes,
            @Value("${trainer.scheduler.defaults.prefer-consecutive-sessions:true}") boolean preferConsecutiveSessions,
            @Value("${trainer.scheduler.defaults.work-start-time:08:00}") String workStartTime,
            @Value("${trainer.scheduler.defaults.work-end-time:18:00}") String workEndTime,
            @Value("${trainer.scheduler.defaults.days-off:}") String[] daysOff,
            @Value("${trainer.scheduler.defaults.preferred-time-blocks:MORNING,AFTERNOON}") String[] preferredTimeBlocks,
            @Value("${trainer.scheduler.defaults.prioritize-recurring-clients:true}") boolean prioritizeRecurringClients) {
        this.maxSessionsPerDay = maxSessionsPerDay;
        this.minBreakMinutes = minBreakMinutes;
        this.preferConsecutiveSessions = preferConsecutiveSessions;
        this.workStartTime = LocalTime.parse(workStartTime.trim());
        this.workEndTime = LocalTime.parse(workEndTime.trim());
        this.daysOff = parseDays(daysOff);
        this.preferredTimeBlocks = parseBlocks(preferredTimeBlocks);
        this.prioritizeRecurringClients = prioritizeRecurringClients;
        if (!this.workEndTime.isAfter(this.workStartTime)) {
            throw new IllegalArgumentException("trainer.scheduler.defaults: work-end-time must be after work-start-time");
        }
        if (this.daysOff.size() >= DayOfWeek.values().length) {
            throw new IllegalArgumentException("trainer.scheduler.defaults: days-off cannot cover every day");
        }
    }

    public SchedulingPreferences forTrainer(Long trainerId) {
        return SchedulingPreferences.builder()
                .trainerId(trainerId)
                .maxSessionsPerDay(maxSessionsPerDay)
                .minBreakMinutes(minBreakMinutes)
                .preferConsecutiveSessions(preferConsecutiveSessions)
                .workStartTime(workStartTime)
                .workEndTime(workEndTime)
                .daysOff(copyOf(daysOff, DayOfWeek.class))
                .preferredTimeBlocks(copyOf(preferredTimeBlocks, TimeBlock.class))
                .prioritizeRecurringClients(prioritizeRecurringClients)
                .prioritizeHighValueSessions(null)
                .build();
    }

    private static Set<DayOfWeek> parseDays(String[] codes) {
        Set<DayOfWeek> res = EnumSet.noneOf(DayOfWeek.class);
        if (codes == null) return res;
        for (String c : codes) {
            if (c == null || c.isBlank()) continue;
            try {
                res.add(DayOfWeek.valueOf(c.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException ex) {
                log.warn("Ignoring unknown day-off code '{}'", c);
            }
        }
        return res;
    }

    private static Set<TimeBlock> parseBlocks(String[] codes) {
        Set<TimeBlock> res = EnumSet.noneOf(TimeBlock.class);
        if (codes == null) return res;
        for (String c : codes) {
            TimeBlock b = TimeBlock.fromCode(c);
            if (b != null) {
                res.add(b);
            } else if (c != null && !c.isBlank()) {
                log.warn("Ignoring unknown time block '{}'", c);
            }
        }
        return res;
    }

    private static <E extends Enum<E>> Set<E> copyOf(Set<E> src, Class<E> type) {
        return src.isEmpty() ? EnumSet.noneOf(type) : EnumSet.copyOf(src);
    }
}
