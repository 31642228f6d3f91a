package io.github.riemr.trainer.optimization.constraint;

import io.github.riemr.trainer.domain.model.SchedulingPreferences;
import io.github.riemr.trainer.optimization.entity.TimeRange;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Checks whether a candidate interval is permitted by the trainer's preferences.
 * Order is fixed: day off, work hours, daily capacity. The first failure wins.
 */
@Component
public class PreferenceEvaluator {

    public record PreferenceCheck(boolean allowed, RejectionReason reason) {
        static final PreferenceCheck OK = new PreferenceCheck(true, null);

        static PreferenceCheck rejected(RejectionReason reason) {
            return new PreferenceCheck(false, reason);
        }
    }

    public PreferenceCheck isStructurallyAllowed(TimeRange candidate, SchedulingPreferences prefs, ConflictIndex index) {
        LocalDate date = candidate.date();
        DayOfWeek dow = date.getDayOfWeek();
        if (prefs.isDayOff(dow)) {
            return PreferenceCheck.rejected(RejectionReason.dayOff(dow));
        }

        if (!TimeRange.withinWindow(candidate, prefs.getWorkStartTime(), prefs.getWorkEndTime())) {
            return PreferenceCheck.rejected(RejectionReason.outsideWorkHours(
                    candidate.start().toLocalTime(), prefs.getWorkStartTime(), prefs.getWorkEndTime()));
        }

        if (index.countOn(date) >= prefs.getMaxSessionsPerDay()) {
            return PreferenceCheck.rejected(RejectionReason.dailyLimit(prefs.getMaxSessionsPerDay(), date));
        }
        return PreferenceCheck.OK;
    }
}
