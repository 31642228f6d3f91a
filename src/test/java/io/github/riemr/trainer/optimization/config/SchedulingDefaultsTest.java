package io.github.riemr.trainer.optimization.config;

import io.github.riemr.trainer.domain.model.SchedulingPreferences;
import io.github.riemr.trainer.domain.model.TimeBlock;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchedulingDefaultsTest {

    @Test
    void forTrainer_buildsDocumentedDefaults() {
        SchedulingDefaults defaults = new SchedulingDefaults(8, 15, true, "08:00", "18:00",
                new String[0], new String[]{"MORNING", "AFTERNOON"}, true);

        SchedulingPreferences p = defaults.forTrainer(42L);

        assertThat(p.getTrainerId()).isEqualTo(42L);
        assertThat(p.getMaxSessionsPerDay()).isEqualTo(8);
        assertThat(p.getMinBreakMinutes()).isEqualTo(15);
        assertThat(p.isPreferConsecutiveSessions()).isTrue();
        assertThat(p.getWorkStartTime()).isEqualTo(LocalTime.of(8, 0));
        assertThat(p.getWorkEndTime()).isEqualTo(LocalTime.of(18, 0));
        assertThat(p.getDaysOff()).isEmpty();
        assertThat(p.getPreferredTimeBlocks()).containsExactlyInAnyOrder(TimeBlock.MORNING, TimeBlock.AFTERNOON);
        assertThat(p.isPrioritizeRecurringClients()).isTrue();
        assertThat(p.getPrioritizeHighValueSessions()).isNull();
    }

    @Test
    void forTrainer_returnsIndependentCopies() {
        SchedulingDefaults defaults = new SchedulingDefaults(8, 15, true, "08:00", "18:00",
                new String[]{"sunday", "bogus"}, new String[]{"evening"}, true);

        SchedulingPreferences a = defaults.forTrainer(1L);
        a.getDaysOff().add(DayOfWeek.MONDAY);

        assertThat(defaults.forTrainer(2L).getDaysOff()).containsExactly(DayOfWeek.SUNDAY);
        assertThat(defaults.forTrainer(2L).getPreferredTimeBlocks()).containsExactly(TimeBlock.EVENING);
    }

    @Test
    void constructor_rejectsInvertedWorkHours() {
        assertThatThrownBy(() -> new SchedulingDefaults(8, 15, true, "18:00", "08:00",
                new String[0], new String[0], true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
