package io.github.riemr.trainer.optimization.service;

import io.github.riemr.trainer.domain.model.BookingRequest;
import io.github.riemr.trainer.domain.model.BookingRequestStatus;
import io.github.riemr.trainer.domain.model.SchedulingPreferences;
import io.github.riemr.trainer.optimization.config.SchedulingDefaults;
import io.github.riemr.trainer.optimization.constraint.PreferenceEvaluator;
import io.github.riemr.trainer.optimization.constraint.RejectionKind;
import io.github.riemr.trainer.optimization.entity.CommittedInterval;
import io.github.riemr.trainer.optimization.entity.TimeRange;
import io.github.riemr.trainer.optimization.phase.CandidateResolver;
import io.github.riemr.trainer.optimization.phase.GreedyPlacementPhase;
import io.github.riemr.trainer.optimization.ranking.PriorityRanker;
import io.github.riemr.trainer.optimization.ranking.PriorityWeights;
import io.github.riemr.trainer.optimization.solution.ProposedScheduleEntry;
import io.github.riemr.trainer.optimization.solution.RejectedEntry;
import io.github.riemr.trainer.optimization.solution.ScheduleProblem;
import io.github.riemr.trainer.optimization.solution.ScheduleResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OptimalScheduleServiceTest {

    private static final Long TRAINER = 7L;
    private static final LocalDate MONDAY = LocalDate.of(2024, 1, 15);

    private OptimalScheduleService service;

    @BeforeEach
    void setUp() {
        SchedulingDefaults defaults = new SchedulingDefaults(8, 15, true, "08:00", "18:00",
                new String[0], new String[]{"MORNING", "AFTERNOON"}, true);
        service = new OptimalScheduleService(
                defaults,
                new PriorityRanker(new PriorityWeights()),
                new GreedyPlacementPhase(new PreferenceEvaluator(), new CandidateResolver(15, 14)),
                new ScheduleReportBuilder());
    }

    private static BookingRequest fixed(long id, LocalDateTime start, int minutes) {
        return BookingRequest.builder()
                .id(id).clientId(id * 10).trainerId(TRAINER)
                .trainingType("Personal Training")
                .durationMinutes(minutes)
                .startTime(start)
                .build();
    }

    private static SchedulingPreferences prefs(int maxPerDay, int minBreak) {
        return SchedulingPreferences.builder()
                .trainerId(TRAINER)
                .maxSessionsPerDay(maxPerDay)
                .minBreakMinutes(minBreak)
                .workStartTime(LocalTime.of(8, 0))
                .workEndTime(LocalTime.of(18, 0))
                .daysOff(EnumSet.of(DayOfWeek.SUNDAY))
                .build();
    }

    @Test
    void generate_returnsNoPendingMessage_whenNothingToSchedule() {
        BookingRequest approved = fixed(1, MONDAY.atTime(9, 0), 60);
        approved.setStatus(BookingRequestStatus.APPROVED);

        ScheduleResult result = service.generate(ScheduleProblem.builder()
                .trainerId(TRAINER).requests(List.of(approved)).build());

        assertThat(result.getMessage()).isEqualTo("No pending booking requests found");
        assertThat(result.getProposedEntries()).isEmpty();
        assertThat(result.getRejectedEntries()).isEmpty();
    }

    @Test
    void generate_usesDefaults_whenPreferencesMissing() {
        ScheduleResult result = service.generate(ScheduleProblem.builder()
                .trainerId(TRAINER)
                .requests(List.of(fixed(1, MONDAY.atTime(7, 0), 60), fixed(2, MONDAY.atTime(9, 0), 60)))
                .build());

        assertThat(result.getProposedEntries()).extracting(ProposedScheduleEntry::getBookingRequestId).containsExactly(2L);
        assertThat(result.getRejectedEntries().get(0).getReasonMessage())
                .isEqualTo("Requested time 07:00 is outside work hours (08:00 - 18:00)");
        assertThat(result.getMessage()).isEqualTo("Generated optimal schedule with 1 proposed sessions");
    }

    @Test
    void generate_skipsRequestsOutsideDateRange() {
        ScheduleResult result = service.generate(ScheduleProblem.builder()
                .trainerId(TRAINER)
                .fromDate(MONDAY).toDate(MONDAY.plusDays(1))
                .preferences(prefs(8, 15))
                .requests(List.of(
                        fixed(1, MONDAY.minusDays(1).atTime(9, 0), 60),
                        fixed(2, MONDAY.atTime(9, 0), 60),
                        fixed(3, MONDAY.plusDays(2).atTime(9, 0), 60)))
                .build());

        assertThat(result.getStatistics().getTotalRequests()).isEqualTo(1);
        assertThat(result.statusTransitions()).containsOnlyKeys(2L);
    }

    @Test
    void generate_keepsFlexibleCandidatesInsideDateRange() {
        // 月曜は埋まっているので、期間内に空きがなければ期間外の日には流さない
        BookingRequest flexible = BookingRequest.builder()
                .id(5L).clientId(50L).trainerId(TRAINER)
                .trainingType("Personal Training")
                .durationMinutes(60)
                .preferredStartDate(MONDAY).preferredEndDate(MONDAY.plusDays(3))
                .preferredTimes(List.of("09:00"))
                .build();

        ScheduleResult result = service.generate(ScheduleProblem.builder()
                .trainerId(TRAINER)
                .fromDate(MONDAY).toDate(MONDAY)
                .preferences(prefs(8, 15))
                .existingBookings(List.of(CommittedInterval.existing(
                        TRAINER, new TimeRange(MONDAY.atTime(9, 0), MONDAY.atTime(10, 0)), 99L)))
                .requests(List.of(flexible))
                .build());

        assertThat(result.getProposedEntries()).isEmpty();
        assertThat(result.getRejectedEntries()).singleElement()
                .satisfies(r -> assertThat(r.getReason().kind()).isEqualTo(RejectionKind.CONFLICT_EXISTING_BOOKING));
    }

    @Test
    void statusTransitions_coverEveryConsideredRequest() {
        ScheduleResult result = service.generate(ScheduleProblem.builder()
                .trainerId(TRAINER)
                .preferences(prefs(8, 15))
                .requests(List.of(fixed(1, MONDAY.atTime(9, 0), 60), fixed(2, MONDAY.atTime(9, 30), 60)))
                .build());

        Map<Long, BookingRequestStatus> transitions = result.statusTransitions();
        assertThat(transitions).hasSize(2);
        assertThat(transitions.values())
                .containsExactlyInAnyOrder(BookingRequestStatus.APPROVED, BookingRequestStatus.REJECTED);
    }

    @Test
    void generate_reportsUtilizationAgainstWorkHoursOfUsedDays() {
        ScheduleResult result = service.generate(ScheduleProblem.builder()
                .trainerId(TRAINER)
                .preferences(prefs(8, 15))
                .requests(List.of(fixed(1, MONDAY.atTime(9, 0), 60), fixed(2, MONDAY.atTime(10, 15), 60)))
                .build());

        // 120 / 600 分
        assertThat(result.getStatistics().getUtilizationRate()).isEqualTo(20.0);
        assertThat(result.getStatistics().getGapsMinimized()).isEqualTo(1);
        assertThat(result.getStatistics().getSchedulingEfficiency()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("A larger mixed batch never overlaps, respects breaks and daily limits, and is reproducible")
    void generate_keepsInvariantsOnMixedBatch() {
        List<BookingRequest> requests = new ArrayList<>();
        Random rnd = new Random(20240115L);
        String[] types = {"Personal Training", "Yoga", "Cardio", "Rehabilitation", "Pilates"};
        int[] durations = {30, 45, 60, 90};
        for (long id = 1; id <= 60; id++) {
            LocalDate day = MONDAY.plusDays(rnd.nextInt(4));
            LocalDateTime start = day.atTime(7 + rnd.nextInt(12), 15 * rnd.nextInt(4));
            BookingRequest r = fixed(id, start, durations[rnd.nextInt(durations.length)]);
            r.setTrainingType(types[rnd.nextInt(types.length)]);
            r.setRecurring(rnd.nextBoolean());
            requests.add(r);
        }
        List<CommittedInterval> existing = List.of(CommittedInterval.existing(TRAINER,
                new TimeRange(MONDAY.atTime(12, 0), MONDAY.atTime(13, 0)), 900L));
        ScheduleProblem problem = ScheduleProblem.builder()
                .trainerId(TRAINER)
                .preferences(prefs(4, 15))
                .requests(requests)
                .existingBookings(existing)
                .build();

        ScheduleResult first = service.generate(problem);
        ScheduleResult second = service.generate(problem);

        List<ProposedScheduleEntry> accepted = first.getProposedEntries();
        List<TimeRange> occupied = new ArrayList<>();
        occupied.add(existing.get(0).range());
        accepted.forEach(e -> occupied.add(new TimeRange(e.getStartTime(), e.getEndTime())));
        for (int i = 0; i < occupied.size(); i++) {
            for (int j = i + 1; j < occupied.size(); j++) {
                TimeRange a = occupied.get(i);
                TimeRange b = occupied.get(j);
                assertThat(a.overlaps(b)).as("%s vs %s", a, b).isFalse();
                if (a.date().equals(b.date())) {
                    assertThat(TimeRange.gapMinutes(a, b)).as("%s vs %s", a, b).isGreaterThanOrEqualTo(15);
                }
            }
        }
        Map<LocalDate, Long> perDay = occupied.stream().collect(Collectors.groupingBy(TimeRange::date, Collectors.counting()));
        assertThat(perDay.values()).allSatisfy(c -> assertThat(c).isLessThanOrEqualTo(4L));

        Set<Long> seen = new HashSet<>();
        accepted.forEach(e -> assertThat(seen.add(e.getBookingRequestId())).isTrue());
        first.getRejectedEntries().forEach(r -> assertThat(seen.add(r.getBookingRequestId())).isTrue());
        assertThat(seen).hasSize(60);
        assertThat(first.getRejectedEntries()).allSatisfy(r -> assertThat(r.getReason()).isNotNull());

        assertThat(second).isEqualTo(first);
    }

    @Test
    void generate_rejectsLowerScoredRequest_forSameWindow() {
        BookingRequest vip = fixed(1, MONDAY.atTime(9, 30), 60);
        vip.setPriorityScore(9.0);
        BookingRequest regular = fixed(2, MONDAY.atTime(9, 30), 60);
        regular.setPriorityScore(6.0);

        ScheduleResult result = service.generate(ScheduleProblem.builder()
                .trainerId(TRAINER).preferences(prefs(8, 15)).requests(List.of(regular, vip)).build());

        assertThat(result.getProposedEntries()).extracting(ProposedScheduleEntry::getBookingRequestId).containsExactly(1L);
        RejectedEntry rejected = result.getRejectedEntries().get(0);
        assertThat(rejected.getReasonKind()).isEqualTo(RejectionKind.CONFLICT_APPROVED_REQUEST);
        assertThat(rejected.getPriorityScore()).isEqualTo(6.0);
    }

    @Test
    void generate_throws_onContractViolations() {
        assertThatThrownBy(() -> service.generate(null)).isInstanceOf(IllegalArgumentException.class);

        BookingRequest otherTrainer = fixed(1, MONDAY.atTime(9, 0), 60);
        otherTrainer.setTrainerId(99L);
        assertThatThrownBy(() -> service.generate(ScheduleProblem.builder()
                .trainerId(TRAINER).requests(List.of(otherTrainer)).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("belongs to trainer 99");

        BookingRequest zero = fixed(2, MONDAY.atTime(9, 0), 0);
        assertThatThrownBy(() -> service.generate(ScheduleProblem.builder()
                .trainerId(TRAINER).requests(List.of(zero)).build()))
                .isInstanceOf(IllegalArgumentException.class);

        BookingRequest inverted = fixed(3, MONDAY.atTime(9, 0), 60);
        inverted.setEndTime(MONDAY.atTime(8, 0));
        assertThatThrownBy(() -> service.generate(ScheduleProblem.builder()
                .trainerId(TRAINER).requests(List.of(inverted)).build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void generate_throws_onInvalidPreferences() {
        SchedulingPreferences allOff = prefs(8, 15).toBuilder().daysOff(EnumSet.allOf(DayOfWeek.class)).build();
        SchedulingPreferences inverted = prefs(8, 15).toBuilder()
                .workStartTime(LocalTime.of(18, 0)).workEndTime(LocalTime.of(8, 0)).build();

        assertThatThrownBy(() -> service.generate(ScheduleProblem.builder()
                .trainerId(TRAINER).preferences(allOff).build()))
                .hasMessage("Cannot have all days as days off");
        assertThatThrownBy(() -> service.generate(ScheduleProblem.builder()
                .trainerId(TRAINER).preferences(inverted).build()))
                .hasMessage("Work end time must be after work start time");
    }
}
