package io.github.riemr.trainer.optimization.service;

import io.github.riemr.trainer.domain.model.BookingRequest;
import io.github.riemr.trainer.domain.model.BookingRequestStatus;
import io.github.riemr.trainer.domain.model.SchedulingPreferences;
import io.github.riemr.trainer.optimization.config.SchedulingDefaults;
import io.github.riemr.trainer.optimization.entity.CapacitySlot;
import io.github.riemr.trainer.optimization.entity.CommittedInterval;
import io.github.riemr.trainer.optimization.phase.GreedyPlacementPhase;
import io.github.riemr.trainer.optimization.phase.GreedyPlacementPhase.PlacementOutcome;
import io.github.riemr.trainer.optimization.ranking.PriorityRanker;
import io.github.riemr.trainer.optimization.ranking.RankedRequest;
import io.github.riemr.trainer.optimization.solution.ScheduleProblem;
import io.github.riemr.trainer.optimization.solution.ScheduleResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 1 トレーナー分の最適スケジュール案を生成する。
 * 入力は呼び出し側で確定済みのものを受け取り、永続化やステータス更新は行わない。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OptimalScheduleService {

    private final SchedulingDefaults schedulingDefaults;
    private final PriorityRanker priorityRanker;
    private final GreedyPlacementPhase placementPhase;
    private final ScheduleReportBuilder reportBuilder;

    public ScheduleResult generate(ScheduleProblem problem) {
        validate(problem);
        Long trainerId = problem.getTrainerId();
        SchedulingPreferences prefs = Optional.ofNullable(problem.getPreferences())
                .orElseGet(() -> schedulingDefaults.forTrainer(trainerId));

        List<BookingRequest> considered = new ArrayList<>();
        for (BookingRequest r : nullSafe(problem.getRequests())) {
            if (r.getStatus() != BookingRequestStatus.PENDING) {
                log.debug("Skipping request id={} with status {}", r.getId(), r.getStatus());
                continue;
            }
            if (!inDateRange(r, problem.getFromDate(), problem.getToDate())) {
                log.debug("Skipping request id={} outside {} .. {}", r.getId(), problem.getFromDate(), problem.getToDate());
                continue;
            }
            considered.add(r);
        }
        if (considered.isEmpty()) {
            log.info("Trainer {}: no pending booking requests to schedule", trainerId);
            return reportBuilder.empty(trainerId);
        }

        long started = System.currentTimeMillis();
        List<RankedRequest> ranked = priorityRanker.rank(considered, prefs);
        PlacementOutcome outcome = placementPhase.place(trainerId, ranked, prefs,
                nullSafe(problem.getExistingBookings()), nullSafe(problem.getCapacitySlots()), problem.getMaxEntries(),
                problem.getToDate());
        ScheduleResult result = reportBuilder.build(trainerId, outcome, prefs.getMinBreakMinutes());

        log.info("Trainer {}: scheduled {} of {} requests in {} ms (utilization={}%)",
                trainerId, result.getStatistics().getScheduledRequests(), result.getStatistics().getTotalRequests(),
                System.currentTimeMillis() - started, result.getStatistics().getUtilizationRate());
        return result;
    }

    static boolean inDateRange(BookingRequest r, LocalDate from, LocalDate to) {
        LocalDateTime requested = r.requestedStart();
        if (requested == null) return true;
        LocalDate day = requested.toLocalDate();
        if (from != null && day.isBefore(from)) return false;
        return to == null || !day.isAfter(to);
    }

    void validate(ScheduleProblem problem) {
        if (problem == null) {
            throw new IllegalArgumentException("Schedule problem is required");
        }
        Long trainerId = problem.getTrainerId();
        if (trainerId == null) {
            throw new IllegalArgumentException("trainerId is required");
        }
        if (problem.getFromDate() != null && problem.getToDate() != null
                && problem.getToDate().isBefore(problem.getFromDate())) {
            throw new IllegalArgumentException("toDate must not be before fromDate");
        }
        if (problem.getMaxEntries() != null && problem.getMaxEntries() < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1");
        }
        if (problem.getPreferences() != null) {
            validatePreferences(trainerId, problem.getPreferences());
        }

        Set<Long> ids = new HashSet<>();
        for (BookingRequest r : nullSafe(problem.getRequests())) {
            if (r == null || r.getId() == null) {
                throw new IllegalArgumentException("Every booking request needs an id");
            }
            if (!ids.add(r.getId())) {
                throw new IllegalArgumentException("Duplicate booking request id " + r.getId());
            }
            if (r.getTrainerId() != null && !trainerId.equals(r.getTrainerId())) {
                throw new IllegalArgumentException("Booking request " + r.getId() + " belongs to trainer " + r.getTrainerId());
            }
            if (r.getDurationMinutes() == null || r.getDurationMinutes() <= 0) {
                throw new IllegalArgumentException("Booking request " + r.getId() + " has no positive duration");
            }
            if (r.getStartTime() != null && r.getEndTime() != null && !r.getEndTime().isAfter(r.getStartTime())) {
                throw new IllegalArgumentException("Booking request " + r.getId() + " ends before it starts");
            }
        }
        for (CommittedInterval b : nullSafe(problem.getExistingBookings())) {
            if (b == null) {
                throw new IllegalArgumentException("Existing bookings must not contain null");
            }
            if (b.trainerId() != null && !trainerId.equals(b.trainerId())) {
                throw new IllegalArgumentException("Existing booking " + b.requestId() + " belongs to trainer " + b.trainerId());
            }
        }
        Set<String> slotIds = new HashSet<>();
        for (CapacitySlot s : nullSafe(problem.getCapacitySlots())) {
            if (s == null || s.id() == null) {
                throw new IllegalArgumentException("Every capacity slot needs an id");
            }
            if (!slotIds.add(s.id())) {
                throw new IllegalArgumentException("Duplicate capacity slot id " + s.id());
            }
        }
    }

    private static void validatePreferences(Long trainerId, SchedulingPreferences p) {
        if (p.getTrainerId() != null && !trainerId.equals(p.getTrainerId())) {
            throw new IllegalArgumentException("Preferences belong to trainer " + p.getTrainerId());
        }
        if (p.getMaxSessionsPerDay() < 1) {
            throw new IllegalArgumentException("maxSessionsPerDay must be at least 1");
        }
        if (p.getMinBreakMinutes() < 0) {
            throw new IllegalArgumentException("minBreakMinutes must not be negative");
        }
        if (p.getWorkStartTime() == null || p.getWorkEndTime() == null
                || !p.getWorkEndTime().isAfter(p.getWorkStartTime())) {
            throw new IllegalArgumentException("Work end time must be after work start time");
        }
        if (p.getDaysOff() != null && p.getDaysOff().size() >= DayOfWeek.values().length) {
            throw new IllegalArgumentException("Cannot have all days as days off");
        }
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }
}
