package io.github.riemr.trainer.optimization.phase;

import io.github.riemr.trainer.domain.model.BookingRequest;
import io.github.riemr.trainer.domain.model.SchedulingPreferences;
import io.github.riemr.trainer.optimization.constraint.ConflictIndex;
import io.github.riemr.trainer.optimization.constraint.PreferenceEvaluator;
import io.github.riemr.trainer.optimization.constraint.PreferenceEvaluator.PreferenceCheck;
import io.github.riemr.trainer.optimization.constraint.RejectionReason;
import io.github.riemr.trainer.optimization.entity.CapacitySlot;
import io.github.riemr.trainer.optimization.entity.CommittedInterval;
import io.github.riemr.trainer.optimization.entity.TimeRange;
import io.github.riemr.trainer.optimization.ranking.RankedRequest;
import io.github.riemr.trainer.optimization.solution.ProposedScheduleEntry;
import io.github.riemr.trainer.optimization.solution.RejectedEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 優先度順の貪欲配置フェーズ。
 * <ul>
 *   <li>リクエストを 1 件ずつ処理し、候補区間を順に評価する</li>
 *   <li>評価順: 件数上限 → 休日/勤務時間/日次上限 → 重複・公開スロット（ユニット単位） → 休憩前後</li>
 *   <li>最初に全チェックを通った候補で確定し、以降のリクエストの制約に反映する</li>
 *   <li>バックトラックはしない（確定済みの配置は動かさない）</li>
 * </ul>
 * 実行ごとの状態（ConflictIndex, CapacitySlotPool）はメソッド内で生成するため、Bean 自体はステートレス。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GreedyPlacementPhase {

    /** Accepted entries sorted by start; rejected entries in processing order. */
    public record PlacementOutcome(List<ProposedScheduleEntry> accepted,
                                   List<RejectedEntry> rejected,
                                   long capacityMinutes) {}

    private record Evaluation(RejectionReason reason, List<CapacitySlot> slots) {
        boolean passed() {
            return reason == null;
        }
    }

    private final PreferenceEvaluator preferenceEvaluator;
    private final CandidateResolver candidateResolver;

    public PlacementOutcome place(Long trainerId,
                                  List<RankedRequest> ranked,
                                  SchedulingPreferences prefs,
                                  Collection<CommittedInterval> existingBookings,
                                  Collection<CapacitySlot> capacitySlots,
                                  Integer maxEntries) {
        return place(trainerId, ranked, prefs, existingBookings, capacitySlots, maxEntries, null);
    }

    /**
     * @param lastDay 計画期間の最終日。柔軟リクエストの候補はこの日までに限る（null なら制限なし）
     */
    public PlacementOutcome place(Long trainerId,
                                  List<RankedRequest> ranked,
                                  SchedulingPreferences prefs,
                                  Collection<CommittedInterval> existingBookings,
                                  Collection<CapacitySlot> capacitySlots,
                                  Integer maxEntries,
                                  LocalDate lastDay) {
        ConflictIndex index = ConflictIndex.seeded(existingBookings);
        CapacitySlotPool pool = new CapacitySlotPool(capacitySlots);

        List<ProposedScheduleEntry> accepted = new ArrayList<>();
        List<RejectedEntry> rejected = new ArrayList<>();

        for (RankedRequest rr : ranked) {
            BookingRequest req = rr.request();

            if (maxEntries != null && accepted.size() >= maxEntries) {
                reject(rejected, rr, RejectionReason.resultLimitReached(maxEntries));
                continue;
            }

            CandidateResolver.Resolution resolution = candidateResolver.resolve(req, prefs, index, lastDay);
            if (resolution.candidates().isEmpty()) {
                reject(rejected, rr, resolution.reason());
                continue;
            }

            RejectionReason firstFailure = null;
            boolean placed = false;
            for (TimeRange candidate : resolution.candidates()) {
                Evaluation ev = evaluate(candidate, prefs, index, pool);
                if (ev.passed()) {
                    index.add(CommittedInterval.accepted(trainerId, candidate, req.getId()));
                    pool.commit(ev.slots());
                    accepted.add(toEntry(rr, candidate, ev.slots()));
                    log.debug("Accepted request id={} at {} (score={})", req.getId(), candidate, rr.score());
                    placed = true;
                    break;
                }
                if (firstFailure == null) firstFailure = ev.reason();
            }
            if (!placed) {
                reject(rejected, rr, firstFailure);
            }
        }

        accepted.sort(Comparator.comparing(ProposedScheduleEntry::getStartTime));
        long capacityMinutes = pool.isEnabled() ? pool.totalMinutes() : workMinutesOverDays(accepted, prefs);
        return new PlacementOutcome(accepted, rejected, capacityMinutes);
    }

    private Evaluation evaluate(TimeRange candidate, SchedulingPreferences prefs,
                                ConflictIndex index, CapacitySlotPool pool) {
        PreferenceCheck check = preferenceEvaluator.isStructurallyAllowed(candidate, prefs, index);
        if (!check.allowed()) {
            return new Evaluation(check.reason(), List.of());
        }

        // ユニット単位で重複とスロット有無を確認し、最初に失敗したユニットを理由にする
        List<CapacitySlot> slots = new ArrayList<>();
        for (CapacitySlotPool.Unit unit : pool.split(candidate)) {
            Optional<CommittedInterval> blocking = index.conflictsWith(unit.range());
            if (blocking.isPresent()) {
                return new Evaluation(RejectionReason.conflict(blocking.get()), List.of());
            }
            if (pool.isEnabled()) {
                if (unit.slot() == null) {
                    return new Evaluation(RejectionReason.noAvailableSlot(unit.range()), List.of());
                }
                slots.add(unit.slot());
            }
        }

        int minBreak = prefs.getMinBreakMinutes();
        Optional<ConflictIndex.BreakViolation> violation = index.breaksBreakRule(candidate, minBreak);
        if (violation.isPresent()) {
            ConflictIndex.BreakViolation v = violation.get();
            return new Evaluation(v.side() == ConflictIndex.Side.BEFORE
                    ? RejectionReason.breakBefore(minBreak, v.neighbor())
                    : RejectionReason.breakAfter(minBreak, v.neighbor()), List.of());
        }
        return new Evaluation(null, slots);
    }

    private void reject(List<RejectedEntry> rejected, RankedRequest rr, RejectionReason reason) {
        BookingRequest req = rr.request();
        log.debug("Rejected request id={} (score={}): {}", req.getId(), rr.score(), reason);
        rejected.add(RejectedEntry.builder()
                .bookingRequestId(req.getId())
                .clientId(req.getClientId())
                .clientName(req.getClientName())
                .sessionType(req.getSessionType())
                .trainingType(req.getTrainingType())
                .durationMinutes(req.getDurationMinutes())
                .requestedStartTime(req.getStartTime())
                .requestedEndTime(req.resolvedEndTime())
                .priorityScore(rr.score())
                .reason(reason)
                .build());
    }

    private static ProposedScheduleEntry toEntry(RankedRequest rr, TimeRange range, List<CapacitySlot> slots) {
        BookingRequest req = rr.request();
        return ProposedScheduleEntry.builder()
                .bookingRequestId(req.getId())
                .clientId(req.getClientId())
                .clientName(req.getClientName())
                .sessionType(req.getSessionType())
                .trainingType(req.getTrainingType())
                .durationMinutes((int) range.durationMinutes())
                .startTime(range.start())
                .endTime(range.end())
                .slotIds(slots.stream().map(CapacitySlot::id).toList())
                .contiguous(slots.size() > 1)
                .priorityScore(rr.score())
                .location(req.getLocation())
                .specialRequests(req.getSpecialRequests())
                .build();
    }

    // スロット未指定時の稼働可能時間 = 勤務時間 × 配置のあった日数
    private static long workMinutesOverDays(List<ProposedScheduleEntry> accepted, SchedulingPreferences prefs) {
        long days = accepted.stream().map(e -> e.getStartTime().toLocalDate()).distinct().count();
        long perDay = Duration.between(prefs.getWorkStartTime(), prefs.getWorkEndTime()).toMinutes();
        return days * perDay;
    }
}
