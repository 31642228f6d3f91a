package io.github.riemr.trainer.optimization.phase;

import io.github.riemr.trainer.domain.model.BookingRequest;
import io.github.riemr.trainer.domain.model.SchedulingPreferences;
import io.github.riemr.trainer.domain.model.TimeBlock;
import io.github.riemr.trainer.optimization.constraint.ConflictIndex;
import io.github.riemr.trainer.optimization.constraint.RejectionReason;
import io.github.riemr.trainer.optimization.entity.CommittedInterval;
import io.github.riemr.trainer.optimization.entity.DailyWindow;
import io.github.riemr.trainer.optimization.entity.TimeRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * リクエストから配置候補（時刻区間）を列挙する。
 * <ul>
 *   <li>開始時刻が指定されていればその区間のみ</li>
 *   <li>未指定なら希望日レンジ × 希望時刻から候補を作る（日付昇順、同日内は記載順）</li>
 *   <li>範囲指定 "HH:mm-HH:mm" は step 分刻みで開始位置を並べる</li>
 *   <li>顧客側の制約（避けたい時刻・週末・夜間）に反する候補は除外する</li>
 * </ul>
 */
@Component
@Slf4j
public class CandidateResolver {

    /**
     * Candidates in try order. {@code reason} explains an empty list and is null otherwise.
     */
    public record Resolution(List<TimeRange> candidates, RejectionReason reason) {
        static Resolution of(List<TimeRange> candidates) {
            return new Resolution(candidates, null);
        }

        static Resolution none(RejectionReason reason) {
            return new Resolution(List.of(), reason);
        }
    }

    private final int stepMinutes;
    private final int maxCandidateDays;

    public CandidateResolver(@Value("${trainer.scheduler.candidate-step-minutes:15}") int stepMinutes,
                             @Value("${trainer.scheduler.max-candidate-days:14}") int maxCandidateDays) {
        if (stepMinutes <= 0) throw new IllegalArgumentException("candidate-step-minutes must be positive");
        if (maxCandidateDays <= 0) throw new IllegalArgumentException("max-candidate-days must be positive");
        this.stepMinutes = stepMinutes;
        this.maxCandidateDays = maxCandidateDays;
    }

    public Resolution resolve(BookingRequest request, SchedulingPreferences prefs, ConflictIndex index) {
        return resolve(request, prefs, index, null);
    }

    /**
     * @param lastAllowedDay 計画期間の最終日。null なら希望日レンジのみで打ち切る
     */
    public Resolution resolve(BookingRequest request, SchedulingPreferences prefs, ConflictIndex index,
                              LocalDate lastAllowedDay) {
        if (request.hasFixedTime()) {
            // 固定時刻は顧客制約で弾かない（本人が指定した時刻）
            return Resolution.of(List.of(new TimeRange(request.getStartTime(), request.resolvedEndTime())));
        }
        if (request.getPreferredTimes() == null || request.getPreferredTimes().isEmpty()) {
            return Resolution.none(RejectionReason.noTimeSpecified());
        }
        List<DailyWindow> preferred = parseAll(request.getId(), request.getPreferredTimes());
        if (preferred.isEmpty()) {
            return Resolution.none(RejectionReason.noTimeSpecified());
        }
        LocalDate firstDay = request.getPreferredStartDate();
        if (firstDay == null) {
            return Resolution.none(RejectionReason.noPreferredDate());
        }
        LocalDate lastDay = request.getPreferredEndDate() == null || request.getPreferredEndDate().isBefore(firstDay)
                ? firstDay
                : request.getPreferredEndDate();
        LocalDate cap = firstDay.plusDays(maxCandidateDays - 1L);
        if (lastDay.isAfter(cap)) {
            log.debug("Request id={} preferred range truncated to {} days", request.getId(), maxCandidateDays);
            lastDay = cap;
        }
        if (lastAllowedDay != null && lastDay.isAfter(lastAllowedDay)) {
            lastDay = lastAllowedDay.isBefore(firstDay) ? firstDay : lastAllowedDay;
        }

        List<DailyWindow> avoid = parseAll(request.getId(), request.getAvoidTimes());
        long duration = request.getDurationMinutes();

        List<TimeRange> candidates = new ArrayList<>();
        int built = 0;
        for (LocalDate day = firstDay; !day.isAfter(lastDay); day = day.plusDays(1)) {
            for (DailyWindow w : preferred) {
                List<TimeRange> positions = positions(w, day, duration, prefs, index);
                built += positions.size();
                for (TimeRange c : positions) {
                    if (acceptableToClient(c, request, avoid)) {
                        candidates.add(c);
                    }
                }
            }
        }
        if (!candidates.isEmpty()) {
            return Resolution.of(candidates);
        }
        if (built == 0) {
            // 範囲指定がすべて所要時間より短い
            return Resolution.none(RejectionReason.windowTooShort(preferred.get(0), duration));
        }
        return Resolution.none(RejectionReason.noAcceptableTime());
    }

    List<TimeRange> positions(DailyWindow window, LocalDate day, long duration,
                              SchedulingPreferences prefs, ConflictIndex index) {
        if (window.isPoint()) {
            return List.of(window.on(day, duration));
        }
        LocalDateTime windowEnd = day.atTime(window.to());
        List<TimeRange> res = new ArrayList<>();
        for (LocalDateTime s = day.atTime(window.from()); !s.plusMinutes(duration).isAfter(windowEnd); s = s.plusMinutes(stepMinutes)) {
            res.add(TimeRange.ofMinutes(s, duration));
        }
        Comparator<TimeRange> order = Comparator.comparing(
                (TimeRange c) -> !prefs.isPreferredTime(c.start().toLocalTime()));
        if (prefs.isPreferConsecutiveSessions()) {
            List<CommittedInterval> sameDay = index.on(day);
            order = Comparator.comparing((TimeRange c) -> !isBackToBack(c, sameDay, prefs.getMinBreakMinutes()))
                    .thenComparing(order);
        }
        // List.sort は安定ソートなので同順位は時刻昇順のまま
        res.sort(order);
        return res;
    }

    /** Gap to a same-day neighbor equals the minimum break exactly. */
    static boolean isBackToBack(TimeRange candidate, List<CommittedInterval> sameDay, int minBreakMinutes) {
        for (CommittedInterval ci : sameDay) {
            if (!ci.range().overlaps(candidate) && TimeRange.gapMinutes(ci.range(), candidate) == minBreakMinutes) {
                return true;
            }
        }
        return false;
    }

    static boolean acceptableToClient(TimeRange candidate, BookingRequest request, List<DailyWindow> avoid) {
        DayOfWeek dow = candidate.start().getDayOfWeek();
        if (!request.isAllowWeekends() && (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY)) {
            return false;
        }
        if (!request.isAllowEvenings() && TimeBlock.EVENING.overlaps(
                candidate.start().toLocalTime(), endTimeOfDay(candidate))) {
            return false;
        }
        for (DailyWindow w : avoid) {
            if (w.touches(candidate)) return false;
        }
        return true;
    }

    private static LocalTime endTimeOfDay(TimeRange candidate) {
        // 日付を跨ぐ候補は当日末尾までとして扱う
        return candidate.end().toLocalDate().isAfter(candidate.date())
                ? LocalTime.MAX
                : candidate.end().toLocalTime();
    }

    private static List<DailyWindow> parseAll(Long requestId, List<String> texts) {
        List<DailyWindow> res = new ArrayList<>();
        if (texts == null) return res;
        for (String t : texts) {
            Optional<DailyWindow> w = DailyWindow.parse(t);
            if (w.isPresent()) {
                res.add(w.get());
            } else {
                log.warn("Ignoring unparseable time entry '{}' on request id={}", t, requestId);
            }
        }
        return res;
    }
}
