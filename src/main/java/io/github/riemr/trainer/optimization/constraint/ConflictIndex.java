package io.github.riemr.trainer.optimization.constraint;

import io.github.riemr.trainer.optimization.entity.CommittedInterval;
import io.github.riemr.trainer.optimization.entity.TimeRange;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Committed intervals of one trainer, grouped per calendar day (by start date) and kept
 * sorted by start. Built fresh for every placement run and never shared.
 */
public class ConflictIndex {

    public enum Side { BEFORE, AFTER }

    public record BreakViolation(Side side, CommittedInterval neighbor) {}

    private static final Comparator<CommittedInterval> BY_RANGE = Comparator.comparing(CommittedInterval::range);

    private final Map<LocalDate, List<CommittedInterval>> byDate = new TreeMap<>();

    public static ConflictIndex seeded(Collection<CommittedInterval> existing) {
        ConflictIndex index = new ConflictIndex();
        if (existing != null) {
            existing.forEach(index::add);
        }
        return index;
    }

    public void add(CommittedInterval interval) {
        List<CommittedInterval> day = byDate.computeIfAbsent(interval.range().date(), k -> new ArrayList<>());
        int pos = 0;
        while (pos < day.size() && BY_RANGE.compare(day.get(pos), interval) <= 0) pos++;
        day.add(pos, interval);
    }

    /** First committed interval (by start) that overlaps the candidate. */
    public Optional<CommittedInterval> conflictsWith(TimeRange candidate) {
        // 前日から日付を跨ぐ予約も対象にする
        LocalDate from = candidate.start().toLocalDate().minusDays(1);
        LocalDate to = candidate.end().toLocalDate();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            for (CommittedInterval ci : byDate.getOrDefault(d, List.of())) {
                if (ci.range().overlaps(candidate)) {
                    return Optional.of(ci);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Neighbor closer than {@code minBreakMinutes}: the previous session is checked
     * before the next one. Assumes the candidate does not overlap anything.
     */
    public Optional<BreakViolation> breaksBreakRule(TimeRange candidate, int minBreakMinutes) {
        if (minBreakMinutes <= 0) return Optional.empty();
        CommittedInterval previous = null;
        CommittedInterval next = null;
        // 前日開始で日付を跨いだ予約も直前のセッションとして扱う
        for (CommittedInterval ci : byDate.getOrDefault(candidate.date().minusDays(1), List.of())) {
            TimeRange r = ci.range();
            if (!r.end().isAfter(candidate.start())
                    && (previous == null || r.end().isAfter(previous.range().end()))) {
                previous = ci;
            }
        }
        for (CommittedInterval ci : byDate.getOrDefault(candidate.date(), List.of())) {
            TimeRange r = ci.range();
            if (!r.end().isAfter(candidate.start())) {
                if (previous == null || r.end().isAfter(previous.range().end())) previous = ci;
            } else if (!r.start().isBefore(candidate.end()) && next == null) {
                next = ci;
            }
        }
        if (previous != null && TimeRange.gapMinutes(previous.range(), candidate) < minBreakMinutes) {
            return Optional.of(new BreakViolation(Side.BEFORE, previous));
        }
        if (next != null && TimeRange.gapMinutes(candidate, next.range()) < minBreakMinutes) {
            return Optional.of(new BreakViolation(Side.AFTER, next));
        }
        return Optional.empty();
    }

    public int countOn(LocalDate date) {
        return byDate.getOrDefault(date, List.of()).size();
    }

    public List<CommittedInterval> on(LocalDate date) {
        return List.copyOf(byDate.getOrDefault(date, List.of()));
    }

    public List<CommittedInterval> all() {
        List<CommittedInterval> res = new ArrayList<>();
        byDate.values().forEach(res::addAll);
        return res;
    }
}
