package io.github.riemr.trainer.optimization.phase;

import io.github.riemr.trainer.optimization.entity.CapacitySlot;
import io.github.riemr.trainer.optimization.entity.TimeRange;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
 * Published availability units of one run. A candidate is covered by walking slots that start
 * exactly where the previous one ended; slots are consumed only by {@link #commit(List)}.
 * An empty pool means capacity is not slot-based and every candidate is a single unit.
 */
class CapacitySlotPool {

    /** One unit of a candidate; {@code slot} is null when no free slot starts at that point. */
    record Unit(TimeRange range, CapacitySlot slot) {}

    private final TreeMap<LocalDateTime, List<CapacitySlot>> byStart = new TreeMap<>();
    private final Set<String> used = new HashSet<>();
    private final long unitMinutes;
    private final long totalMinutes;

    CapacitySlotPool(Collection<CapacitySlot> slots) {
        long unit = Long.MAX_VALUE;
        long total = 0;
        if (slots != null) {
            for (CapacitySlot s : slots) {
                byStart.computeIfAbsent(s.range().start(), k -> new ArrayList<>()).add(s);
                unit = Math.min(unit, s.range().durationMinutes());
                total += s.range().durationMinutes();
            }
        }
        byStart.values().forEach(l -> l.sort(Comparator.comparing(CapacitySlot::id)));
        this.unitMinutes = unit == Long.MAX_VALUE ? 0 : unit;
        this.totalMinutes = total;
    }

    boolean isEnabled() {
        return !byStart.isEmpty();
    }

    long totalMinutes() {
        return totalMinutes;
    }

    /**
     * Splits the candidate into consecutive units. Without slots the candidate is one unit
     * with a null slot, which callers must treat as "no slot model".
     */
    List<Unit> split(TimeRange candidate) {
        if (!isEnabled()) {
            return List.of(new Unit(candidate, null));
        }
        List<Unit> units = new ArrayList<>();
        LocalDateTime cursor = candidate.start();
        while (cursor.isBefore(candidate.end())) {
            CapacitySlot slot = freeSlotAt(cursor);
            if (slot != null) {
                LocalDateTime unitEnd = min(slot.range().end(), candidate.end());
                units.add(new Unit(new TimeRange(cursor, unitEnd), slot));
                cursor = slot.range().end();
            } else {
                LocalDateTime unitEnd = min(cursor.plusMinutes(unitMinutes), candidate.end());
                units.add(new Unit(new TimeRange(cursor, unitEnd), null));
                cursor = unitEnd;
            }
        }
        return units;
    }

    void commit(List<CapacitySlot> slots) {
        for (CapacitySlot s : slots) {
            if (!used.add(s.id())) {
                throw new IllegalStateException("Capacity slot committed twice: " + s.id());
            }
        }
    }

    private CapacitySlot freeSlotAt(LocalDateTime start) {
        for (CapacitySlot s : byStart.getOrDefault(start, List.of())) {
            if (!used.contains(s.id())) return s;
        }
        return null;
    }

    private static LocalDateTime min(LocalDateTime a, LocalDateTime b) {
        return a.isBefore(b) ? a : b;
    }
}
