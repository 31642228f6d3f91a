package io.github.riemr.trainer.optimization.entity;

import java.util.Objects;

/**
 * Published availability unit (e.g. a 30 or 60 minute block).
 */
public record CapacitySlot(String id, TimeRange range) {

    public CapacitySlot {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(range, "range");
    }
}
