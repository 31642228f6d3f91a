package io.github.riemr.trainer.optimization.ranking;

import io.github.riemr.trainer.domain.model.BookingRequest;

/**
 * A request paired with the score used to order placement. The request itself is not modified.
 */
public record RankedRequest(BookingRequest request, double score) {}
