package io.github.riemr.trainer.domain.model;

public enum BookingRequestStatus {
    PENDING,
    APPROVED,
    REJECTED,
    EXPIRED;

    public static BookingRequestStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        try {
            return BookingRequestStatus.valueOf(code.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
