package com.grantradar.catalog.model;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Outcome of resolving a date value. {@link Status#ABSENT} means no value was supplied,
 * {@link Status#UNRESOLVED} means a value was supplied but could not be read as a date.
 */
public record DateResolution(Status status, LocalDate date, String raw) {

    private static final DateResolution ABSENT = new DateResolution(Status.ABSENT, null, null);

    public enum Status {
        RESOLVED,
        UNRESOLVED,
        ABSENT
    }

    public DateResolution {
        if (status == Status.RESOLVED && date == null) {
            throw new IllegalArgumentException("resolved date requires a value");
        }
        if (status != Status.RESOLVED && date != null) {
            throw new IllegalArgumentException("only a resolved date carries a value");
        }
    }

    public static DateResolution resolved(LocalDate date) {
        return new DateResolution(Status.RESOLVED, date, date.toString());
    }

    public static DateResolution unresolved(String raw) {
        return new DateResolution(Status.UNRESOLVED, null, raw);
    }

    public static DateResolution absent() {
        return ABSENT;
    }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }

    public Optional<LocalDate> asOptional() {
        return Optional.ofNullable(date);
    }
}
