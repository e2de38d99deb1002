package com.incarts.analytics.domain.filter;

import com.incarts.analytics.domain.exception.InvalidFilterException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Inclusive date bounds. Either bound may be absent, in which case the range is
 * open on that side.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DateRange {

    LocalDate start;
    LocalDate end;

    public static DateRange of(LocalDate start, LocalDate end) {
        if (start != null && end != null && start.isAfter(end)) {
            throw new InvalidFilterException("start_date " + start + " is after end_date " + end);
        }
        return new DateRange(start, end);
    }

    public static DateRange unbounded() {
        return new DateRange(null, null);
    }

    public Optional<LocalDate> startBound() {
        return Optional.ofNullable(start);
    }

    public Optional<LocalDate> endBound() {
        return Optional.ofNullable(end);
    }

    public boolean isBounded() {
        return start != null || end != null;
    }
}
