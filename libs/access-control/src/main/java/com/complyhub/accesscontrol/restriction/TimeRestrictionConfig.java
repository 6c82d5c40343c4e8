package com.complyhub.accesscontrol.restriction;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Time-of-week restriction evaluated in a fixed timezone.
 *
 * @param allowedDays  days access is allowed, 0 = Sunday through 6 = Saturday
 * @param allowedHours local hour window, start inclusive, end exclusive
 * @param timezone     IANA zone id (e.g., "Asia/Kolkata")
 */
public record TimeRestrictionConfig(List<Integer> allowedDays, HourWindow allowedHours, String timezone)
        implements RestrictionConfig {

    public TimeRestrictionConfig {
        allowedDays = allowedDays == null ? null : List.copyOf(allowedDays);
    }

    @Override
    public RestrictionType type() {
        return RestrictionType.TIME;
    }

    /**
     * Local hour window {@code [start, end)} on a 0 to 24 clock. Both bounds are required; a
     * window missing either one is not well formed and contains no hour.
     *
     * @param start first allowed hour (inclusive)
     * @param end   first disallowed hour (exclusive)
     */
    public record HourWindow(Integer start, Integer end) {

        public boolean contains(int hour) {
            return isWellFormed() && hour >= start && hour < end;
        }

        @JsonIgnore
        public boolean isComplete() {
            return start != null && end != null;
        }

        @JsonIgnore
        public boolean isWellFormed() {
            return isComplete() && start >= 0 && end <= 24 && start < end;
        }
    }
}
