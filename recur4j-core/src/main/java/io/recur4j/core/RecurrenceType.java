package io.recur4j.core;

import io.recur4j.utils.DateStepper;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Recurrence kinds supported by a series rule.
 *
 * <p>Each constant computes the next anchor itself, so every kind is handled in one place.
 */
public enum RecurrenceType {
    DAILY("day") {
        @Override
        public LocalDateTime next(LocalDateTime anchor, int interval) {
            return DateStepper.plusDays(anchor, interval);
        }
    },
    WEEKLY("week") {
        @Override
        public LocalDateTime next(LocalDateTime anchor, int interval) {
            return DateStepper.plusWeeks(anchor, interval);
        }
    },
    MONTHLY("month") {
        @Override
        public LocalDateTime next(LocalDateTime anchor, int interval) {
            return DateStepper.sameWeekdayOfMonth(anchor, interval);
        }
    },
    YEARLY("year") {
        @Override
        public LocalDateTime next(LocalDateTime anchor, int interval) {
            return DateStepper.sameIsoWeekday(anchor, interval);
        }
    };

    private final String unit;

    RecurrenceType(String unit) {
        this.unit = unit;
    }

    public abstract LocalDateTime next(LocalDateTime anchor, int interval);

    /**
     * Lower-case value used in the persisted rule record ("daily", "weekly", ...).
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Singular calendar unit ("day", "week", ...), used by rule summaries.
     */
    public String unit() {
        return unit;
    }

    /**
     * Resolve a persisted type value.
     *
     * @throws InvalidRecurrenceRuleException if the value is not a known recurrence type
     */
    public static RecurrenceType fromValue(String value) {
        if (value != null) {
            for (RecurrenceType t : values()) {
                if (t.value().equalsIgnoreCase(value.trim())) {
                    return t;
                }
            }
        }
        throw new InvalidRecurrenceRuleException("Unknown recurrence type: " + value);
    }
}
