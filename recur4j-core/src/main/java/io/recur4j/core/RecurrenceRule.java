package io.recur4j.core;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated recurrence rule owned by a series parent.
 *
 * <p>Termination is at most one of:
 * <ul>
 *   <li>{@code count}: repeats generated after the parent (the parent itself is not counted)</li>
 *   <li>{@code untilDate}: inclusive last date</li>
 *   <li>forever: {@code never} marker, or neither count nor untilDate</li>
 * </ul>
 */
public record RecurrenceRule(
        RecurrenceType type,
        int interval,
        Integer count,
        LocalDate untilDate,
        boolean never
) {
    public static final int MAX_COUNT = 500;

    public RecurrenceRule {
        Objects.requireNonNull(type, "type must not be null");
        if (interval < 1) {
            throw new InvalidRecurrenceRuleException("interval must be >= 1, got: " + interval);
        }
        if (count != null && (count < 1 || count > MAX_COUNT)) {
            throw new InvalidRecurrenceRuleException(
                    "count must be between 1 and " + MAX_COUNT + ", got: " + count);
        }
        if (count != null && untilDate != null) {
            throw new InvalidRecurrenceRuleException("count and until_date are mutually exclusive");
        }
        if (never && (count != null || untilDate != null)) {
            throw new InvalidRecurrenceRuleException("a rule ending 'never' cannot carry count or until_date");
        }
    }

    public static RecurrenceRule forever(RecurrenceType type, int interval) {
        return new RecurrenceRule(type, interval, null, null, true);
    }

    public static RecurrenceRule times(RecurrenceType type, int interval, int count) {
        return new RecurrenceRule(type, interval, count, null, false);
    }

    public static RecurrenceRule until(RecurrenceType type, int interval, LocalDate untilDate) {
        Objects.requireNonNull(untilDate, "untilDate must not be null");
        return new RecurrenceRule(type, interval, null, untilDate, false);
    }

    /**
     * Interpret a persisted rule record.
     *
     * @return empty when the record is absent or its type is "none"
     * @throws InvalidRecurrenceRuleException if the record cannot be interpreted
     */
    public static Optional<RecurrenceRule> from(RecurrenceRuleRecord record) {
        if (record == null || record.isNone()) {
            return Optional.empty();
        }
        RecurrenceType type = RecurrenceType.fromValue(record.type());
        int interval = record.interval() == null ? 1 : record.interval();

        LocalDate until = null;
        if (record.untilDate() != null && !record.untilDate().isBlank()) {
            until = parseUntilDate(record.untilDate());
        }
        return Optional.of(new RecurrenceRule(type, interval, record.count(), until, record.endsNever()));
    }

    private static LocalDate parseUntilDate(String raw) {
        String s = raw.trim();
        // Older rows carried a full ISO datetime; only the date part matters.
        if (s.length() > 10 && s.charAt(10) == 'T') {
            s = s.substring(0, 10);
        }
        try {
            return LocalDate.parse(s);
        } catch (DateTimeParseException e) {
            throw new InvalidRecurrenceRuleException("Malformed until_date: " + raw, e);
        }
    }

    public RecurrenceRuleRecord toRecord() {
        return new RecurrenceRuleRecord(
                type.value(),
                interval,
                count,
                untilDate == null ? null : untilDate.toString(),
                never ? RecurrenceRuleRecord.END_NEVER : null
        );
    }
}
