package io.recur4j.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Persisted shape of a recurrence rule.
 *
 * <pre>
 * { "type": "weekly", "interval": 2, "count": null, "until_date": "2026-01-15", "end": "never" }
 * </pre>
 *
 * <p>This is a raw record: it is only validated when converted with {@link RecurrenceRule#from}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecurrenceRuleRecord(
        @JsonProperty("type") String type,
        @JsonProperty("interval") Integer interval,
        @JsonProperty("count") Integer count,
        @JsonProperty("until_date") String untilDate,
        @JsonProperty("end") String end
) {
    public static final String NONE = "none";
    public static final String END_NEVER = "never";

    public boolean isNone() {
        return type == null || type.isBlank() || NONE.equalsIgnoreCase(type.trim());
    }

    public boolean endsNever() {
        return end != null && END_NEVER.equalsIgnoreCase(end.trim());
    }
}
