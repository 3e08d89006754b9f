package io.recur4j.core;

/**
 * Call-reminder schedule of a job.
 *
 * weeksPrior : 2 = Sunday of the previous week, 3 = Sunday two weeks before
 * completed  : whether the call was made (per occurrence, never inherited)
 */
public record CallReminderSettings(
        boolean enabled,
        Integer weeksPrior,
        boolean completed
) {
    public CallReminderSettings {
        if (weeksPrior != null && weeksPrior != 2 && weeksPrior != 3) {
            throw new IllegalArgumentException("weeksPrior must be 2 or 3, got: " + weeksPrior);
        }
    }

    public static CallReminderSettings none() {
        return new CallReminderSettings(false, null, false);
    }

    public static CallReminderSettings weeksPrior(int weeksPrior) {
        return new CallReminderSettings(true, weeksPrior, false);
    }

    /**
     * Schedule copied onto a new instance: same weeks-prior, not yet completed.
     */
    public CallReminderSettings forNewInstance() {
        return new CallReminderSettings(enabled, weeksPrior, false);
    }

    public boolean isScheduled() {
        return enabled && weeksPrior != null;
    }
}
