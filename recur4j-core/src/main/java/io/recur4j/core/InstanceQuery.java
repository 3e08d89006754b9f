package io.recur4j.core;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * InstanceQuery describes which instances of one series an operation touches.
 *
 * <p>This is an API-layer object (NOT a MongoDB query). The store layer translates it into an
 * actual database query.
 */
public final class InstanceQuery {

    private final String parentId;
    private final Instant anchorFrom;
    private final Set<OccurrenceStatus> excludeStatuses;
    private final boolean includeDeleted;

    private InstanceQuery(String parentId, Instant anchorFrom, Set<OccurrenceStatus> excludeStatuses,
                          boolean includeDeleted) {
        this.parentId = parentId;
        this.anchorFrom = anchorFrom;
        this.excludeStatuses = excludeStatuses.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(excludeStatuses));
        this.includeDeleted = includeDeleted;
    }

    /**
     * Id of the series parent; always present.
     */
    public String parentId() {
        return parentId;
    }

    /**
     * Inclusive lower bound on the original anchor, or null for no bound.
     */
    public Instant anchorFrom() {
        return anchorFrom;
    }

    public Set<OccurrenceStatus> excludeStatuses() {
        return excludeStatuses;
    }

    /**
     * Whether soft-deleted instances match too.
     */
    public boolean includeDeleted() {
        return includeDeleted;
    }

    public static Builder forParent(String parentId) {
        return new Builder(parentId);
    }

    public static final class Builder {
        private final String parentId;
        private Instant anchorFrom;
        private final Set<OccurrenceStatus> excludeStatuses = EnumSet.noneOf(OccurrenceStatus.class);
        private boolean includeDeleted;

        private Builder(String parentId) {
            Objects.requireNonNull(parentId, "parentId must not be null");
            if (parentId.isBlank()) {
                throw new IllegalArgumentException("parentId must not be blank");
            }
            this.parentId = parentId;
        }

        /**
         * Only instances whose anchor date, in the series zone, is on or after {@code date}.
         */
        public Builder anchorOnOrAfter(LocalDate date, ZoneId zone) {
            Objects.requireNonNull(date, "date must not be null");
            Objects.requireNonNull(zone, "zone must not be null");
            this.anchorFrom = date.atStartOfDay(zone).toInstant();
            return this;
        }

        /**
         * Only instances whose anchor date, in the series zone, is strictly after {@code date}.
         */
        public Builder anchorAfter(LocalDate date, ZoneId zone) {
            Objects.requireNonNull(date, "date must not be null");
            return anchorOnOrAfter(date.plusDays(1), zone);
        }

        public Builder excludeStatus(OccurrenceStatus status) {
            Objects.requireNonNull(status, "status must not be null");
            this.excludeStatuses.add(status);
            return this;
        }

        /**
         * Skip completed and canceled instances.
         */
        public Builder excludeTerminal() {
            for (OccurrenceStatus s : OccurrenceStatus.values()) {
                if (s.isTerminal()) {
                    excludeStatuses.add(s);
                }
            }
            return this;
        }

        public Builder includeDeleted(boolean includeDeleted) {
            this.includeDeleted = includeDeleted;
            return this;
        }

        public InstanceQuery build() {
            return new InstanceQuery(parentId, anchorFrom, excludeStatuses, includeDeleted);
        }
    }
}
