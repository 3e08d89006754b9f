package io.recur4j.core;

public enum OccurrenceStatus {
    UNCOMPLETED {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    COMPLETED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    CANCELED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    };

    /**
     * Terminal occurrences are historical record: regeneration and scoped edits leave them alone.
     */
    public abstract boolean isTerminal();
}
