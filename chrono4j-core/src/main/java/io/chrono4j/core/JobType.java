package io.chrono4j.core;

public enum JobType {
    CRON {
        @Override
        public boolean shouldReschedule() {
            return true;
        }
    },
    ONCE {
        @Override
        public boolean shouldReschedule() {
            return false;
        }
    },
    INTERVAL {
        @Override
        public boolean shouldReschedule() {
            return true;
        }
    };

    public abstract boolean shouldReschedule();
}
