package io.rankwatch4j.core;

public enum TriggerType {
    INTERVAL {
        @Override
        public boolean isRecurring() {
            return true;
        }
    },
    CRON {
        @Override
        public boolean isRecurring() {
            return true;
        }
    },
    DAILY {
        @Override
        public boolean isRecurring() {
            return true;
        }
    },
    ONCE {
        @Override
        public boolean isRecurring() {
            return false;
        }
    };

    public abstract boolean isRecurring();
}
