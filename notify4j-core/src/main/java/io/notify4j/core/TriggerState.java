package io.notify4j.core;

public enum TriggerState {
    SCHEDULED {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    FIRED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    CANCELLED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    };

    public abstract boolean isTerminal();
}
