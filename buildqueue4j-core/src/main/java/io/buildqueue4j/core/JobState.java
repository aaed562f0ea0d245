package io.buildqueue4j.core;

public enum JobState {
    PENDING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    RUNNING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    FULFILLED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    REJECTED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    };

    public abstract boolean isTerminal();
}
