package io.cronhook.core;

/**
 * Lifecycle of a fire event: {@code PENDING -> IN_FLIGHT -> SUCCEEDED | RETRY_SCHEDULED | PERMANENTLY_FAILED},
 * where {@code RETRY_SCHEDULED} becomes claimable again once its backoff has elapsed.
 */
public enum FireEventState {
    PENDING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    IN_FLIGHT {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    RETRY_SCHEDULED {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    SUCCEEDED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    PERMANENTLY_FAILED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    };

    public abstract boolean isTerminal();
}
