package io.gridsweep.remote;

public enum RemoteErrorCategory {
    RATE_LIMITED(true),
    TRANSIENT_TRANSPORT(true),
    SERVER_FAULT(true),
    INVALID_INPUT(false),
    AUTH(false),
    /** A prediction was created but never delivered an output. Resubmitting would bill a second one. */
    ABANDONED(false);

    private final boolean retryable;

    RemoteErrorCategory(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }

    public static RemoteErrorCategory fromHttpStatus(int status) {
        if (status == 429) {
            return RATE_LIMITED;
        }
        if (status == 401 || status == 403) {
            return AUTH;
        }
        if (status == 408) {
            return TRANSIENT_TRANSPORT;
        }
        if (status >= 500) {
            return SERVER_FAULT;
        }
        return INVALID_INPUT;
    }
}
