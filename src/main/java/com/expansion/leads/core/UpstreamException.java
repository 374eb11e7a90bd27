package com.expansion.leads.core;

/**
 * Transient failure of an external collaborator (timeout, 5xx, rate limit) after the
 * HTTP boundary has exhausted its retries. Callers skip the affected item and carry on.
 */
public class UpstreamException extends LeadsException {
    private final int status;

    public UpstreamException(String message, int status) {
        super(message);
        this.status = status;
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    /**
     * HTTP status of the last attempt, or -1 when no response was received.
     */
    public int getStatus() {
        return status;
    }

    public boolean isRetryable() {
        return status == -1 || status == 429 || status >= 500;
    }
}
