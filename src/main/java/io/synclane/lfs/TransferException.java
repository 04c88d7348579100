package io.synclane.lfs;

import java.io.IOException;

/**
 * Failure talking to the large-object endpoint. {@link #isRetryable()} separates transient network
 * and server trouble from answers that will not change on retry.
 */
public final class TransferException extends IOException {
    private final int statusCode;
    private final boolean retryable;

    public TransferException(String message, int statusCode, boolean retryable) {
        super(message);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public TransferException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.retryable = true;
    }

    public static TransferException forStatus(String operation, int statusCode) {
        boolean retryable = statusCode >= 500 || statusCode == 429 || statusCode == 408;
        return new TransferException(operation + " failed with HTTP " + statusCode, statusCode, retryable);
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean isAuthFailure() {
        return statusCode == 401 || statusCode == 403;
    }
}
