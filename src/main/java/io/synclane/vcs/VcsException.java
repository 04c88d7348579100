package io.synclane.vcs;

public final class VcsException extends RuntimeException {
    public enum Kind {
        AUTH,
        NETWORK,
        REJECTED,
        NOT_FOUND,
        OTHER
    }

    private final Kind kind;

    public VcsException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind == Kind.NETWORK;
    }
}
