package ru.kfl.leasingsync.shared.error;

public enum SyncErrorKind {

    AUTHENTICATION_FAILED(401, false),
    VALIDATION_FAILED(400, false),
    NOT_FOUND(404, false),
    PERMISSION_DENIED(403, false),
    STORE_UNAVAILABLE(503, true);

    private final int httpStatus;
    private final boolean retryable;

    SyncErrorKind(int httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public boolean retryable() {
        return retryable;
    }
}
