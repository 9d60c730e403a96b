package ru.kfl.leasingsync.shared.error;

public abstract class SyncException extends RuntimeException {

    private final SyncErrorKind kind;

    protected SyncException(SyncErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected SyncException(SyncErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public SyncErrorKind getKind() {
        return kind;
    }

    /**
     * Rebuilds the typed exception for a kind received over the wire.
     */
    public static SyncException of(SyncErrorKind kind, String message) {
        return switch (kind) {
            case AUTHENTICATION_FAILED -> new AuthenticationFailedException(message);
            case VALIDATION_FAILED -> new ValidationFailedException(message);
            case NOT_FOUND -> new NotFoundException(message);
            case PERMISSION_DENIED -> new PermissionDeniedException(message);
            case STORE_UNAVAILABLE -> new StoreUnavailableException(message);
        };
    }
}
