package ru.kfl.leasingsync.shared.error;

public class StoreUnavailableException extends SyncException {

    public StoreUnavailableException(String message) {
        super(SyncErrorKind.STORE_UNAVAILABLE, message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(SyncErrorKind.STORE_UNAVAILABLE, message, cause);
    }
}
