package ru.kfl.leasingsync.shared.error;

public class PermissionDeniedException extends SyncException {

    public PermissionDeniedException(String message) {
        super(SyncErrorKind.PERMISSION_DENIED, message);
    }
}
