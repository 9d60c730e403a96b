package ru.kfl.leasingsync.shared.error;

public class NotFoundException extends SyncException {

    public NotFoundException(String message) {
        super(SyncErrorKind.NOT_FOUND, message);
    }
}
