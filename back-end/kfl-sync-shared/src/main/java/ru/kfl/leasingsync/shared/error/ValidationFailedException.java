package ru.kfl.leasingsync.shared.error;

public class ValidationFailedException extends SyncException {

    public ValidationFailedException(String message) {
        super(SyncErrorKind.VALIDATION_FAILED, message);
    }
}
