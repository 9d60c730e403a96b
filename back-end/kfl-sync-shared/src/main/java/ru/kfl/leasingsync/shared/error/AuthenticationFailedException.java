package ru.kfl.leasingsync.shared.error;

public class AuthenticationFailedException extends SyncException {

    public AuthenticationFailedException(String message) {
        super(SyncErrorKind.AUTHENTICATION_FAILED, message);
    }
}
