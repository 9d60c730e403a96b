package ru.kfl.leasingsync.bot.gateway;

/**
 * Gateway answered with an error that does not map to a sync error kind,
 * typically a 5xx from an unexpected failure.
 */
public class GatewayCallException extends RuntimeException {

    private final int status;

    public GatewayCallException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
