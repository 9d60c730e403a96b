package ru.kfl.leasingsync.bot.local;

/**
 * The local JSON log could not be read or written. Always fatal for the
 * calling operation.
 */
public class LocalLogException extends RuntimeException {

    public LocalLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
