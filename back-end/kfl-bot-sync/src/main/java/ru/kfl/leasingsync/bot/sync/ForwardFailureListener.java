package ru.kfl.leasingsync.bot.sync;

/**
 * Notified when a forward to the gateway fails after the local write succeeded.
 */
@FunctionalInterface
public interface ForwardFailureListener {

    ForwardFailureListener NONE = (operation, key, cause) -> { };

    void onForwardFailure(String operation, Object key, Exception cause);
}
