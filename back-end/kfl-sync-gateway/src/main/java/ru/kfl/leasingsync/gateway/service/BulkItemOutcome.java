package ru.kfl.leasingsync.gateway.service;

import ru.kfl.leasingsync.shared.error.SyncErrorKind;
import ru.kfl.leasingsync.shared.store.UpsertOutcome;

/**
 * Result for the element at {@code index} of a bulk request. Exactly one of
 * {@code entity} and {@code error} is set.
 */
public record BulkItemOutcome<E>(int index, E entity, boolean created, SyncErrorKind errorKind, String error) {

    public static <E> BulkItemOutcome<E> ok(int index, UpsertOutcome<E> outcome) {
        return new BulkItemOutcome<>(index, outcome.entity(), outcome.created(), null, null);
    }

    public static <E> BulkItemOutcome<E> failed(int index, SyncErrorKind kind, String reason) {
        return new BulkItemOutcome<>(index, null, false, kind, reason);
    }

    public boolean succeeded() {
        return error == null;
    }
}
