package ru.kfl.leasingsync.shared.store;

public record UpsertOutcome<E>(E entity, WriteKind kind) {

    public enum WriteKind { CREATED, UPDATED }

    public static <E> UpsertOutcome<E> created(E entity) {
        return new UpsertOutcome<>(entity, WriteKind.CREATED);
    }

    public static <E> UpsertOutcome<E> updated(E entity) {
        return new UpsertOutcome<>(entity, WriteKind.UPDATED);
    }

    public boolean created() {
        return kind == WriteKind.CREATED;
    }
}
