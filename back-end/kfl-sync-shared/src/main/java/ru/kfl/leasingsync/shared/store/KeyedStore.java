package ru.kfl.leasingsync.shared.store;

import java.util.List;
import java.util.Optional;

/** Get/upsert/list by a stable external key. The last upsert of a key wins. */
public interface KeyedStore<K, E, F> {

    Optional<E> get(K key);

    UpsertOutcome<E> upsert(E entity);

    List<E> list(F filter);
}
