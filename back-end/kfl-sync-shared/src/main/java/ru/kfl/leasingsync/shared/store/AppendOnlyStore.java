package ru.kfl.leasingsync.shared.store;

import java.util.List;
import java.util.Optional;

/** Store for records that are written once and never updated or deleted. */
public interface AppendOnlyStore<K, E, F> {

    Optional<E> get(K key);

    E append(E entity);

    List<E> list(F filter);
}
