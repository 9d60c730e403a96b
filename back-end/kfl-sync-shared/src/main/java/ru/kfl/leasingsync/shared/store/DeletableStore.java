package ru.kfl.leasingsync.shared.store;

public interface DeletableStore<K, E, F> extends KeyedStore<K, E, F> {

    /**
     * Replaces the stored entity with the same key. Never creates one.
     *
     * @throws ru.kfl.leasingsync.shared.error.NotFoundException when the key is gone
     */
    E update(E entity);

    /**
     * @return {@code false} when nothing was stored under the key
     */
    boolean delete(K key);
}
