package com.hltvsync.domain.ports;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Port for the entity store.
 *
 * All methods may throw {@link com.hltvsync.domain.exception.PersistenceException}.
 */
public interface RecordStore {

    /**
     * Runs the work in one transaction. Any exception rolls the transaction back.
     */
    <T> T inTransaction(Function<StoreTransaction, T> work);

    Optional<Map<String, Object>> findOne(StoreCollection collection, Map<String, Object> key);

    /**
     * Returns the subset of the given ids already stored in an entity collection.
     */
    Set<Long> findExistingIds(StoreCollection collection, Collection<Long> ids);

    long count(StoreCollection collection);
}
