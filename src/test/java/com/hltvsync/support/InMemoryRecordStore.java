package com.hltvsync.support;

import com.hltvsync.domain.exception.PersistenceException;
import com.hltvsync.domain.ports.RecordStore;
import com.hltvsync.domain.ports.StoreCollection;
import com.hltvsync.domain.ports.StoreTransaction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Record store kept in memory. A transaction works on a copy of all rows and swaps it in on
 * success, so a failing transaction leaves nothing behind.
 */
public class InMemoryRecordStore implements RecordStore {

    private Map<StoreCollection, List<Map<String, Object>>> rows = emptyRows();
    private RuntimeException nextFailure;
    private int transactions;

    @Override
    public synchronized <T> T inTransaction(Function<StoreTransaction, T> work) {
        transactions++;
        if (nextFailure != null) {
            RuntimeException failure = nextFailure;
            nextFailure = null;
            throw failure;
        }
        Map<StoreCollection, List<Map<String, Object>>> working = copyOf(rows);
        T result = work.apply(new Transaction(working));
        rows = working;
        return result;
    }

    @Override
    public synchronized Optional<Map<String, Object>> findOne(StoreCollection collection, Map<String, Object> key) {
        return find(rows, collection, key).map(LinkedHashMap::new);
    }

    @Override
    public synchronized Set<Long> findExistingIds(StoreCollection collection, Collection<Long> ids) {
        Set<Long> found = new HashSet<>();
        for (Map<String, Object> row : rows.get(collection)) {
            Object id = row.get(collection.getIdField());
            if (id instanceof Long value && ids.contains(value)) {
                found.add(value);
            }
        }
        return found;
    }

    @Override
    public synchronized long count(StoreCollection collection) {
        return rows.get(collection).size();
    }

    /**
     * Makes the next transaction fail with the given exception before touching any row.
     */
    public synchronized void failNextTransaction(RuntimeException failure) {
        this.nextFailure = failure;
    }

    public synchronized void seed(StoreCollection collection, Map<String, Object> row) {
        rows.get(collection).add(new LinkedHashMap<>(row));
    }

    public synchronized List<Map<String, Object>> rows(StoreCollection collection) {
        List<Map<String, Object>> copy = new ArrayList<>();
        rows.get(collection).forEach(row -> copy.add(new LinkedHashMap<>(row)));
        return copy;
    }

    public synchronized Map<String, Object> row(StoreCollection collection, Map<String, Object> key) {
        return findOne(collection, key).orElse(null);
    }

    public synchronized int getTransactions() {
        return transactions;
    }

    private static Optional<Map<String, Object>> find(Map<StoreCollection, List<Map<String, Object>>> rows,
                                                      StoreCollection collection, Map<String, Object> key) {
        return rows.get(collection).stream()
            .filter(row -> matches(row, key))
            .findFirst();
    }

    private static boolean matches(Map<String, Object> row, Map<String, Object> key) {
        for (Map.Entry<String, Object> entry : key.entrySet()) {
            if (!Objects.equals(row.get(entry.getKey()), entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static Map<StoreCollection, List<Map<String, Object>>> emptyRows() {
        Map<StoreCollection, List<Map<String, Object>>> rows = new EnumMap<>(StoreCollection.class);
        for (StoreCollection collection : StoreCollection.values()) {
            rows.put(collection, new ArrayList<>());
        }
        return rows;
    }

    private static Map<StoreCollection, List<Map<String, Object>>> copyOf(
            Map<StoreCollection, List<Map<String, Object>>> source) {
        Map<StoreCollection, List<Map<String, Object>>> copy = emptyRows();
        source.forEach((collection, list) -> list.forEach(row -> copy.get(collection).add(new LinkedHashMap<>(row))));
        return copy;
    }

    private static class Transaction implements StoreTransaction {
        private final Map<StoreCollection, List<Map<String, Object>>> rows;

        Transaction(Map<StoreCollection, List<Map<String, Object>>> rows) {
            this.rows = rows;
        }

        @Override
        public Optional<Map<String, Object>> findOne(StoreCollection collection, Map<String, Object> key) {
            return find(rows, collection, key).map(LinkedHashMap::new);
        }

        @Override
        public void insert(StoreCollection collection, Map<String, Object> row) {
            Map<String, Object> key = new LinkedHashMap<>();
            collection.getKeyFields().forEach(field -> key.put(field, row.get(field)));
            if (find(rows, collection, key).isPresent()) {
                throw PersistenceException.constraint("Duplicate key in " + collection.getCollectionName() + ": " + key);
            }
            rows.get(collection).add(new LinkedHashMap<>(row));
        }

        @Override
        public void replace(StoreCollection collection, Map<String, Object> key, Map<String, Object> row) {
            List<Map<String, Object>> list = rows.get(collection);
            for (int i = 0; i < list.size(); i++) {
                if (matches(list.get(i), key)) {
                    list.set(i, new LinkedHashMap<>(row));
                    return;
                }
            }
            throw PersistenceException.constraint("No row to replace in " + collection.getCollectionName());
        }
    }
}
