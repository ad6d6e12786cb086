package com.hltvsync.domain.ports;

import java.util.Map;
import java.util.Optional;

/**
 * Row access inside one store transaction.
 */
public interface StoreTransaction {

    Optional<Map<String, Object>> findOne(StoreCollection collection, Map<String, Object> key);

    void insert(StoreCollection collection, Map<String, Object> row);

    void replace(StoreCollection collection, Map<String, Object> key, Map<String, Object> row);
}
