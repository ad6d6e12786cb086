package com.hltvsync.infrastructure.persistence;

import com.hltvsync.domain.exception.PersistenceException;
import com.hltvsync.domain.ports.RecordStore;
import com.hltvsync.domain.ports.StoreCollection;
import com.hltvsync.domain.ports.StoreTransaction;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoClientException;
import com.mongodb.MongoException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Projections;
import org.bson.Document;
import org.bson.codecs.configuration.CodecConfigurationException;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * MongoDB implementation of RecordStore.
 *
 * Every collection gets a unique index on its key fields. Multi-document transactions need a
 * replica set (a single-node one is enough).
 */
@Repository
public class MongoRecordStore implements RecordStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoRecordStore.class);

    private final MongoClient mongoClient;
    private final String databaseName;

    public MongoRecordStore(MongoClient mongoClient, @Value("${mongodb.database:hltv}") String databaseName) {
        this.mongoClient = mongoClient;
        this.databaseName = databaseName;

        initializeIndexes();
    }

    private void initializeIndexes() {
        for (StoreCollection storeCollection : StoreCollection.values()) {
            try {
                List<Bson> keys = storeCollection.getKeyFields().stream().map(Indexes::ascending).toList();
                collection(storeCollection).createIndex(
                    Indexes.compoundIndex(keys),
                    new IndexOptions().unique(true).name(storeCollection.getCollectionName() + "_key"));
            } catch (MongoException e) {
                logger.warn("Failed to create key index on {} (may already exist): {}",
                    storeCollection.getCollectionName(), e.getMessage());
            }
        }
        logger.info("MongoDB key indexes initialized in database: {}", databaseName);
    }

    @Override
    public <T> T inTransaction(Function<StoreTransaction, T> work) {
        try (ClientSession session = mongoClient.startSession()) {
            return session.withTransaction(() -> work.apply(new SessionTransaction(session)));
        } catch (MongoException e) {
            throw translate(e);
        } catch (CodecConfigurationException e) {
            throw new PersistenceException(PersistenceException.Kind.CONSTRAINT,
                "Value cannot be stored: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Map<String, Object>> findOne(StoreCollection storeCollection, Map<String, Object> key) {
        try {
            Document document = collection(storeCollection).find(new Document(key)).first();
            return Optional.ofNullable(document).map(MongoRecordStore::toPlainMap);
        } catch (MongoException e) {
            throw translate(e);
        }
    }

    @Override
    public Set<Long> findExistingIds(StoreCollection storeCollection, Collection<Long> ids) {
        if (ids.isEmpty()) {
            return Set.of();
        }
        String idField = storeCollection.getIdField();
        Set<Long> existing = new HashSet<>();
        try {
            collection(storeCollection).find(Filters.in(idField, ids))
                .projection(Projections.include(idField))
                .forEach(document -> {
                    Object id = document.get(idField);
                    if (id instanceof Number number) {
                        existing.add(number.longValue());
                    }
                });
        } catch (MongoException e) {
            throw translate(e);
        }
        return existing;
    }

    @Override
    public long count(StoreCollection storeCollection) {
        try {
            return collection(storeCollection).countDocuments();
        } catch (MongoException e) {
            throw translate(e);
        }
    }

    private MongoCollection<Document> collection(StoreCollection storeCollection) {
        return mongoClient.getDatabase(databaseName).getCollection(storeCollection.getCollectionName());
    }

    /**
     * Duplicate keys and other write errors are constraint violations; timeouts, socket and
     * server selection errors mean the store is unreachable.
     */
    static PersistenceException translate(MongoException e) {
        if (e instanceof MongoTimeoutException || e instanceof MongoSocketException
            || e instanceof MongoClientException
            || e.hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)) {
            return new PersistenceException(PersistenceException.Kind.CONNECTIVITY, e.getMessage(), e);
        }
        if (e instanceof MongoWriteException writeException
            && writeException.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) {
            return new PersistenceException(PersistenceException.Kind.CONSTRAINT, "Duplicate key: " + e.getMessage(), e);
        }
        return new PersistenceException(PersistenceException.Kind.CONSTRAINT, e.getMessage(), e);
    }

    /**
     * Converts a stored document into plain maps and lists, with dates as instants and without _id.
     */
    static Map<String, Object> toPlainMap(Document document) {
        Map<String, Object> map = new LinkedHashMap<>();
        document.forEach((key, value) -> {
            if (!"_id".equals(key)) {
                map.put(key, toPlainValue(value));
            }
        });
        return map;
    }

    private static Object toPlainValue(Object value) {
        if (value instanceof Document nested) {
            return toPlainMap(nested);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(element -> copy.add(toPlainValue(element)));
            return copy;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        return value;
    }

    private class SessionTransaction implements StoreTransaction {

        private final ClientSession session;

        SessionTransaction(ClientSession session) {
            this.session = session;
        }

        @Override
        public Optional<Map<String, Object>> findOne(StoreCollection storeCollection, Map<String, Object> key) {
            Document document = collection(storeCollection).find(session, new Document(key)).first();
            return Optional.ofNullable(document).map(MongoRecordStore::toPlainMap);
        }

        @Override
        public void insert(StoreCollection storeCollection, Map<String, Object> row) {
            collection(storeCollection).insertOne(session, new Document(row));
        }

        @Override
        public void replace(StoreCollection storeCollection, Map<String, Object> key, Map<String, Object> row) {
            collection(storeCollection).replaceOne(session, new Document(key), new Document(row));
        }
    }
}
