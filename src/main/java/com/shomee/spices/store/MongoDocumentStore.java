package com.shomee.spices.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import com.mongodb.MongoException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.shomee.spices.error.StoreQueryException;
import com.shomee.spices.error.StoreUnavailableException;
import com.shomee.spices.error.StoreWriteException;

@Repository
public class MongoDocumentStore implements DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoDocumentStore.class);

    private final MongoTemplate mongoTemplate;

    public MongoDocumentStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<Document> listDocuments(String collection, Map<String, Object> filter, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Query query = new Query().limit(limit);
        filter.forEach((field, value) -> query.addCriteria(Criteria.where(field).is(value)));
        try {
            List<Document> documents = mongoTemplate.find(query, Document.class, collection);
            documents.forEach(MongoDocumentStore::stringifyId);
            return documents;
        } catch (RuntimeException e) {
            if (isUnavailable(e)) {
                throw new StoreUnavailableException("document store unavailable", e);
            }
            throw new StoreQueryException("query on '" + collection + "' failed", e);
        }
    }

    @Override
    public String createDocument(String collection, Document record) {
        Document copy = new Document(record);
        try {
            Document inserted = mongoTemplate.insert(copy, collection);
            String id = String.valueOf(inserted.get(ID_FIELD));
            logger.atInfo().log("Inserted document {} into {}", id, collection);
            return id;
        } catch (RuntimeException e) {
            if (isUnavailable(e)) {
                throw new StoreUnavailableException("document store unavailable", e);
            }
            throw new StoreWriteException("insert into '" + collection + "' failed", e);
        }
    }

    @Override
    public List<String> listCollectionNames() {
        try {
            return new ArrayList<>(mongoTemplate.getCollectionNames());
        } catch (RuntimeException e) {
            if (isUnavailable(e)) {
                throw new StoreUnavailableException("document store unavailable", e);
            }
            throw new StoreQueryException("listing collections failed", e);
        }
    }

    @Override
    public String databaseName() {
        try {
            mongoTemplate.executeCommand(new Document("ping", 1));
            return mongoTemplate.getDb().getName();
        } catch (RuntimeException e) {
            if (isUnavailable(e)) {
                throw new StoreUnavailableException("document store unavailable", e);
            }
            throw new StoreQueryException("ping failed", e);
        }
    }

    static void stringifyId(Document document) {
        Object id = document.get(ID_FIELD);
        if (id instanceof ObjectId objectId) {
            document.put(ID_FIELD, objectId.toHexString());
        } else if (id != null) {
            document.put(ID_FIELD, id.toString());
        }
    }

    private static boolean isUnavailable(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof DataAccessResourceFailureException
                || t instanceof MongoTimeoutException
                || t instanceof MongoSocketException) {
                return true;
            }
            if (!(t instanceof DataAccessException || t instanceof MongoException)) {
                break;
            }
        }
        return false;
    }
}
