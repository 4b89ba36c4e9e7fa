package com.shomee.spices.store;

import java.util.List;
import java.util.Map;

import org.bson.Document;

import com.shomee.spices.error.StoreQueryException;
import com.shomee.spices.error.StoreUnavailableException;
import com.shomee.spices.error.StoreWriteException;

/**
 * Reads and writes schemaless documents in named collections. Identifiers
 * leave the store only in string form.
 */
public interface DocumentStore {

    String ID_FIELD = "_id";

    /**
     * Finds up to {@code limit} documents whose fields equal every entry of
     * {@code filter}. An empty filter matches all documents; no ordering is
     * guaranteed.
     *
     * @throws StoreUnavailableException if the store cannot be reached
     * @throws StoreQueryException if the query itself fails
     */
    List<Document> listDocuments(String collection, Map<String, Object> filter, int limit);

    /**
     * Inserts one document. The argument is not modified.
     *
     * @return the store-assigned identifier
     * @throws StoreUnavailableException if the store cannot be reached
     * @throws StoreWriteException if the insert fails
     */
    String createDocument(String collection, Document record);

    List<String> listCollectionNames();

    /**
     * Pings the server and returns the configured database name.
     *
     * @throws StoreUnavailableException if the store cannot be reached
     */
    String databaseName();
}
