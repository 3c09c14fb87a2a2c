package com.spendings.backend.repositories;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.bson.Document;

/**
 * Minimal document collection contract used by the services.
 *
 * Filters are exact-match on every entry. No ordering is guaranteed for {@code find}; callers
 * sort in memory where order matters.
 */
public interface DocumentStore {

    /**
     * Stores the document and returns the store-assigned identifier in text form.
     */
    String insert(StoreCollection collection, Document document);

    default List<Document> find(StoreCollection collection, Map<String, Object> filter) {
        return find(collection, filter, 0);
    }

    /**
     * @param limit maximum number of documents, 0 for all of them
     */
    List<Document> find(StoreCollection collection, Map<String, Object> filter, int limit);

    Collection<String> collectionNames();

    String databaseName();
}
