package com.spendings.backend.repositories;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Repository
@RequiredArgsConstructor
@Slf4j
public class MongoDocumentStore implements DocumentStore {

    private static final String ID_FIELD = "_id";

    private final MongoTemplate mongoTemplate;

    @Override
    public String insert(StoreCollection collection, Document document) {
        Document saved = mongoTemplate.insert(document, collection.getCollectionName());
        Object id = saved.get(ID_FIELD);
        log.debug("[Mongo] inserted {} into {}", id, collection.getCollectionName());
        return String.valueOf(id);
    }

    @Override
    public List<Document> find(StoreCollection collection, Map<String, Object> filter, int limit) {
        Query query = new Query();
        filter.forEach((field, value) -> query.addCriteria(Criteria.where(field).is(value)));
        if (limit > 0) {
            query.limit(limit);
        }
        return mongoTemplate.find(query, Document.class, collection.getCollectionName());
    }

    @Override
    public Collection<String> collectionNames() {
        return mongoTemplate.getCollectionNames();
    }

    @Override
    public String databaseName() {
        return mongoTemplate.getDb().getName();
    }
}
