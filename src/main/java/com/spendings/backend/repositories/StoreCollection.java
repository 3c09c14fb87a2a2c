package com.spendings.backend.repositories;

/**
 * Storage namespace of each record kind.
 */
public enum StoreCollection {
    TRANSACTION("transaction"),
    RECURRING("recurring"),
    SHARE("share");

    private final String collectionName;

    StoreCollection(String collectionName) {
        this.collectionName = collectionName;
    }

    public String getCollectionName() {
        return collectionName;
    }
}
