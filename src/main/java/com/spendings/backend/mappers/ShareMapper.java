package com.spendings.backend.mappers;

import org.bson.Document;

import com.spendings.backend.entities.Share;

public class ShareMapper {

    public static final String CLIENT_ID = "client_id";
    public static final String TOKEN = "token";
    public static final String CREATED_AT = "created_at";

    private ShareMapper() {}

    public static Document toDocument(Share entity) {
        return new Document()
                .append(CLIENT_ID, entity.getClientId())
                .append(TOKEN, entity.getToken())
                .append(CREATED_AT, DocumentValues.toDate(entity.getCreatedAt()));
    }
}
