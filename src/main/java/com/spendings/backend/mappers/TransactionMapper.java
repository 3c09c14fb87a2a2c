package com.spendings.backend.mappers;

import org.bson.Document;

import com.spendings.backend.dto.TransactionResponseDTO;
import com.spendings.backend.entities.Transaction;

public class TransactionMapper {

    public static final String CLIENT_ID = "client_id";
    public static final String AMOUNT = "amount";
    public static final String CATEGORY = "category";
    public static final String NOTE = "note";
    public static final String DATE = "date";
    public static final String TYPE = "type";
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";

    private TransactionMapper() {}

    public static Document toDocument(Transaction entity) {
        return new Document()
                .append(CLIENT_ID, entity.getClientId())
                .append(AMOUNT, entity.getAmount())
                .append(CATEGORY, entity.getCategory())
                .append(NOTE, entity.getNote())
                .append(DATE, DocumentValues.toDate(entity.getDate()))
                .append(TYPE, entity.getType().getValue());
    }

    public static TransactionResponseDTO toResponseDTO(Document doc) {
        return new TransactionResponseDTO(
                DocumentValues.idOf(doc),
                DocumentValues.text(doc, CLIENT_ID),
                DocumentValues.number(doc, AMOUNT),
                DocumentValues.text(doc, CATEGORY),
                DocumentValues.text(doc, NOTE),
                DocumentValues.isoText(doc.get(DATE)),
                DocumentValues.text(doc, TYPE),
                DocumentValues.isoText(doc.get(CREATED_AT)),
                DocumentValues.isoText(doc.get(UPDATED_AT))
        );
    }
}
