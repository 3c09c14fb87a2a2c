package com.spendings.backend.mappers;

import org.bson.Document;

import com.spendings.backend.dto.RecurringResponseDTO;
import com.spendings.backend.dto.ReminderDTO;
import com.spendings.backend.entities.Recurring;

public class RecurringMapper {

    public static final String CLIENT_ID = "client_id";
    public static final String LABEL = "label";
    public static final String AMOUNT = "amount";
    public static final String CATEGORY = "category";
    public static final String FREQUENCY = "frequency";
    public static final String TYPE = "type";
    public static final String NEXT_DUE_DATE = "next_due_date";

    private RecurringMapper() {}

    public static Document toDocument(Recurring entity) {
        return new Document()
                .append(CLIENT_ID, entity.getClientId())
                .append(LABEL, entity.getLabel())
                .append(AMOUNT, entity.getAmount())
                .append(CATEGORY, entity.getCategory())
                .append(FREQUENCY, entity.getFrequency().getValue())
                .append(TYPE, entity.getType().getValue())
                .append(NEXT_DUE_DATE, DocumentValues.toDate(entity.getNextDueDate()));
    }

    public static RecurringResponseDTO toResponseDTO(Document doc) {
        return new RecurringResponseDTO(
                DocumentValues.idOf(doc),
                DocumentValues.text(doc, CLIENT_ID),
                DocumentValues.text(doc, LABEL),
                DocumentValues.number(doc, AMOUNT),
                DocumentValues.text(doc, CATEGORY),
                DocumentValues.text(doc, FREQUENCY),
                DocumentValues.text(doc, TYPE),
                DocumentValues.isoText(doc.get(NEXT_DUE_DATE))
        );
    }

    // next_due_date fica de fora do lembrete
    public static ReminderDTO toReminderDTO(Document doc) {
        return new ReminderDTO(
                DocumentValues.text(doc, LABEL),
                DocumentValues.text(doc, CATEGORY),
                DocumentValues.number(doc, AMOUNT)
        );
    }
}
