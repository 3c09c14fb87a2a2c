package com.spendings.backend.services;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.bson.Document;
import org.springframework.stereotype.Service;

import com.spendings.backend.dto.CreatedResponseDTO;
import com.spendings.backend.dto.RecurringRequestDTO;
import com.spendings.backend.dto.RecurringResponseDTO;
import com.spendings.backend.dto.ReminderDTO;
import com.spendings.backend.entities.Recurring;
import com.spendings.backend.enums.EntryType;
import com.spendings.backend.enums.Frequency;
import com.spendings.backend.exceptions.BadRequestException;
import com.spendings.backend.mappers.DocumentValues;
import com.spendings.backend.mappers.RecurringMapper;
import com.spendings.backend.repositories.DocumentStore;
import com.spendings.backend.repositories.StoreCollection;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class RecurringService {

    private final DocumentStore documentStore;
    private final Clock clock;

    /**
     * Stores amount and type exactly as sent; no sign normalization happens for schedules.
     */
    public CreatedResponseDTO create(RecurringRequestDTO dto) {
        if (!Double.isFinite(dto.amount())) {
            throw new BadRequestException("amount must be a finite number");
        }

        Recurring entity = Recurring.builder()
                .clientId(dto.clientId())
                .label(dto.label())
                .amount(dto.amount())
                .category(dto.category())
                .frequency(dto.frequency() != null ? dto.frequency() : Frequency.MONTHLY)
                .type(dto.type() != null ? dto.type() : EntryType.INCOME)
                .nextDueDate(dto.nextDueDate() != null ? dto.nextDueDate() : clock.instant())
                .build();

        String id = documentStore.insert(StoreCollection.RECURRING, RecurringMapper.toDocument(entity));
        log.info("[Recurring] created id={} clientId={} label={} frequency={}",
                id, entity.getClientId(), entity.getLabel(), entity.getFrequency().getValue());

        return new CreatedResponseDTO(id);
    }

    public List<RecurringResponseDTO> list(String clientId) {
        return findAllByClient(clientId)
                .stream()
                .map(RecurringMapper::toResponseDTO)
                .toList();
    }

    /**
     * Schedules whose next due date is at or before now. Read only: due dates are not advanced, so
     * an item keeps showing up until its record changes.
     */
    public List<ReminderDTO> reminders(String clientId) {
        Instant now = clock.instant();
        return findAllByClient(clientId)
                .stream()
                .filter(doc -> !dueDateOf(doc, now).isAfter(now))
                .map(RecurringMapper::toReminderDTO)
                .toList();
    }

    /**
     * A missing or unreadable due date resolves to {@code now}: ambiguous schedules are reported as
     * due instead of being dropped.
     */
    Instant dueDateOf(Document doc, Instant now) {
        Object raw = doc.get(RecurringMapper.NEXT_DUE_DATE);
        Optional<Instant> parsed = DocumentValues.instant(raw);
        if (parsed.isPresent()) {
            return parsed.get();
        }
        log.warn("[Reminders] recurring {} has unreadable next_due_date '{}', treating as due",
                DocumentValues.idOf(doc), raw);
        return now;
    }

    private List<Document> findAllByClient(String clientId) {
        return documentStore.find(StoreCollection.RECURRING, Map.of(RecurringMapper.CLIENT_ID, clientId));
    }
}
