package com.spendings.backend.mappers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.time.Instant;
import java.util.Date;

import org.bson.Document;
import org.junit.jupiter.api.Test;

class DocumentValuesTest {

    @Test
    void parseTimestamp_acceptsOffsetLocalAndDateOnlyForms() {
        assertThat(DocumentValues.parseTimestamp("2026-03-01T10:00:00Z")).contains(Instant.parse("2026-03-01T10:00:00Z"));
        assertThat(DocumentValues.parseTimestamp("2026-03-01T10:00:00.250000+02:00"))
                .contains(Instant.parse("2026-03-01T08:00:00.250Z"));
        assertThat(DocumentValues.parseTimestamp("2026-03-01T10:00")).contains(Instant.parse("2026-03-01T10:00:00Z"));
        assertThat(DocumentValues.parseTimestamp("2026-03-01")).contains(Instant.parse("2026-03-01T00:00:00Z"));
    }

    @Test
    void parseTimestamp_rejectsGarbage() {
        assertThat(DocumentValues.parseTimestamp("tomorrow")).isEmpty();
        assertThat(DocumentValues.parseTimestamp("2026-13-01")).isEmpty();
        assertThat(DocumentValues.parseTimestamp("")).isEmpty();
    }

    @Test
    void instant_readsDatesAndIgnoresOtherShapes() {
        Instant at = Instant.parse("2026-01-01T00:00:00Z");

        assertThat(DocumentValues.instant(Date.from(at))).contains(at);
        assertThat(DocumentValues.instant(42)).isEmpty();
        assertThat(DocumentValues.instant(null)).isEmpty();
    }

    @Test
    void isoText_rendersDatesAndPassesTextThrough() {
        assertEquals("2026-01-01T10:15:30Z", DocumentValues.isoText(Date.from(Instant.parse("2026-01-01T10:15:30Z"))));
        assertEquals("whenever", DocumentValues.isoText("whenever"));
        assertNull(DocumentValues.isoText(null));
    }

    @Test
    void number_readsAnyNumericType() {
        Document doc = new Document("a", 3).append("b", 2L).append("c", "x");

        assertEquals(3.0, DocumentValues.number(doc, "a"));
        assertEquals(2.0, DocumentValues.number(doc, "b"));
        assertNull(DocumentValues.number(doc, "c"));
        assertEquals(0.0, DocumentValues.amountOrZero(doc, "missing"));
    }
}
