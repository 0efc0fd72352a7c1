package org.driftlens.obs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.bson.BsonDocument;
import org.junit.jupiter.api.Test;

class RunJournalTest {
    @Test
    void keepsOnlyTheMostRecentEntries() {
        RunJournal journal = new RunJournal(2);

        journal.record("A{}", 10L, null);
        journal.record("B{}", 20L, "  ");
        journal.record("C{}", 30L, "boom");

        List<RunJournal.Entry> entries = journal.entries();
        assertEquals(2, journal.size());
        assertEquals(1L, journal.droppedCount());
        assertEquals(2L, entries.get(0).sequence());
        assertEquals("B{}", entries.get(0).unit());
        assertFalse(entries.get(0).failed());
        assertEquals(3L, entries.get(1).sequence());
        assertTrue(entries.get(1).failed());
        assertEquals("boom", entries.get(1).error());
    }

    @Test
    void documentListsEntriesWithErrorsOnlyWhenFailed() {
        RunJournal journal = new RunJournal(4);
        journal.record("A{}", 5L, null);
        journal.record("B{}", 7L, "boom");

        BsonDocument document = journal.toDocument();

        assertEquals(4, document.getInt32("capacity").getValue());
        assertEquals(2, document.getInt32("size").getValue());
        assertEquals(0L, document.getInt64("dropped").getValue());
        BsonDocument first = document.getArray("entries").get(0).asDocument();
        BsonDocument second = document.getArray("entries").get(1).asDocument();
        assertFalse(first.containsKey("error"));
        assertEquals("boom", second.getString("error").getValue());
        assertTrue(second.getBoolean("failed").getValue());
    }

    @Test
    void clearResetsEntriesButNotSequence() {
        RunJournal journal = new RunJournal(1);
        journal.record("A{}", 1L, null);
        journal.record("B{}", 1L, null);
        journal.clear();
        journal.record("C{}", 1L, null);

        assertEquals(0L, journal.droppedCount());
        assertEquals(3L, journal.entries().get(0).sequence());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new RunJournal(0));
    }
}
