package com.imperium.companion.ai.extraction;

import com.imperium.companion.model.entity.CheckIn;
import com.imperium.companion.model.entity.JournalEntry;

/**
 * 本轮抽取产生的记录，至多一条。
 */
public record ExtractionOutcome(CheckIn checkIn, JournalEntry journalEntry) {

    private static final ExtractionOutcome NONE = new ExtractionOutcome(null, null);

    public static ExtractionOutcome none() {
        return NONE;
    }

    public static ExtractionOutcome of(CheckIn checkIn) {
        return new ExtractionOutcome(checkIn, null);
    }

    public static ExtractionOutcome of(JournalEntry journalEntry) {
        return new ExtractionOutcome(null, journalEntry);
    }

    public boolean created() {
        return checkIn != null || journalEntry != null;
    }
}
