package com.imperium.companion.ai.extraction;

public record JournalDraft(String title, String content) {
}
