package com.imperium.companion.ai.extraction;

import com.imperium.companion.ai.context.ConversationContext;
import com.imperium.companion.model.entity.CheckIn;
import com.imperium.companion.model.entity.Conversation;
import com.imperium.companion.model.entity.JournalEntry;
import com.imperium.companion.model.entity.Message;
import com.imperium.companion.service.CheckInService;
import com.imperium.companion.service.JournalService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 按当前阶段选择抽取器并落库：check_in → 签到，journal_prompt → 日记，其余阶段不抽取。
 * <p>
 * 幂等：本轮用户消息 ID 作为 source_message_id；已有同键记录，或本次阶段停留期间
 * （created_at ≥ stage_entered_at）已建过同类记录时跳过。任何失败只记日志，不影响本轮。
 */
@Component
public class ExtractionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ExtractionPipeline.class);

    private final CheckInExtractor checkInExtractor;
    private final JournalExtractor journalExtractor;
    private final CheckInService checkInService;
    private final JournalService journalService;

    public ExtractionPipeline(CheckInExtractor checkInExtractor,
            JournalExtractor journalExtractor,
            CheckInService checkInService,
            JournalService journalService) {
        this.checkInExtractor = checkInExtractor;
        this.journalExtractor = journalExtractor;
        this.checkInService = checkInService;
        this.journalService = journalService;
    }

    public ExtractionOutcome run(String userId, Conversation conversation, Message userMessage,
            ConversationContext context) {
        try {
            return switch (context.phase()) {
                case CHECK_IN -> runCheckIn(userId, conversation, userMessage, context);
                case JOURNAL_PROMPT -> runJournal(userId, conversation, userMessage, context);
                default -> ExtractionOutcome.none();
            };
        } catch (RuntimeException e) {
            log.warn("Extraction step failed: conversationId={}, phase={}, error={}",
                    conversation.getId(), context.phase().getCode(), e.getMessage());
            return ExtractionOutcome.none();
        }
    }

    private ExtractionOutcome runCheckIn(String userId, Conversation conversation, Message userMessage,
            ConversationContext context) {
        if (checkInService.existsForSourceMessage(userId, userMessage.getId())
                || checkInService.existsSince(userId, conversation.getStageEnteredAt())) {
            log.info("Check-in already recorded for this phase visit: conversationId={}", conversation.getId());
            return ExtractionOutcome.none();
        }
        Optional<CheckInDraft> draft = checkInExtractor.extract(context.recentMessages());
        if (draft.isEmpty()) {
            return ExtractionOutcome.none();
        }
        CheckInDraft d = draft.get();
        CheckIn checkIn = checkInService.createCheckIn(userId, d.mood(), d.sleepQuality(), d.energyLevel(),
                d.intentions(), userMessage.getId());
        log.info("Check-in recorded from conversation: conversationId={}, checkInId={}, sleep={}, energy={}",
                conversation.getId(), checkIn.getId(), checkIn.getSleepQuality(), checkIn.getEnergyLevel());
        return ExtractionOutcome.of(checkIn);
    }

    private ExtractionOutcome runJournal(String userId, Conversation conversation, Message userMessage,
            ConversationContext context) {
        if (journalService.existsForSourceMessage(userId, userMessage.getId())
                || journalService.existsSince(userId, conversation.getStageEnteredAt())) {
            log.info("Journal entry already recorded for this phase visit: conversationId={}", conversation.getId());
            return ExtractionOutcome.none();
        }
        Optional<JournalDraft> draft = journalExtractor.extract(context.recentMessages());
        if (draft.isEmpty()) {
            return ExtractionOutcome.none();
        }
        JournalEntry entry = journalService.createEntry(userId, draft.get().title(), draft.get().content(),
                userMessage.getId());
        log.info("Journal entry recorded from conversation: conversationId={}, entryId={}, words={}",
                conversation.getId(), entry.getId(), entry.getWordCount());
        return ExtractionOutcome.of(entry);
    }
}
