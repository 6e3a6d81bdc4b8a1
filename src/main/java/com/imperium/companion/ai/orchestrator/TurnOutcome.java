package com.imperium.companion.ai.orchestrator;

import com.imperium.companion.ai.extraction.ExtractionOutcome;
import com.imperium.companion.ai.stage.TransitionDecision;
import com.imperium.companion.ai.suggestion.SuggestedReply;
import com.imperium.companion.model.enums.Phase;

import java.util.List;

/**
 * 一轮结束后的结果：提交后的阶段、切换判定、抽取记录与下一轮快捷回复。
 */
public record TurnOutcome(Phase phase,
        Phase previousPhase,
        boolean transitioned,
        TransitionDecision decision,
        ExtractionOutcome extraction,
        List<SuggestedReply> suggestedReplies) {
}
