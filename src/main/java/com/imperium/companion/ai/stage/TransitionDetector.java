package com.imperium.companion.ai.stage;

import com.imperium.companion.ai.extraction.ExtractionSchema;
import com.imperium.companion.ai.extraction.StageAssessment;
import com.imperium.companion.ai.extraction.StructuredExtractionClient;
import com.imperium.companion.exception.StructuredExtractionException;
import com.imperium.companion.model.entity.Message;
import com.imperium.companion.model.enums.Phase;
import com.imperium.companion.model.enums.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * 阶段切换判定：先检查本阶段最少用户轮次，再做一次结构化评估。
 * <p>
 * 评估只报告已满足的判据编号，是否切换由本地按“有效且去重的编号数 ≥ 需要数”计算。
 * 评估失败一律不切换。
 */
@Component
public class TransitionDetector {

    private static final Logger log = LoggerFactory.getLogger(TransitionDetector.class);

    private final StructuredExtractionClient extractionClient;

    public TransitionDetector(StructuredExtractionClient extractionClient) {
        this.extractionClient = extractionClient;
    }

    public TransitionDecision shouldTransition(Phase phase, List<Message> recentMessages, long userTurnCountInPhase) {
        StageCriteria criteria = StageCriteria.forPhase(phase);
        if (userTurnCountInPhase < criteria.minUserTurns()) {
            return TransitionDecision.belowMinimum(userTurnCountInPhase, criteria.minUserTurns(), criteria.required());
        }

        StageAssessment assessment;
        try {
            assessment = extractionClient.extract(buildPrompt(phase, criteria, recentMessages),
                    ExtractionSchema.STAGE_ASSESSMENT);
        } catch (StructuredExtractionException e) {
            log.warn("Stage assessment failed, keeping phase {}: {}", phase.getCode(), e.getMessage());
            return TransitionDecision.serviceFailure(e.getMessage(), criteria.required());
        }

        int met = countSatisfied(assessment.satisfiedCriteria(), criteria.criteria().size());
        return TransitionDecision.evaluated(met, criteria.required(),
                assessment.reasoning() != null ? assessment.reasoning() : "");
    }

    /** 只统计 1..size 范围内的去重编号 */
    static int countSatisfied(List<Integer> reported, int size) {
        if (reported == null) {
            return 0;
        }
        return (int) reported.stream()
                .filter(Objects::nonNull)
                .filter(n -> n >= 1 && n <= size)
                .distinct()
                .count();
    }

    static String buildPrompt(Phase phase, StageCriteria criteria, List<Message> recentMessages) {
        String conversation = recentMessages.stream()
                .filter(m -> m.getContent() != null)
                .map(m -> (m.getRole() == Role.USER ? "User" : "AI") + ": " + m.getContent())
                .collect(Collectors.joining("\n"));
        String numbered = IntStream.range(0, criteria.criteria().size())
                .mapToObj(i -> (i + 1) + ". " + criteria.criteria().get(i))
                .collect(Collectors.joining("\n"));
        return """
                You are analyzing a recovery companion conversation to determine if the current stage is complete.

                Current Stage: %s
                Stage Description: %s

                Criteria for completion:
                %s

                Recent Conversation:
                %s

                Analyze the conversation and report:
                1. satisfiedCriteria: the numbers of the criteria above that the user has met (be flexible with natural language variations); an empty list if none
                2. reasoning: a brief explanation
                """.formatted(phase.getCode(), criteria.description(), numbered, conversation);
    }
}
