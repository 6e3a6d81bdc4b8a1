package com.imperium.companion.ai.stage;

import com.imperium.companion.model.enums.Phase;

/**
 * 某阶段回复生成所需的系统提示与输出上限。
 */
public record PromptDirectives(Phase phase, String systemPrompt, int maxTokens) {
}
