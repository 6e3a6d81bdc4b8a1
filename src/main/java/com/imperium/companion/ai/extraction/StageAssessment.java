package com.imperium.companion.ai.extraction;

import java.util.List;

/**
 * 阶段完成度评估：已满足的判据编号（从 1 开始）与简短理由。
 * 是否切换阶段由本地根据编号计数决定，模型不直接给出结论。
 */
public record StageAssessment(List<Integer> satisfiedCriteria, String reasoning) {
}
