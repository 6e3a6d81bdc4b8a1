package com.imperium.companion.ai.stage;

/**
 * 阶段切换判定结果。
 *
 * @param transition       是否切换到下一阶段
 * @param reason           判定原因
 * @param rationale        说明（模型理由或失败原因）
 * @param criteriaMet      满足的判据数
 * @param criteriaRequired 需要的判据数
 */
public record TransitionDecision(boolean transition,
        Reason reason,
        String rationale,
        int criteriaMet,
        int criteriaRequired) {

    public enum Reason {
        /** 本阶段用户轮次不足，未调用评估 */
        BELOW_MINIMUM,
        CRITERIA_MET,
        CRITERIA_NOT_MET,
        /** 评估服务失败、超时或返回无法解析，保持当前阶段 */
        SERVICE_FAILURE
    }

    public static TransitionDecision belowMinimum(long userTurns, int minUserTurns, int required) {
        return new TransitionDecision(false, Reason.BELOW_MINIMUM,
                "Need at least " + minUserTurns + " user turns in this phase (currently " + userTurns + ")",
                0, required);
    }

    public static TransitionDecision serviceFailure(String cause, int required) {
        return new TransitionDecision(false, Reason.SERVICE_FAILURE, cause, 0, required);
    }

    public static TransitionDecision evaluated(int met, int required, String rationale) {
        boolean transition = met >= required;
        return new TransitionDecision(transition,
                transition ? Reason.CRITERIA_MET : Reason.CRITERIA_NOT_MET,
                rationale, met, required);
    }
}
