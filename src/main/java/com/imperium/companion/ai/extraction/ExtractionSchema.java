package com.imperium.companion.ai.extraction;

/**
 * 结构化抽取的版本化 schema：payload 类型 + 名称 + 版本 + 采样温度。
 * <p>
 * payload 的字段集合变化时必须提升 version，日志与解析错误中都会带上 {@link #id()}。
 */
public record ExtractionSchema<T>(String name, int version, Class<T> type, double temperature) {

    public static final ExtractionSchema<CheckInExtraction> CHECK_IN =
            new ExtractionSchema<>("check_in", 1, CheckInExtraction.class, 0.1);

    public static final ExtractionSchema<JournalExtraction> JOURNAL =
            new ExtractionSchema<>("journal", 1, JournalExtraction.class, 0.2);

    public static final ExtractionSchema<StageAssessment> STAGE_ASSESSMENT =
            new ExtractionSchema<>("stage_assessment", 1, StageAssessment.class, 0.1);

    public static final int MAX_CONFIDENCE = 100;

    /**
     * 置信度必须在 0~100；越界时抛出，由 Jackson 包装为解析失败。
     */
    static void requireConfidence(int confidence) {
        if (confidence < 0 || confidence > MAX_CONFIDENCE) {
            throw new IllegalArgumentException("confidence must be within 0.." + MAX_CONFIDENCE + ", got " + confidence);
        }
    }

    public String id() {
        return name + ".v" + version;
    }
}
