package com.imperium.companion.ai.extraction;

import com.imperium.companion.exception.StructuredExtractionException;

/**
 * 结构化抽取调用：给定提示词与 schema，返回严格按 schema 解析的对象。
 */
public interface StructuredExtractionClient {

    /**
     * @throws StructuredExtractionException 服务失败、超时或返回内容不符合 schema
     */
    <T> T extract(String prompt, ExtractionSchema<T> schema);
}
