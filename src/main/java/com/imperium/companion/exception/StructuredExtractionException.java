package com.imperium.companion.exception;

/**
 * 结构化抽取调用失败：服务不可用、超时或返回内容无法按 schema 解析。
 * <p>
 * 仅在引擎内部流转，调用方降级为“不建记录 / 不切换阶段”，不会返回给 HTTP 客户端。
 */
public class StructuredExtractionException extends RuntimeException {

    public StructuredExtractionException(String message) {
        super(message);
    }

    public StructuredExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
