package com.imperium.companion.exception;

/**
 * 领域校验失败（如签到评分越界、日记正文过短）。映射为 400 invalid_argument。
 */
public class DomainValidationException extends RuntimeException {

    /** 出错字段，可为 null */
    private final String field;

    public DomainValidationException(String message) {
        this(null, message);
    }

    public DomainValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
