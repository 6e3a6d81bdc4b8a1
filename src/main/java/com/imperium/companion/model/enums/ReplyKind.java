package com.imperium.companion.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 快捷回复类型：quick 为短句，detailed 为引导用户展开的长句。
 */
public enum ReplyKind {

    QUICK("quick"),
    DETAILED("detailed");

    private final String code;

    ReplyKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
