package com.imperium.companion.model.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 消息角色：user | assistant
 */
public enum Role {

    USER("user"),
    ASSISTANT("assistant");

    @EnumValue
    private final String code;

    Role(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static Role fromCode(String code) {
        if ("assistant".equalsIgnoreCase(code)) {
            return ASSISTANT;
        }
        if ("user".equalsIgnoreCase(code)) {
            return USER;
        }
        throw new IllegalArgumentException("Unknown role: " + code);
    }
}
