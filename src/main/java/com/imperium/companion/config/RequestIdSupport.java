package com.imperium.companion.config;

import com.imperium.companion.exception.MissingIdentityException;
import jakarta.servlet.http.HttpServletRequest;

import java.util.UUID;

public final class RequestIdSupport {

    public static final String HEADER_REQUEST_ID = "X-Request-Id";
    public static final String ATTR_REQUEST_ID = "requestId";

    /** 外部身份提供方写入的用户标识头 */
    public static final String HEADER_USER_ID = "X-User-Id";
    public static final String MDC_USER_ID = "userId";

    private RequestIdSupport() {
    }

    public static String newRequestId() {
        return "req_" + shortUuid();
    }

    /** 带前缀的短 ID，如 c_xxx、m_xxx */
    public static String newId(String prefix) {
        return prefix + "_" + shortUuid();
    }

    /**
     * 校验用户标识头存在，返回去除首尾空白后的值。
     *
     * @throws MissingIdentityException 缺失或为空白
     */
    public static String requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new MissingIdentityException();
        }
        return userId.trim();
    }

    public static String resolve(HttpServletRequest request) {
        if (request == null) {
            return newRequestId();
        }
        Object attr = request.getAttribute(ATTR_REQUEST_ID);
        if (attr instanceof String value && !value.isBlank()) {
            return value;
        }
        String headerValue = request.getHeader(HEADER_REQUEST_ID);
        if (headerValue != null && !headerValue.isBlank()) {
            return headerValue;
        }
        String generated = newRequestId();
        request.setAttribute(ATTR_REQUEST_ID, generated);
        return generated;
    }

    private static String shortUuid() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
