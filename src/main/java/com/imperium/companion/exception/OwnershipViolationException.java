package com.imperium.companion.exception;

/**
 * 记录属于其他用户。映射为 403 forbidden。
 */
public class OwnershipViolationException extends RuntimeException {

    public OwnershipViolationException(String resource) {
        super("userId does not match " + resource);
    }
}
