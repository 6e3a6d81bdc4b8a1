package com.imperium.companion.exception;

/**
 * 按用户范围查找的记录不存在。映射为 404 not_found。
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resource, String id) {
        super(resource + " not found: " + id);
    }
}
