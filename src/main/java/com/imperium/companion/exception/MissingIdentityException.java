package com.imperium.companion.exception;

/**
 * 请求未携带用户标识（X-User-Id）。
 */
public class MissingIdentityException extends RuntimeException {

    public MissingIdentityException() {
        super("X-User-Id is required");
    }
}
