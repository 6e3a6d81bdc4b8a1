package com.imperium.companion.exception;

/**
 * 同一会话的上一轮尚未结束，等待超时。
 */
public class ConversationBusyException extends RuntimeException {

    public ConversationBusyException(String key) {
        super("Another turn is still in progress for " + key);
    }
}
