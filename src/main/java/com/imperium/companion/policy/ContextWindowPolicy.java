package com.imperium.companion.policy;

/**
 * 上下文窗口：每次决策读取的最近消息、签到与成就数量。
 */
public final class ContextWindowPolicy {

    /** 最近消息条数（按时间升序返回） */
    public static final int RECENT_MESSAGES = 10;

    /** 最近签到条数（最新在前） */
    public static final int RECENT_CHECK_INS = 3;

    /** 最近成就条数（最新在前） */
    public static final int RECENT_ACHIEVEMENTS = 5;

    private ContextWindowPolicy() {}
}
