package com.imperium.companion.policy;

/**
 * 标题生成规则。
 */
public final class TitlePolicy {

    public static final String DEFAULT_CONVERSATION_TITLE = "New Recovery Session";
    public static final String DEFAULT_JOURNAL_TITLE = "Journal Entry";

    public static final int CONVERSATION_TITLE_MAX = 50;
    public static final int JOURNAL_TITLE_MAX = 60;

    /** 会话标题：首条用户消息前 50 字符，超出追加 "..." */
    public static String conversationTitle(String firstUserMessage) {
        if (firstUserMessage == null || firstUserMessage.isBlank()) {
            return DEFAULT_CONVERSATION_TITLE;
        }
        return truncate(firstUserMessage.trim(), CONVERSATION_TITLE_MAX);
    }

    /**
     * 日记标题：优先使用给定标题，否则取正文首行；均截断到 60 字符 + "..."。
     */
    public static String journalTitle(String suggestedTitle, String content) {
        if (suggestedTitle != null && !suggestedTitle.isBlank()) {
            return truncate(suggestedTitle.trim(), JOURNAL_TITLE_MAX);
        }
        if (content == null || content.isBlank()) {
            return DEFAULT_JOURNAL_TITLE;
        }
        String firstLine = content.trim().split("\\R", 2)[0].trim();
        return truncate(firstLine, JOURNAL_TITLE_MAX);
    }

    /** 按空白切分计数 */
    public static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }

    private static String truncate(String value, int max) {
        return value.length() > max ? value.substring(0, max) + "..." : value;
    }

    private TitlePolicy() {}
}
