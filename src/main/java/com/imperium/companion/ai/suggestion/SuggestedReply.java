package com.imperium.companion.ai.suggestion;

import com.imperium.companion.model.enums.ReplyKind;

/**
 * 快捷回复：text 为按钮文案，kind 区分简短（quick）与展开（detailed）。
 */
public record SuggestedReply(String text, ReplyKind kind) {

    public static SuggestedReply quick(String text) {
        return new SuggestedReply(text, ReplyKind.QUICK);
    }

    public static SuggestedReply detailed(String text) {
        return new SuggestedReply(text, ReplyKind.DETAILED);
    }
}
