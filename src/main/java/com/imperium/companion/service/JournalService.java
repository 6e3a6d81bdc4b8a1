package com.imperium.companion.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.companion.model.dto.stats.JournalStatsResponse;
import com.imperium.companion.model.entity.JournalEntry;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public interface JournalService extends IService<JournalEntry> {

    /** 直接创建时正文最少字符数 */
    int MIN_CONTENT_LENGTH = 10;

    /**
     * 创建日记。标题为空时取正文首行；词数由正文推导。
     *
     * @throws com.imperium.companion.exception.DomainValidationException 正文不足 10 个字符
     */
    JournalEntry createEntry(String userId, String title, String content, String sourceMessageId);

    /** 部分更新：null 字段保持不变 */
    JournalEntry updateEntry(String userId, String entryId, String title, String content);

    JournalEntry updateInsights(String userId, String entryId, Map<String, Object> insights);

    void deleteEntry(String userId, String entryId);

    JournalEntry getOwned(String userId, String entryId);

    /** 最近日记，最新在前 */
    List<JournalEntry> recent(String userId, int limit);

    /** 标题或正文包含 term（忽略大小写） */
    List<JournalEntry> search(String userId, String term, int limit);

    long countForUser(String userId);

    boolean existsForSourceMessage(String userId, String sourceMessageId);

    boolean existsSince(String userId, LocalDateTime since);

    JournalStatsResponse stats(String userId);
}
