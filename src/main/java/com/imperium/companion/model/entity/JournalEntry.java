package com.imperium.companion.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 日记表实体，对应 journal_entries 表。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("journal_entries")
public class JournalEntry {

    @TableId
    private String id;

    @TableField("user_id")
    private String userId;

    /** 标题（可空） */
    private String title;

    /** 正文 */
    private String content;

    /** 词数，由正文推导 */
    @TableField("word_count")
    private Integer wordCount;

    /** AI 洞察（JSON） */
    @TableField("ai_insights")
    private String aiInsightsJson;

    /** 产生该记录的用户消息ID（对话抽取时的幂等键；直接创建时为空） */
    @TableField("source_message_id")
    private String sourceMessageId;

    @TableField("created_at")
    private LocalDateTime createdAt;

    @TableField("updated_at")
    private LocalDateTime updatedAt;
}
