package com.imperium.companion.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 每日签到表实体，对应 check_ins 表。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("check_ins")
public class CheckIn {

    @TableId
    private String id;

    @TableField("user_id")
    private String userId;

    /** 情绪（自由文本） */
    private String mood;

    /** 睡眠质量 1~5 */
    @TableField("sleep_quality")
    private Integer sleepQuality;

    /** 精力 1~5 */
    @TableField("energy_level")
    private Integer energyLevel;

    /** 今日意图 */
    private String intentions;

    /** 产生该记录的用户消息ID（对话抽取时的幂等键；直接创建时为空） */
    @TableField("source_message_id")
    private String sourceMessageId;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
