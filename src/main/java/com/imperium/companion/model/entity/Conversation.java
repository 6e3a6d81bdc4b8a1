package com.imperium.companion.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.imperium.companion.model.enums.Phase;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话表实体，对应 conversations 表。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("conversations")
public class Conversation {

    /** 会话ID */
    @TableId
    private String id;

    /** 所属用户ID（由身份提供方给出） */
    @TableField("user_id")
    private String userId;

    /** 会话标题（取自首条用户消息摘要） */
    private String title;

    /** 当前引导阶段，仅由阶段状态机写入 */
    private Phase stage;

    /** 进入当前阶段的时间，用于统计本阶段内的用户轮次 */
    @TableField("stage_entered_at")
    private LocalDateTime stageEnteredAt;

    /** 创建时间 */
    @TableField("created_at")
    private LocalDateTime createdAt;

    /** 最后更新时间 */
    @TableField("updated_at")
    private LocalDateTime updatedAt;
}
