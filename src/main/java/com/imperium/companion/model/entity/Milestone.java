package com.imperium.companion.model.entity;

import com.baomidou.mybatisplus.annotation.FieldStrategy;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 成就（里程碑）表实体，对应 milestones 表。
 * <p>
 * (user_id, type) 唯一；unlocked = true 时 progress 必为 100 且 unlocked_at 非空。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("milestones")
public class Milestone {

    @TableId
    private String id;

    @TableField("user_id")
    private String userId;

    /** 稳定类型键，如 check_in_streak_7，用于“是否已授予”判断 */
    private String type;

    /** 展示名 */
    private String name;

    private String description;

    /** 进度 0~100 */
    private Integer progress;

    private Boolean unlocked;

    /** 进度回落时需写回 null */
    @TableField(value = "unlocked_at", updateStrategy = FieldStrategy.ALWAYS)
    private LocalDateTime unlockedAt;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
