package com.imperium.companion.model.entity;

import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.imperium.companion.model.enums.Role;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 消息表实体，对应 messages 表。只追加，按 created_at 排序。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("messages")
public class Message {

    /** 消息ID */
    @TableId
    private String id;

    /** 所属会话ID */
    @TableField("conversation_id")
    private String conversationId;

    /** 角色：user | assistant */
    private Role role;

    /** 消息内容 */
    private String content;

    /** 创建时间（单调递增，同一会话内不重复） */
    @TableField("created_at")
    private LocalDateTime createdAt;
}
