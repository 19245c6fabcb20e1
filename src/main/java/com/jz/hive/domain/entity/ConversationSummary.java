package com.jz.hive.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 收件箱里的一行：每个成员、每个会话各一行，N 个成员就有 N 行。
 * (ownerUserId, peerId) 唯一；群聊 peerId = 群 id，单聊 peerId = 对方 userId。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("conversation_summary")
public class ConversationSummary {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String ownerUserId;
    private String peerId;
    private String conversationId;

    /** direct / group */
    private String kind;

    private String displayName;
    private String avatarRef;

    private String lastMessage;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime updatedAt;

    private Integer unreadCount;
}
