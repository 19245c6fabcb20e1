package com.jz.hive.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.*;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("conversation_member")
public class ConversationMember {

    public static final String ROLE_ADMIN = "admin";
    public static final String ROLE_MEMBER = "member";

    @TableId(type = IdType.AUTO)
    private Long id;

    private String conversationId;
    private String userId;

    private String displayName;
    private String avatarRef;

    private String role;

    private LocalDateTime joinedAt;
}
