package com.jz.hive.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.*;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("notification")
public class Notification {

    public static final String TYPE_MESSAGE = "message";

    @TableId(type = IdType.AUTO)
    private Long id;

    private String userId;

    /** message / group_invite / session_reminder / friend_request */
    private String type;

    private String title;
    private String body;

    /** 会话 id 等 */
    private String relatedId;

    private Boolean isRead;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;
}
