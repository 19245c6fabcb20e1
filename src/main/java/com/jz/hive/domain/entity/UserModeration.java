package com.jz.hive.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 用户审核台账，一人一行。第一次违规时创建，之后只由审核状态机修改，不删除。
 * suspensionEndsAt 不为空时 warningCount 一定大于 0。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("user_moderation")
public class UserModeration {

    @TableId(type = IdType.INPUT)
    private String userId;

    private Integer warningCount;

    private LocalDateTime suspensionEndsAt;

    /** warning_incremented / suspended / suspension_removed */
    private String lastAction;
    private LocalDateTime lastActionAt;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;
}
