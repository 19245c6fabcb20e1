package com.jz.hive.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.*;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("conversation")
public class Conversation {

    public static final String KIND_DIRECT = "direct";
    public static final String KIND_GROUP = "group";

    /** 群聊为生成的 id；单聊为两个 userId 排序后用 "_" 拼接 */
    @TableId(type = IdType.INPUT)
    private String id;

    private String kind;

    /** 群名；单聊为空，展示名取对方昵称 */
    private String name;
    private String avatarRef;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    public boolean isGroup() {
        return KIND_GROUP.equals(kind);
    }
}
