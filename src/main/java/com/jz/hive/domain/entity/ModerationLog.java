package com.jz.hive.domain.entity;


import com.baomidou.mybatisplus.annotation.*;
import lombok.*;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("moderation_log")
public class ModerationLog {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String userId;

    /** warning / final_warning / suspension / suspension_removed */
    private String action;

    private String reason;

    /** 仅存前 100 字截断文本，解封记录为空 */
    private String messageExcerpt;

    private Integer warningCountAfter;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;
}
