package com.jz.hive.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.*;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("chat_message")
public class ChatMessage {

    public static final String TYPE_TEXT = "text";
    public static final String TYPE_CALL_LOG = "call_log";

    @TableId(type = IdType.ASSIGN_ID)
    private Long id;

    private String conversationId;

    private String senderId;
    private String senderDisplayName;

    private String content;

    /** text / call_log，缺省按 text 处理 */
    private String type;

    /** 会话内递增序号（Redis INCR），同一会话按它排序 */
    private Long seq;

    // 以下仅 call_log 使用
    private String callId;
    /** audio / video */
    private String callType;
    /** calling / ended / missed */
    private String callStatus;
    private Long callDurationMs;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    public String typeOrDefault() {
        return type == null ? TYPE_TEXT : type;
    }
}
