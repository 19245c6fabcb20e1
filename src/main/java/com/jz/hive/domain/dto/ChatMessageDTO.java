package com.jz.hive.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jz.hive.domain.entity.ChatMessage;
import lombok.*;

import java.time.LocalDateTime;

/** 对外的消息形状：HTTP 响应和实时事件共用 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatMessageDTO {
    /** 雪花 id 转字符串，避免前端 JS 丢精度 */
    private String id;
    private String conversationId;
    private String senderId;
    private String senderDisplayName;
    private String content;
    private String type;
    private Long seq;
    private LocalDateTime createdAt;
    private CallInfoDTO callInfo;

    public static ChatMessageDTO from(ChatMessage m) {
        ChatMessageDTOBuilder b = ChatMessageDTO.builder()
                .id(m.getId() == null ? null : String.valueOf(m.getId()))
                .conversationId(m.getConversationId())
                .senderId(m.getSenderId())
                .senderDisplayName(m.getSenderDisplayName())
                .content(m.getContent())
                .type(m.typeOrDefault())
                .seq(m.getSeq())
                .createdAt(m.getCreatedAt());
        if (ChatMessage.TYPE_CALL_LOG.equals(m.getType())) {
            b.callInfo(CallInfoDTO.builder()
                    .callId(m.getCallId())
                    .callType(m.getCallType())
                    .status(m.getCallStatus())
                    .durationMs(m.getCallDurationMs())
                    .build());
        }
        return b.build();
    }
}
