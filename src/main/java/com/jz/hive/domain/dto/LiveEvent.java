package com.jz.hive.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

/** 按会话 id 推给在线订阅者的实时事件 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LiveEvent {

    public static final String NEW_MESSAGE = "newMessage";
    public static final String CALL_LOG_UPDATED = "callLogUpdated";
    public static final String CALL_LOG_DELETED = "callLogDeleted";

    private String type;
    private String conversationId;
    private ChatMessageDTO message;
    /** 仅 callLogDeleted */
    private String callId;

    public static LiveEvent newMessage(ChatMessageDTO m) {
        return LiveEvent.builder().type(NEW_MESSAGE).conversationId(m.getConversationId()).message(m).build();
    }

    public static LiveEvent callLogUpdated(ChatMessageDTO m) {
        return LiveEvent.builder().type(CALL_LOG_UPDATED).conversationId(m.getConversationId()).message(m).build();
    }

    public static LiveEvent callLogDeleted(String conversationId, String callId) {
        return LiveEvent.builder().type(CALL_LOG_DELETED).conversationId(conversationId).callId(callId).build();
    }
}
