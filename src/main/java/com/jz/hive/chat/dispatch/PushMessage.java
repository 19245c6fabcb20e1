package com.jz.hive.chat.dispatch;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class PushMessage {
    String title;
    String body;
    /** conversationId / senderName 等，客户端点通知时跳转用 */
    Map<String, String> data;
}
