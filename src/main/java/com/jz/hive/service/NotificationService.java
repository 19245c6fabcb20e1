package com.jz.hive.service;

import com.jz.hive.domain.entity.Notification;

import java.util.List;

public interface NotificationService {

    /** 异步：先落通知记录，成功后再尝试推送 */
    void notifyMessage(String recipientId, String conversationId, String senderDisplayName, String content);

    List<Notification> recent(String userId, int limit);

    boolean markRead(String userId, Long notificationId);

    void registerToken(String userId, String token);

    void unregisterToken(String userId, String token);
}
