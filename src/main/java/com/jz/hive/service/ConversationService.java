package com.jz.hive.service;

import com.jz.hive.domain.dto.ChatMessageDTO;
import com.jz.hive.domain.dto.CreateGroupRequest;
import com.jz.hive.domain.dto.OpenDirectRequest;
import com.jz.hive.domain.dto.SenderIdentity;
import com.jz.hive.domain.entity.Conversation;
import com.jz.hive.domain.entity.ConversationSummary;

import java.util.List;

/** 会话与成员管理：收件箱行随入群/开单聊创建，随退群删除 */
public interface ConversationService {

    /** 会话不存在抛 404，不是成员抛 403 */
    Conversation requireMember(String conversationId, String userId);

    List<ConversationSummary> inbox(String userId);

    /** 行不存在时返回 false，不报错 */
    boolean markRead(String userId, String peerId);

    Conversation openDirect(SenderIdentity self, OpenDirectRequest req);

    Conversation createGroup(SenderIdentity creator, CreateGroupRequest req);

    void join(String conversationId, SenderIdentity user);

    /** 自己退出，或管理员移除他人 */
    void removeMember(String conversationId, String requesterId, String targetUserId);

    List<ChatMessageDTO> history(String conversationId, String userId, long afterSeq, int limit);
}
