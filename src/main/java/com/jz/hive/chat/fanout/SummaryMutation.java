package com.jz.hive.chat.fanout;

import lombok.Builder;
import lombok.Value;

/** 一个成员的一条收件箱变更 */
@Value
@Builder
public class SummaryMutation {
    String ownerUserId;
    String peerId;
    String conversationId;
    String kind;
    /** 行不存在时补建用 */
    String displayName;
    String avatarRef;
    String lastMessage;
    /** 发送者自己 false，其余成员 true */
    boolean incrementUnread;
}
