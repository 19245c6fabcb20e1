package com.jz.hive.service;

import com.jz.hive.chat.dispatch.CallOutcome;
import com.jz.hive.domain.dto.ChatMessageDTO;
import com.jz.hive.domain.dto.SenderIdentity;

/** 通话记录占位消息：Calling → {Ended, Missed, Cancelled} */
public interface CallLogService {

    ChatMessageDTO startCall(String conversationId, SenderIdentity caller, String callType, String correlationId);

    /** 找不到仍在 calling 的占位消息时什么都不做 */
    void resolveCall(String conversationId, String correlationId, CallOutcome outcome, long durationMs);
}
