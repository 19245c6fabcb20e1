package com.jz.hive.service;

import com.jz.hive.domain.dto.SendResult;
import com.jz.hive.domain.dto.SenderIdentity;

public interface MessageIngressService {

    /**
     * 校验 → 审核 → （拒绝 | 落库 + 扇出 + 派发）。
     * 审核拒绝是正常返回；校验失败、无权限、扇出失败以异常抛出。
     */
    SendResult sendMessage(String conversationId, SenderIdentity sender, String content);
}
