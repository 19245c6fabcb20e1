package com.jz.hive.chat.dispatch;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/** 没有接推送服务商时的默认实现：只打日志，全部视为送达 */
@Slf4j
public class LoggingPushGateway implements PushGateway {

    @Override
    public PushReport sendMulticast(List<String> tokens, PushMessage message) {
        log.info("[push] tokens={}, title={}, body={}", tokens.size(), message.getTitle(), message.getBody());
        return PushReport.allDelivered(tokens.size());
    }
}
