package com.jz.hive.chat.dispatch;

import java.util.List;

/** 推送服务商的窄接口，具体实现由部署方提供 */
public interface PushGateway {

    PushReport sendMulticast(List<String> tokens, PushMessage message) throws PushDeliveryException;
}
