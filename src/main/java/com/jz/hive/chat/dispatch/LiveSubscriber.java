package com.jz.hive.chat.dispatch;

import com.jz.hive.domain.dto.LiveEvent;

import java.io.IOException;

/** 一条在线连接；写失败说明连接已断，由总线摘掉 */
public interface LiveSubscriber {

    String id();

    void send(LiveEvent event) throws IOException;
}
