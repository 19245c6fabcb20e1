package com.jz.hive.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "chat.call-log")
public class CallLogProperties {
    /** 通话时长低于该值视为没接通，占位消息直接删除 */
    private long minConnectedDurationMs = 1000;
}
