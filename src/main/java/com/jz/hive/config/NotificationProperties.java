package com.jz.hive.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "chat.notification")
public class NotificationProperties {
    /** 推送正文截断长度，超出部分用 "..." 代替 */
    private int bodyMaxLength = 100;
    /** 推送失败（非 token 失效）的最大尝试次数 */
    private int pushMaxAttempts = 2;
    private String tokenKeyPrefix = "push:tokens:";
}
