package com.jz.hive.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "chat.message")
public class MessageProperties {
    private int maxLength = 5000;
    /** 历史消息单次最多拉取条数 */
    private int maxPageSize = 200;
}
