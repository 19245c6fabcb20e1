package com.jz.hive.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "chat.fanout")
public class FanoutProperties {

    /**
     * 单个事务里最多写多少行（含消息本身那一行）。
     * 超过后按块提交，块与块之间只保证最终一致。
     */
    private int maxBatchWrites = 500;
}
