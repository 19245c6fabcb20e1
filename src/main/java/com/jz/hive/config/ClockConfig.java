package com.jz.hive.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** 全服务统一时钟：封禁到期、消息时间戳都从这里取，测试里可以替换 */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
