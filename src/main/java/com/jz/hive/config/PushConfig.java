package com.jz.hive.config;

import com.jz.hive.chat.dispatch.LoggingPushGateway;
import com.jz.hive.chat.dispatch.PushGateway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PushConfig {

    @Bean
    @ConditionalOnMissingBean(PushGateway.class)
    public PushGateway pushGateway() {
        return new LoggingPushGateway();
    }
}
