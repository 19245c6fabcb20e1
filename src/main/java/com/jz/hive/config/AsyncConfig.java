package com.jz.hive.config;

import com.jz.hive.chat.dispatch.DispatchLanes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;


@Slf4j
@Configuration
@EnableAsync
public class AsyncConfig implements AsyncConfigurer {

    /** 实时广播：每个会话固定一条单线程道，保证同一会话的事件按提交顺序发出 */
    @Bean
    public DispatchLanes dispatchLanes() {
        return DispatchLanes.singleThreaded(8, 1000, "chat-lane-");
    }

    /** 推送通知：队列满了直接丢弃（best-effort），不反压到发送链路 */
    @Bean(name = "notifyExecutor")
    public ThreadPoolTaskExecutor notifyExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(2);
        ex.setMaxPoolSize(8);
        ex.setQueueCapacity(5000);
        ex.setThreadNamePrefix("notify-");
        ex.setRejectedExecutionHandler((r, executor) ->
                log.warn("notify queue full, dropping push job, queued={}", executor.getQueue().size()));
        ex.initialize();
        return ex;
    }

    // 无返回值 @Async 方法的未捕获异常
    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (ex, method, params) ->
                log.error("Async error in {}: {}", method.getName(), ex.getMessage(), ex);
    }
}
