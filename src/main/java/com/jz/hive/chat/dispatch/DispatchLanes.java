package com.jz.hive.chat.dispatch;

import org.springframework.beans.factory.DisposableBean;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * 按会话分道的派发线程：同一会话的任务总落在同一条单线程道上，按提交顺序执行。
 * 不同会话之间互不阻塞。
 */
public class DispatchLanes implements DisposableBean {

    private final List<? extends Executor> lanes;

    public DispatchLanes(List<? extends Executor> lanes) {
        if (lanes == null || lanes.isEmpty()) {
            throw new IllegalArgumentException("at least one lane is required");
        }
        this.lanes = List.copyOf(lanes);
    }

    public static DispatchLanes singleThreaded(int count, int queueCapacity, String threadNamePrefix) {
        List<ThreadPoolTaskExecutor> lanes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
            ex.setCorePoolSize(1);
            ex.setMaxPoolSize(1);
            ex.setQueueCapacity(queueCapacity);
            ex.setThreadNamePrefix(threadNamePrefix + i + "-");
            ex.setAwaitTerminationSeconds(10);
            ex.setWaitForTasksToCompleteOnShutdown(true);
            ex.initialize();
            lanes.add(ex);
        }
        return new DispatchLanes(lanes);
    }

    /**
     * 队列满时抛 {@link org.springframework.core.task.TaskRejectedException}，由调用方决定怎么记。
     */
    public void execute(String conversationId, Runnable task) {
        lanes.get(laneOf(conversationId)).execute(task);
    }

    int laneOf(String conversationId) {
        return Math.floorMod(conversationId == null ? 0 : conversationId.hashCode(), lanes.size());
    }

    public int size() {
        return lanes.size();
    }

    @Override
    public void destroy() {
        for (Executor lane : lanes) {
            if (lane instanceof ThreadPoolTaskExecutor) {
                ((ThreadPoolTaskExecutor) lane).shutdown();
            }
        }
    }
}
