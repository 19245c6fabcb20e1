package com.jz.hive.chat.dispatch;

import com.jz.hive.domain.dto.ChatMessageDTO;
import com.jz.hive.domain.dto.LiveEvent;
import com.jz.hive.domain.entity.ConversationMember;
import com.jz.hive.service.NotificationService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 提交之后的派发：实时广播 + 给除发送者外的每个成员排一个推送任务。
 * 全部发完即走，失败只记日志和指标，绝不回滚或重试写入。
 * 同一会话的事件都进同一条派发道，先提交的先发。
 */
@Slf4j
@Component
public class EventDispatcher {

    private final LiveEventBus liveBus;
    private final NotificationService notificationService;
    private final DispatchLanes lanes;
    private final Counter broadcastFailureCounter;

    public EventDispatcher(LiveEventBus liveBus, NotificationService notificationService,
                           DispatchLanes lanes, MeterRegistry registry) {
        this.liveBus = liveBus;
        this.notificationService = notificationService;
        this.lanes = lanes;
        this.broadcastFailureCounter = Counter.builder("live.broadcast.failure.count")
                .description("Live events that failed to reach a subscriber")
                .register(registry);
    }

    public void dispatchNewMessage(ChatMessageDTO message, List<ConversationMember> members) {
        submit(message.getConversationId(), () -> deliverNewMessage(message, members));
    }

    public void dispatchCallLogUpdated(ChatMessageDTO message) {
        submit(message.getConversationId(), () -> broadcast(LiveEvent.callLogUpdated(message)));
    }

    public void dispatchCallLogDeleted(String conversationId, String callId) {
        submit(conversationId, () -> broadcast(LiveEvent.callLogDeleted(conversationId, callId)));
    }

    private void submit(String conversationId, Runnable task) {
        try {
            lanes.execute(conversationId, task);
        } catch (TaskRejectedException e) {
            broadcastFailureCounter.increment();
            log.warn("dispatch lane full, dropping live event, conversationId={}", conversationId);
        }
    }

    private void deliverNewMessage(ChatMessageDTO message, List<ConversationMember> members) {
        broadcast(LiveEvent.newMessage(message));

        for (ConversationMember m : members) {
            if (m.getUserId().equals(message.getSenderId())) continue;
            try {
                notificationService.notifyMessage(m.getUserId(), message.getConversationId(),
                        message.getSenderDisplayName(), message.getContent());
            } catch (RuntimeException e) {
                // 一个收件人失败不影响其他人（比如推送队列满）
                log.warn("enqueue notification failed, recipient={}, conversationId={}, err={}",
                        m.getUserId(), message.getConversationId(), e.getMessage());
            }
        }
    }

    private void broadcast(LiveEvent event) {
        try {
            int failed = liveBus.publish(event);
            if (failed > 0) {
                broadcastFailureCounter.increment(failed);
            }
        } catch (RuntimeException e) {
            broadcastFailureCounter.increment();
            log.error("live broadcast failed, type={}, conversationId={}, err={}",
                    event.getType(), event.getConversationId(), e.getMessage(), e);
        }
    }
}
