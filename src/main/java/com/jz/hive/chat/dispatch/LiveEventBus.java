package com.jz.hive.chat.dispatch;

import com.jz.hive.domain.dto.LiveEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本实例上的实时频道：conversationId → 在线订阅者。
 * 同一会话的事件按 publish 调用顺序写出；写失败的连接直接摘掉，不影响其他人。
 */
@Slf4j
@Component
public class LiveEventBus {

    static final long SSE_TIMEOUT_MS = 30 * 60 * 1000L;

    private final Map<String, Map<String, LiveSubscriber>> channels = new ConcurrentHashMap<>();

    public void subscribe(String conversationId, LiveSubscriber subscriber) {
        channels.computeIfAbsent(conversationId, k -> new ConcurrentHashMap<>()).put(subscriber.id(), subscriber);
        log.debug("live subscribe, conversationId={}, subscriber={}", conversationId, subscriber.id());
    }

    public void unsubscribe(String conversationId, String subscriberId) {
        channels.computeIfPresent(conversationId, (k, subs) -> {
            subs.remove(subscriberId);
            return subs.isEmpty() ? null : subs;
        });
    }

    /**
     * 广播给当前在线的订阅者。
     *
     * @return 写失败的连接数
     */
    public int publish(LiveEvent event) {
        Map<String, LiveSubscriber> subs = channels.get(event.getConversationId());
        if (subs == null || subs.isEmpty()) return 0;
        int failed = 0;
        // 同一会话串行写，保证事件顺序
        synchronized (subs) {
            for (LiveSubscriber s : subs.values()) {
                try {
                    s.send(event);
                } catch (IOException | IllegalStateException e) {
                    failed++;
                    log.warn("live send failed, dropping subscriber, conversationId={}, subscriber={}, err={}",
                            event.getConversationId(), s.id(), e.getMessage());
                    unsubscribe(event.getConversationId(), s.id());
                }
            }
        }
        return failed;
    }

    public int subscriberCount(String conversationId) {
        Map<String, LiveSubscriber> subs = channels.get(conversationId);
        return subs == null ? 0 : subs.size();
    }

    /** SSE 传输：连接关闭/超时/出错时自动退订 */
    public SseEmitter openStream(String conversationId) {
        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        String id = UUID.randomUUID().toString();
        subscribe(conversationId, new SseSubscriber(id, emitter));
        emitter.onCompletion(() -> unsubscribe(conversationId, id));
        emitter.onTimeout(() -> unsubscribe(conversationId, id));
        emitter.onError(e -> unsubscribe(conversationId, id));
        return emitter;
    }

    private record SseSubscriber(String id, SseEmitter emitter) implements LiveSubscriber {
        @Override
        public void send(LiveEvent event) throws IOException {
            emitter.send(SseEmitter.event().name(event.getType()).data(event, MediaType.APPLICATION_JSON));
        }
    }
}
