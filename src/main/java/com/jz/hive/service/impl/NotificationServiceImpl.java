package com.jz.hive.service.impl;

import com.jz.hive.chat.dispatch.PushDeliveryException;
import com.jz.hive.chat.dispatch.PushGateway;
import com.jz.hive.chat.dispatch.PushMessage;
import com.jz.hive.chat.dispatch.PushReport;
import com.jz.hive.chat.dispatch.PushTokenRegistry;
import com.jz.hive.config.NotificationProperties;
import com.jz.hive.domain.entity.Notification;
import com.jz.hive.exception.ValidationException;
import com.jz.hive.mapper.NotificationMapper;
import com.jz.hive.service.NotificationService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * 推送是 best-effort：通知记录落库失败就不推；推送方失败最多试 {@code push-max-attempts} 次，
 * 确定失效的 token 从注册集合里删掉。任何失败都不会回到发送链路。
 */
@Slf4j
@Service
public class NotificationServiceImpl implements NotificationService {

    private final NotificationMapper notificationMapper;
    private final PushTokenRegistry tokenRegistry;
    private final PushGateway pushGateway;
    private final NotificationProperties props;
    private final Counter pushFailureCounter;

    public NotificationServiceImpl(NotificationMapper notificationMapper,
                                   PushTokenRegistry tokenRegistry,
                                   PushGateway pushGateway,
                                   NotificationProperties props,
                                   MeterRegistry registry) {
        this.notificationMapper = notificationMapper;
        this.tokenRegistry = tokenRegistry;
        this.pushGateway = pushGateway;
        this.props = props;
        this.pushFailureCounter = Counter.builder("notify.push.failure.count")
                .description("Push notifications that could not be delivered")
                .register(registry);
    }

    @Async("notifyExecutor")
    @Override
    public void notifyMessage(String recipientId, String conversationId, String senderDisplayName, String content) {
        String title = "New message from " + senderDisplayName;
        String body = truncate(content);

        try {
            notificationMapper.insert(Notification.builder()
                    .userId(recipientId)
                    .type(Notification.TYPE_MESSAGE)
                    .title(title)
                    .body(body)
                    .relatedId(conversationId)
                    .isRead(false)
                    .build());
        } catch (DataAccessException e) {
            pushFailureCounter.increment();
            log.error("persist notification failed, skipping push, recipient={}, conversationId={}, err={}",
                    recipientId, conversationId, e.getMessage(), e);
            return;
        }

        List<String> tokens;
        try {
            tokens = tokenRegistry.tokensOf(recipientId);
        } catch (DataAccessException e) {
            pushFailureCounter.increment();
            log.error("load push tokens failed, recipient={}, err={}", recipientId, e.getMessage(), e);
            return;
        }
        if (tokens.isEmpty()) {
            log.debug("no push tokens, recipient={}", recipientId);
            return;
        }

        PushMessage msg = PushMessage.builder()
                .title(title)
                .body(body)
                .data(Map.of("conversationId", conversationId, "senderName", senderDisplayName))
                .build();
        PushReport report = sendWithRetry(recipientId, tokens, msg);
        if (report == null) return;

        if (!report.failures().isEmpty()) {
            pushFailureCounter.increment(report.failures().size());
            log.warn("push partially failed, recipient={}, success={}, failures={}",
                    recipientId, report.successCount(), report.failures());
        }
        List<String> invalid = report.invalidTokens();
        if (!invalid.isEmpty()) {
            try {
                tokenRegistry.prune(recipientId, invalid);
            } catch (DataAccessException e) {
                log.error("prune push tokens failed, recipient={}, err={}", recipientId, e.getMessage(), e);
            }
        }
    }

    private PushReport sendWithRetry(String recipientId, List<String> tokens, PushMessage msg) {
        int attempts = Math.max(1, props.getPushMaxAttempts());
        for (int i = 1; i <= attempts; i++) {
            try {
                return pushGateway.sendMulticast(tokens, msg);
            } catch (PushDeliveryException e) {
                log.warn("push attempt {}/{} failed, recipient={}, err={}", i, attempts, recipientId, e.getMessage());
            }
        }
        pushFailureCounter.increment();
        log.error("push gave up after {} attempts, recipient={}", attempts, recipientId);
        return null;
    }

    String truncate(String content) {
        if (content == null) return "";
        int max = props.getBodyMaxLength();
        return content.length() > max ? content.substring(0, max) + "..." : content;
    }

    @Override
    public List<Notification> recent(String userId, int limit) {
        return notificationMapper.selectRecent(userId, Math.max(1, Math.min(limit, 200)));
    }

    @Override
    public boolean markRead(String userId, Long notificationId) {
        return notificationMapper.markRead(notificationId, userId) > 0;
    }

    @Override
    public void registerToken(String userId, String token) {
        tokenRegistry.register(userId, requireToken(token));
    }

    @Override
    public void unregisterToken(String userId, String token) {
        tokenRegistry.unregister(userId, requireToken(token));
    }

    private static String requireToken(String token) {
        if (token == null || token.isBlank()) {
            throw new ValidationException("Push token is required.");
        }
        return token.trim();
    }
}
