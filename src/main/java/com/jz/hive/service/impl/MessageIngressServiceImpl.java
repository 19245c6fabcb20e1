package com.jz.hive.service.impl;

import com.jz.hive.chat.dispatch.EventDispatcher;
import com.jz.hive.chat.fanout.ConversationFanoutService;
import com.jz.hive.chat.log.ChatSequencer;
import com.jz.hive.config.MessageProperties;
import com.jz.hive.domain.dto.ChatMessageDTO;
import com.jz.hive.domain.dto.SendResult;
import com.jz.hive.domain.dto.SenderIdentity;
import com.jz.hive.domain.entity.ChatMessage;
import com.jz.hive.domain.entity.Conversation;
import com.jz.hive.domain.entity.ConversationMember;
import com.jz.hive.exception.SendFailedException;
import com.jz.hive.exception.ValidationException;
import com.jz.hive.guard.ConversationModerationService;
import com.jz.hive.guard.ModerationDecision;
import com.jz.hive.service.ConversationService;
import com.jz.hive.service.MessageIngressService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.List;

@Slf4j
@Service
public class MessageIngressServiceImpl implements MessageIngressService {

    private final ConversationService conversationService;
    private final ConversationModerationService moderationService;
    private final ConversationFanoutService fanoutService;
    private final ChatSequencer chatSequencer;
    private final EventDispatcher dispatcher;
    private final MessageProperties props;
    private final MeterRegistry meterRegistry;

    private final Timer sendTimer;
    private final Counter acceptedCounter;
    private final Counter failedCounter;

    public MessageIngressServiceImpl(ConversationService conversationService,
                                     ConversationModerationService moderationService,
                                     ConversationFanoutService fanoutService,
                                     ChatSequencer chatSequencer,
                                     EventDispatcher dispatcher,
                                     MessageProperties props,
                                     MeterRegistry meterRegistry) {
        this.conversationService = conversationService;
        this.moderationService = moderationService;
        this.fanoutService = fanoutService;
        this.chatSequencer = chatSequencer;
        this.dispatcher = dispatcher;
        this.props = props;
        this.meterRegistry = meterRegistry;

        this.sendTimer = Timer.builder("chat.send.latency")
                .description("Latency of sendMessage (validate->moderate->persist+fan-out)")
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(meterRegistry);
        this.acceptedCounter = Counter.builder("chat.send.accepted.count").register(meterRegistry);
        this.failedCounter = Counter.builder("chat.send.failed.count")
                .description("Sends that failed in the persist/fan-out step")
                .register(meterRegistry);
    }

    @Override
    public SendResult sendMessage(String conversationId, SenderIdentity sender, String content) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return doSend(conversationId, sender, content);
        } finally {
            sample.stop(sendTimer);
        }
    }

    private SendResult doSend(String conversationId, SenderIdentity sender, String content) {
        String text = validate(content);
        Conversation conversation = conversationService.requireMember(conversationId, sender.getUserId());

        // 1) 审核：拒绝时只有台账变化，消息不落库也不派发
        ModerationDecision decision = moderationService.preModerate(sender.getUserId(), text);
        if (!decision.isAllowed()) {
            Counter.builder("chat.send.rejected.count")
                    .tag("reason", decision.getReason().wire())
                    .register(meterRegistry)
                    .increment();
            log.info("message rejected, conversationId={}, userId={}, reason={}, warnings={}",
                    conversationId, sender.getUserId(), decision.getReason(), decision.getWarningCount());
            return SendResult.rejected(decision);
        }

        // 2) 落库 + 扇出，同一个原子批次
        ChatMessage message = ChatMessage.builder()
                .conversationId(conversationId)
                .senderId(sender.getUserId())
                .senderDisplayName(sender.getDisplayName())
                .content(text)
                .type(ChatMessage.TYPE_TEXT)
                .build();
        List<ConversationMember> members;
        try {
            message.setSeq(chatSequencer.next(conversationId));
            members = fanoutService.persistAndFanOut(conversation, message);
        } catch (DataAccessException | TransactionException e) {
            failedCounter.increment();
            log.error("persist/fan-out failed, conversationId={}, userId={}, err={}",
                    conversationId, sender.getUserId(), e.getMessage(), e);
            throw new SendFailedException("Message could not be sent. Please try again.", e);
        }

        // 3) 派发不等结果
        ChatMessageDTO dto = ChatMessageDTO.from(message);
        try {
            dispatcher.dispatchNewMessage(dto, members);
        } catch (RuntimeException e) {
            // 执行器拒绝等，发送本身已成功
            log.warn("dispatch not scheduled, conversationId={}, messageId={}, err={}",
                    conversationId, message.getId(), e.getMessage());
        }
        acceptedCounter.increment();
        return SendResult.accepted(dto);
    }

    private String validate(String content) {
        if (content == null || content.trim().isEmpty()) {
            throw new ValidationException("Message content is required.");
        }
        String text = content.trim();
        if (text.length() > props.getMaxLength()) {
            throw new ValidationException("Message too long.");
        }
        return text;
    }
}
