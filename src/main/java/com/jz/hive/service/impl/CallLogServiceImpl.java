package com.jz.hive.service.impl;

import com.jz.hive.chat.dispatch.CallOutcome;
import com.jz.hive.chat.dispatch.CallStatus;
import com.jz.hive.chat.dispatch.EventDispatcher;
import com.jz.hive.chat.fanout.ConversationFanoutService;
import com.jz.hive.chat.log.ChatSequencer;
import com.jz.hive.config.CallLogProperties;
import com.jz.hive.domain.dto.ChatMessageDTO;
import com.jz.hive.domain.dto.SenderIdentity;
import com.jz.hive.domain.entity.ChatMessage;
import com.jz.hive.domain.entity.Conversation;
import com.jz.hive.domain.entity.ConversationMember;
import com.jz.hive.exception.SendFailedException;
import com.jz.hive.exception.ValidationException;
import com.jz.hive.mapper.ChatMessageMapper;
import com.jz.hive.service.CallLogService;
import com.jz.hive.service.ConversationService;
import com.jz.hive.utils.CallLogTexts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class CallLogServiceImpl implements CallLogService {

    private final ConversationService conversationService;
    private final ConversationFanoutService fanoutService;
    private final ChatSequencer chatSequencer;
    private final ChatMessageMapper messageMapper;
    private final EventDispatcher dispatcher;
    private final CallLogProperties props;
    private final Clock clock;

    @Override
    public ChatMessageDTO startCall(String conversationId, SenderIdentity caller, String callType, String correlationId) {
        Conversation conversation = conversationService.requireMember(conversationId, caller.getUserId());
        String type = CallLogTexts.normalizeType(callType);
        String callId = (correlationId == null || correlationId.isBlank()) ? UUID.randomUUID().toString() : correlationId.trim();

        ChatMessage placeholder = ChatMessage.builder()
                .conversationId(conversationId)
                .senderId(caller.getUserId())
                .senderDisplayName(caller.getDisplayName())
                .content(CallLogTexts.calling(type))
                .type(ChatMessage.TYPE_CALL_LOG)
                .callId(callId)
                .callType(type)
                .callStatus(CallStatus.CALLING)
                .build();
        List<ConversationMember> members;
        try {
            placeholder.setSeq(chatSequencer.next(conversationId));
            members = fanoutService.persistAndFanOut(conversation, placeholder);
        } catch (DuplicateKeyException dup) {
            throw new ValidationException("Call id already in use.");
        } catch (DataAccessException e) {
            log.error("persist call placeholder failed, conversationId={}, callId={}, err={}",
                    conversationId, callId, e.getMessage(), e);
            throw new SendFailedException("Call could not be started. Please try again.", e);
        }

        ChatMessageDTO dto = ChatMessageDTO.from(placeholder);
        dispatcher.dispatchNewMessage(dto, members);
        log.info("[CallLog] calling, conversationId={}, callId={}, type={}", conversationId, callId, type);
        return dto;
    }

    @Override
    public void resolveCall(String conversationId, String correlationId, CallOutcome outcome, long durationMs) {
        if (outcome == null) {
            throw new ValidationException("Call outcome is required.");
        }
        ChatMessage placeholder = messageMapper.selectCallingPlaceholder(conversationId, correlationId);
        if (placeholder == null) {
            log.info("[CallLog] no calling placeholder, nothing to resolve, conversationId={}, callId={}",
                    conversationId, correlationId);
            return;
        }

        String type = placeholder.getCallType();
        String content;
        String status;
        if (outcome == CallOutcome.MISSED) {
            content = CallLogTexts.missed(type);
            status = CallStatus.MISSED;
        } else if (outcome == CallOutcome.ENDED && durationMs >= props.getMinConnectedDurationMs()) {
            content = CallLogTexts.ended(type, durationMs);
            status = CallStatus.ENDED;
        } else {
            // 没接通或秒挂：占位消息直接删掉
            if (messageMapper.deleteCallPlaceholder(placeholder.getId()) > 0) {
                dispatcher.dispatchCallLogDeleted(conversationId, correlationId);
                log.info("[CallLog] deleted, conversationId={}, callId={}, outcome={}, durationMs={}",
                        conversationId, correlationId, outcome, durationMs);
            }
            return;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Long duration = CallStatus.ENDED.equals(status) ? durationMs : null;
        if (messageMapper.resolveCallPlaceholder(placeholder.getId(), content, status, duration, now) == 0) {
            // 并发的另一次结算先到了
            return;
        }
        placeholder.setContent(content);
        placeholder.setCallStatus(status);
        placeholder.setCallDurationMs(duration);
        placeholder.setUpdatedAt(now);
        dispatcher.dispatchCallLogUpdated(ChatMessageDTO.from(placeholder));
        log.info("[CallLog] {}, conversationId={}, callId={}, content={}", status, conversationId, correlationId, content);
    }
}
