package com.jz.hive.chat.fanout;

import com.jz.hive.config.FanoutProperties;
import com.jz.hive.domain.entity.ChatMessage;
import com.jz.hive.domain.entity.Conversation;
import com.jz.hive.domain.entity.ConversationMember;
import com.jz.hive.mapper.ConversationMemberMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 消息扇出：消息落库 + 每个成员一条收件箱变更。
 * <p>
 * 成员在扇出开始时读一次，之后按快照执行。总写入数不超过 {@code chat.fanout.max-batch-writes} 时整体一个事务；
 * 超过则分块提交，第一块带上消息本身，后续块失败只记日志和指标（块之间只有最终一致）。
 */
@Slf4j
@Service
public class ConversationFanoutService {

    static final String SELF_PREFIX = "You: ";

    private final ConversationMemberMapper memberMapper;
    private final FanoutBatchWriter batchWriter;
    private final FanoutProperties props;
    private final Clock clock;
    private final Counter chunkFailureCounter;

    public ConversationFanoutService(ConversationMemberMapper memberMapper,
                                     FanoutBatchWriter batchWriter,
                                     FanoutProperties props,
                                     Clock clock,
                                     MeterRegistry registry) {
        this.memberMapper = memberMapper;
        this.batchWriter = batchWriter;
        this.props = props;
        this.clock = clock;
        this.chunkFailureCounter = Counter.builder("chat.fanout.chunk.failure.count")
                .description("Trailing fan-out chunks that failed after the message was committed")
                .register(registry);
    }

    /**
     * 持久化消息并扇出。第一块失败时异常原样抛出，消息和任何收件箱变更都不会留下。
     *
     * @return 本次扇出使用的成员快照，派发通知时复用
     */
    public List<ConversationMember> persistAndFanOut(Conversation conversation, ChatMessage message) {
        LocalDateTime now = LocalDateTime.now(clock);
        message.setCreatedAt(now);
        message.setUpdatedAt(now);

        List<ConversationMember> members = memberMapper.selectByConversationId(conversation.getId());
        List<SummaryMutation> mutations = plan(conversation, members, message.getSenderId(),
                message.getSenderDisplayName(), message.getContent());

        int firstChunk = Math.max(1, props.getMaxBatchWrites() - 1);
        List<List<SummaryMutation>> chunks = chunk(mutations, firstChunk, Math.max(1, props.getMaxBatchWrites()));

        batchWriter.writeBatch(message, chunks.get(0), now);
        for (int i = 1; i < chunks.size(); i++) {
            try {
                batchWriter.writeBatch(null, chunks.get(i), now);
            } catch (DataAccessException e) {
                chunkFailureCounter.increment();
                log.error("fan-out chunk {}/{} failed, conversationId={}, messageId={}, err={}",
                        i + 1, chunks.size(), conversation.getId(), message.getId(), e.getMessage(), e);
            }
        }
        if (chunks.size() > 1) {
            log.info("fan-out chunked, conversationId={}, members={}, chunks={}",
                    conversation.getId(), members.size(), chunks.size());
        }
        return members;
    }

    /**
     * 按 owner 排序，让并发批次以相同顺序拿行锁。
     * 发送者名字用本条消息带的（发送时的资料），没有才退回成员行里入群时存的名字。
     */
    List<SummaryMutation> plan(Conversation conversation, List<ConversationMember> members,
                               String senderId, String senderDisplayName, String content) {
        String senderName = senderDisplayName;
        if (senderName == null || senderName.isBlank()) {
            senderName = members.stream()
                    .filter(m -> m.getUserId().equals(senderId) && m.getDisplayName() != null)
                    .map(ConversationMember::getDisplayName)
                    .findFirst().orElse(senderId);
        }

        List<SummaryMutation> out = new ArrayList<>(members.size());
        for (ConversationMember m : members) {
            boolean self = m.getUserId().equals(senderId);
            String lastMessage;
            if (self) {
                lastMessage = SELF_PREFIX + content;
            } else if (conversation.isGroup()) {
                lastMessage = senderName + ": " + content;
            } else {
                // 单聊的收件箱标题就是对方名字，不再重复前缀
                lastMessage = content;
            }
            out.add(toMutation(conversation, m, members, lastMessage, !self));
        }
        out.sort(Comparator.comparing(SummaryMutation::getOwnerUserId));
        return out;
    }

    private SummaryMutation toMutation(Conversation c, ConversationMember owner, List<ConversationMember> members,
                                       String lastMessage, boolean incrementUnread) {
        SummaryMutation.SummaryMutationBuilder b = SummaryMutation.builder()
                .ownerUserId(owner.getUserId())
                .conversationId(c.getId())
                .kind(c.getKind())
                .lastMessage(lastMessage)
                .incrementUnread(incrementUnread);
        if (c.isGroup()) {
            return b.peerId(c.getId()).displayName(c.getName()).avatarRef(c.getAvatarRef()).build();
        }
        ConversationMember peer = members.stream()
                .filter(m -> !m.getUserId().equals(owner.getUserId()))
                .findFirst().orElse(owner);
        return b.peerId(peer.getUserId()).displayName(peer.getDisplayName()).avatarRef(peer.getAvatarRef()).build();
    }

    static <T> List<List<T>> chunk(List<T> items, int firstSize, int size) {
        List<List<T>> out = new ArrayList<>();
        int i = 0;
        int n = firstSize;
        while (i < items.size()) {
            int end = Math.min(items.size(), i + n);
            out.add(new ArrayList<>(items.subList(i, end)));
            i = end;
            n = size;
        }
        if (out.isEmpty()) {
            out.add(new ArrayList<>());
        }
        return out;
    }
}
