package com.jz.hive.chat.fanout;

import com.jz.hive.domain.entity.ChatMessage;
import com.jz.hive.domain.entity.ConversationSummary;
import com.jz.hive.mapper.ChatMessageMapper;
import com.jz.hive.mapper.ConversationSummaryMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 一个原子批次：消息本身（可选）+ 若干成员的收件箱变更，要么全部落库要么全部回滚。
 * 单独成 bean 是为了让 @Transactional 走代理。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FanoutBatchWriter {

    private final ChatMessageMapper messageMapper;
    private final ConversationSummaryMapper summaryMapper;

    @Transactional(rollbackFor = Exception.class)
    public void writeBatch(ChatMessage message, List<SummaryMutation> mutations, LocalDateTime now) {
        if (message != null) {
            messageMapper.insert(message);
        }
        for (SummaryMutation m : mutations) {
            apply(m, now);
        }
    }

    private void apply(SummaryMutation m, LocalDateTime now) {
        if (update(m, now) > 0) return;

        // 收件箱行缺失（比如加群时补建失败）：补一行再继续
        try {
            summaryMapper.insert(ConversationSummary.builder()
                    .ownerUserId(m.getOwnerUserId())
                    .peerId(m.getPeerId())
                    .conversationId(m.getConversationId())
                    .kind(m.getKind())
                    .displayName(m.getDisplayName())
                    .avatarRef(m.getAvatarRef())
                    .lastMessage(m.getLastMessage())
                    .updatedAt(now)
                    .unreadCount(m.isIncrementUnread() ? 1 : 0)
                    .build());
            log.info("summary row recreated during fan-out, owner={}, peer={}", m.getOwnerUserId(), m.getPeerId());
        } catch (DuplicateKeyException dup) {
            // 并发的另一批刚建好，回到原子更新
            if (update(m, now) == 0) {
                throw new IllegalStateException("summary row missing after duplicate key, owner=" + m.getOwnerUserId());
            }
        }
    }

    private int update(SummaryMutation m, LocalDateTime now) {
        return m.isIncrementUnread()
                ? summaryMapper.bumpUnread(m.getOwnerUserId(), m.getPeerId(), m.getLastMessage(), now)
                : summaryMapper.touch(m.getOwnerUserId(), m.getPeerId(), m.getLastMessage(), now);
    }
}
