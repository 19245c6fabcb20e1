package com.jz.hive.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.jz.hive.config.MessageProperties;
import com.jz.hive.domain.dto.ChatMessageDTO;
import com.jz.hive.domain.dto.CreateGroupRequest;
import com.jz.hive.domain.dto.OpenDirectRequest;
import com.jz.hive.domain.dto.SenderIdentity;
import com.jz.hive.domain.entity.Conversation;
import com.jz.hive.domain.entity.ConversationMember;
import com.jz.hive.domain.entity.ConversationSummary;
import com.jz.hive.exception.ConversationAccessException;
import com.jz.hive.exception.ValidationException;
import com.jz.hive.mapper.ChatMessageMapper;
import com.jz.hive.mapper.ConversationMapper;
import com.jz.hive.mapper.ConversationMemberMapper;
import com.jz.hive.mapper.ConversationSummaryMapper;
import com.jz.hive.service.ConversationService;
import com.jz.hive.utils.ConversationIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationServiceImpl extends ServiceImpl<ConversationMapper, Conversation>
        implements ConversationService {

    private final ConversationMemberMapper memberMapper;
    private final ConversationSummaryMapper summaryMapper;
    private final ChatMessageMapper messageMapper;
    private final MessageProperties messageProps;
    private final Clock clock;

    @Override
    public Conversation requireMember(String conversationId, String userId) {
        Conversation c = getById(conversationId);
        if (c == null) {
            throw ConversationAccessException.notFound(conversationId);
        }
        if (memberMapper.countMember(conversationId, userId) == 0) {
            throw ConversationAccessException.notMember(conversationId);
        }
        return c;
    }

    @Override
    public List<ConversationSummary> inbox(String userId) {
        return summaryMapper.selectInbox(userId);
    }

    @Override
    public boolean markRead(String userId, String peerId) {
        int n = summaryMapper.markRead(userId, peerId);
        if (n == 0) {
            log.debug("markRead on missing summary, owner={}, peer={}", userId, peerId);
        }
        return n > 0;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public Conversation openDirect(SenderIdentity self, OpenDirectRequest req) {
        if (req == null || req.getPeerId() == null || req.getPeerId().isBlank()) {
            throw new ValidationException("Peer id is required.");
        }
        if (req.getPeerId().equals(self.getUserId())) {
            throw new ValidationException("Cannot start a chat with yourself.");
        }
        String id = ConversationIds.direct(self.getUserId(), req.getPeerId());
        Conversation existing = getById(id);
        if (existing != null) {
            return existing;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Conversation c = Conversation.builder().id(id).kind(Conversation.KIND_DIRECT).createdAt(now).build();
        try {
            save(c);
        } catch (DuplicateKeyException dup) {
            // 对方同时发起了同一个单聊
            return getById(id);
        }
        ConversationMember me = member(id, self.getUserId(), self.getDisplayName(), null, ConversationMember.ROLE_MEMBER, now);
        ConversationMember peer = member(id, req.getPeerId(), req.getPeerDisplayName(), req.getPeerAvatarRef(),
                ConversationMember.ROLE_MEMBER, now);
        memberMapper.insert(me);
        memberMapper.insert(peer);
        summaryMapper.insert(summary(c, me.getUserId(), peer.getUserId(), peer.getDisplayName(), peer.getAvatarRef(), now));
        summaryMapper.insert(summary(c, peer.getUserId(), me.getUserId(), me.getDisplayName(), me.getAvatarRef(), now));
        log.info("direct conversation opened, id={}", id);
        return c;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public Conversation createGroup(SenderIdentity creator, CreateGroupRequest req) {
        if (req == null || req.getName() == null || req.getName().isBlank()) {
            throw new ValidationException("Group name is required.");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        Conversation c = Conversation.builder()
                .id(ConversationIds.group())
                .kind(Conversation.KIND_GROUP)
                .name(req.getName().trim())
                .avatarRef(req.getAvatarRef())
                .createdAt(now)
                .build();
        save(c);
        memberMapper.insert(member(c.getId(), creator.getUserId(), creator.getDisplayName(), null,
                ConversationMember.ROLE_ADMIN, now));
        summaryMapper.insert(summary(c, creator.getUserId(), c.getId(), c.getName(), c.getAvatarRef(), now));
        log.info("group created, id={}, creator={}", c.getId(), creator.getUserId());
        return c;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void join(String conversationId, SenderIdentity user) {
        Conversation c = getById(conversationId);
        if (c == null || !c.isGroup()) {
            throw ConversationAccessException.notFound(conversationId);
        }
        if (memberMapper.countMember(conversationId, user.getUserId()) > 0) {
            throw ConversationAccessException.alreadyMember(conversationId);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        memberMapper.insert(member(conversationId, user.getUserId(), user.getDisplayName(), null,
                ConversationMember.ROLE_MEMBER, now));
        // 可能残留着上次退群前的行
        if (summaryMapper.selectByOwnerAndPeer(user.getUserId(), conversationId) == null) {
            summaryMapper.insert(summary(c, user.getUserId(), conversationId, c.getName(), c.getAvatarRef(), now));
        }
        log.info("member joined, conversationId={}, userId={}", conversationId, user.getUserId());
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void removeMember(String conversationId, String requesterId, String targetUserId) {
        Conversation c = requireMember(conversationId, requesterId);
        if (!c.isGroup()) {
            throw new ValidationException("Cannot leave a direct conversation.");
        }
        if (!requesterId.equals(targetUserId) && !isAdmin(conversationId, requesterId)) {
            throw ConversationAccessException.notAdmin(conversationId);
        }
        memberMapper.deleteMember(conversationId, targetUserId);
        summaryMapper.deleteByOwnerAndConversation(targetUserId, conversationId);
        log.info("member removed, conversationId={}, userId={}, by={}", conversationId, targetUserId, requesterId);
    }

    @Override
    public List<ChatMessageDTO> history(String conversationId, String userId, long afterSeq, int limit) {
        requireMember(conversationId, userId);
        int n = Math.max(1, Math.min(limit, messageProps.getMaxPageSize()));
        return messageMapper.selectAfterSeq(conversationId, Math.max(0, afterSeq), n).stream()
                .map(ChatMessageDTO::from)
                .toList();
    }

    private boolean isAdmin(String conversationId, String userId) {
        return memberMapper.selectByConversationId(conversationId).stream()
                .anyMatch(m -> m.getUserId().equals(userId) && ConversationMember.ROLE_ADMIN.equals(m.getRole()));
    }

    private static ConversationMember member(String conversationId, String userId, String displayName,
                                             String avatarRef, String role, LocalDateTime now) {
        return ConversationMember.builder()
                .conversationId(conversationId)
                .userId(userId)
                .displayName(displayName == null ? userId : displayName)
                .avatarRef(avatarRef)
                .role(role)
                .joinedAt(now)
                .build();
    }

    private static ConversationSummary summary(Conversation c, String owner, String peerId,
                                               String displayName, String avatarRef, LocalDateTime now) {
        return ConversationSummary.builder()
                .ownerUserId(owner)
                .peerId(peerId)
                .conversationId(c.getId())
                .kind(c.getKind())
                .displayName(displayName == null ? peerId : displayName)
                .avatarRef(avatarRef)
                .lastMessage("")
                .updatedAt(now)
                .unreadCount(0)
                .build();
    }
}
