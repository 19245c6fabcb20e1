package com.jz.hive.service.impl;

import com.jz.hive.BaseIntegrationTest;
import com.jz.hive.domain.dto.CreateGroupRequest;
import com.jz.hive.domain.dto.OpenDirectRequest;
import com.jz.hive.domain.dto.SenderIdentity;
import com.jz.hive.domain.entity.Conversation;
import com.jz.hive.domain.entity.ConversationSummary;
import com.jz.hive.exception.ConversationAccessException;
import com.jz.hive.exception.ValidationException;
import com.jz.hive.mapper.ConversationSummaryMapper;
import com.jz.hive.service.ConversationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConversationServiceImpl membership and inbox")
class ConversationServiceImplIntegrationTest extends BaseIntegrationTest {

    private static final SenderIdentity ALICE = SenderIdentity.of("alice", "Alice");
    private static final SenderIdentity BOB = SenderIdentity.of("bob", "Bob");

    @Autowired
    private ConversationService conversationService;

    @Autowired
    private ConversationSummaryMapper summaryMapper;

    @Test
    @DisplayName("opening a direct chat twice returns the same conversation")
    void openDirectIsIdempotent() {
        Conversation first = conversationService.openDirect(ALICE, direct("bob", "Bob"));
        Conversation second = conversationService.openDirect(BOB, direct("alice", "Alice"));

        assertThat(second.getId()).isEqualTo(first.getId()).isEqualTo("alice_bob");
        assertThat(conversationService.inbox("alice")).hasSize(1);
        assertThat(conversationService.inbox("bob")).extracting(ConversationSummary::getDisplayName)
                .containsExactly("Alice");
    }

    @Test
    void cannotChatWithSelf() {
        assertThatThrownBy(() -> conversationService.openDirect(ALICE, direct("alice", "Alice")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void joinCreatesSummaryWithZeroUnread() {
        Conversation g = group(ALICE, "Hikers");

        conversationService.join(g.getId(), BOB);

        ConversationSummary s = summaryMapper.selectByOwnerAndPeer("bob", g.getId());
        assertThat(s.getUnreadCount()).isZero();
        assertThat(s.getKind()).isEqualTo(Conversation.KIND_GROUP);
        assertThat(s.getDisplayName()).isEqualTo("Hikers");
    }

    @Test
    void joiningTwiceIsAConflict() {
        Conversation g = group(ALICE, "Hikers");

        assertThatThrownBy(() -> conversationService.join(g.getId(), ALICE))
                .isInstanceOfSatisfying(ConversationAccessException.class, e -> assertThat(e.getCode()).isEqualTo(409));
    }

    @Test
    void leavingDeletesSummary() {
        Conversation g = group(ALICE, "Hikers");
        conversationService.join(g.getId(), BOB);

        conversationService.removeMember(g.getId(), "bob", "bob");

        assertThat(summaryMapper.selectByOwnerAndPeer("bob", g.getId())).isNull();
        assertThatThrownBy(() -> conversationService.requireMember(g.getId(), "bob"))
                .isInstanceOfSatisfying(ConversationAccessException.class, e -> assertThat(e.getCode()).isEqualTo(403));
    }

    @Test
    void onlyAdminCanRemoveOthers() {
        Conversation g = group(ALICE, "Hikers");
        conversationService.join(g.getId(), BOB);

        assertThatThrownBy(() -> conversationService.removeMember(g.getId(), "bob", "alice"))
                .isInstanceOf(ConversationAccessException.class);

        conversationService.removeMember(g.getId(), "alice", "bob");
        assertThat(summaryMapper.selectByOwnerAndPeer("bob", g.getId())).isNull();
    }

    @Test
    void unknownConversationIsNotFound() {
        assertThatThrownBy(() -> conversationService.requireMember("missing", "alice"))
                .isInstanceOfSatisfying(ConversationAccessException.class, e -> assertThat(e.getCode()).isEqualTo(404));
    }

    @Test
    @DisplayName("mark read zeroes the counter and tolerates a missing row")
    void markRead() {
        Conversation g = group(ALICE, "Hikers");
        conversationService.join(g.getId(), BOB);
        summaryMapper.bumpUnread("bob", g.getId(), "Alice: hi", LocalDateTime.now(clock));

        assertThat(conversationService.markRead("bob", g.getId())).isTrue();
        assertThat(summaryMapper.selectByOwnerAndPeer("bob", g.getId()).getUnreadCount()).isZero();
        assertThat(conversationService.markRead("bob", "nowhere")).isFalse();
    }

    @Test
    void inboxIsNewestFirst() {
        Conversation older = group(ALICE, "Older");
        clock.advance(Duration.ofMinutes(1));
        Conversation newer = group(ALICE, "Newer");

        assertThat(conversationService.inbox("alice")).extracting(ConversationSummary::getConversationId)
                .containsExactly(newer.getId(), older.getId());
    }

    private Conversation group(SenderIdentity creator, String name) {
        CreateGroupRequest req = new CreateGroupRequest();
        req.setName(name);
        return conversationService.createGroup(creator, req);
    }

    private static OpenDirectRequest direct(String peerId, String peerName) {
        OpenDirectRequest req = new OpenDirectRequest();
        req.setPeerId(peerId);
        req.setPeerDisplayName(peerName);
        return req;
    }
}
