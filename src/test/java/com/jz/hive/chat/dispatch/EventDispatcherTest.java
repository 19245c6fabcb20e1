package com.jz.hive.chat.dispatch;

import com.jz.hive.domain.dto.ChatMessageDTO;
import com.jz.hive.domain.dto.LiveEvent;
import com.jz.hive.domain.entity.ConversationMember;
import com.jz.hive.service.NotificationService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EventDispatcher")
class EventDispatcherTest {

    @Mock
    private LiveEventBus liveBus;

    @Mock
    private NotificationService notificationService;

    private SimpleMeterRegistry registry;
    private EventDispatcher dispatcher;

    private final ChatMessageDTO message = ChatMessageDTO.builder()
            .id("42").conversationId("g1").senderId("alice").senderDisplayName("Alice").content("hi").build();

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        // 测试里同步执行，断言不用等线程
        dispatcher = new EventDispatcher(liveBus, notificationService,
                new DispatchLanes(List.<Executor>of(Runnable::run)), registry);
    }

    @Test
    @DisplayName("broadcasts once and notifies every member except the sender")
    void broadcastsAndNotifiesOthers() {
        dispatcher.dispatchNewMessage(message, members("alice", "bob", "carol"));

        ArgumentCaptor<LiveEvent> event = ArgumentCaptor.forClass(LiveEvent.class);
        verify(liveBus).publish(event.capture());
        assertThat(event.getValue().getType()).isEqualTo(LiveEvent.NEW_MESSAGE);
        assertThat(event.getValue().getMessage()).isSameAs(message);
        verify(notificationService).notifyMessage("bob", "g1", "Alice", "hi");
        verify(notificationService).notifyMessage("carol", "g1", "Alice", "hi");
        verify(notificationService, never()).notifyMessage(eq("alice"), anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("one recipient failing to enqueue does not stop the rest")
    void recipientFailureIsIsolated() {
        doThrow(new TaskRejectedException("queue full"))
                .when(notificationService).notifyMessage(eq("bob"), anyString(), anyString(), anyString());

        dispatcher.dispatchNewMessage(message, members("alice", "bob", "carol"));

        verify(notificationService).notifyMessage("carol", "g1", "Alice", "hi");
    }

    @Test
    void broadcastFailureIsSwallowedAndCounted() {
        when(liveBus.publish(any())).thenThrow(new IllegalStateException("boom"));

        assertThatCode(() -> dispatcher.dispatchCallLogUpdated(message)).doesNotThrowAnyException();

        assertThat(registry.counter("live.broadcast.failure.count").count()).isEqualTo(1.0);
    }

    @Test
    void dropsCountedPerFailedSubscriber() {
        when(liveBus.publish(any())).thenReturn(2);

        dispatcher.dispatchCallLogDeleted("g1", "call-1");

        assertThat(registry.counter("live.broadcast.failure.count").count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("a delete dispatched right after a start reaches subscribers second")
    void eventsOfOneConversationKeepSubmissionOrder() throws Exception {
        DispatchLanes lanes = DispatchLanes.singleThreaded(4, 100, "test-lane-");
        EventDispatcher laned = new EventDispatcher(liveBus, notificationService, lanes, registry);
        CountDownLatch firstPublishEntered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(2);
        List<String> published = new CopyOnWriteArrayList<>();
        when(liveBus.publish(any())).thenAnswer(inv -> {
            LiveEvent e = inv.getArgument(0);
            if (LiveEvent.NEW_MESSAGE.equals(e.getType())) {
                firstPublishEntered.countDown();
                // 让开始事件慢一点，删除事件如果能插队就会先到
                release.await(5, TimeUnit.SECONDS);
            }
            published.add(e.getType());
            done.countDown();
            return 0;
        });
        try {
            laned.dispatchNewMessage(message, List.of());
            laned.dispatchCallLogDeleted("g1", "call-1");
            assertThat(firstPublishEntered.await(5, TimeUnit.SECONDS)).isTrue();
            release.countDown();

            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(published).containsExactly(LiveEvent.NEW_MESSAGE, LiveEvent.CALL_LOG_DELETED);
        } finally {
            lanes.destroy();
        }
    }

    @Test
    void fullLaneIsCountedNotThrown() {
        Executor rejecting = task -> {
            throw new TaskRejectedException("lane full");
        };
        EventDispatcher full = new EventDispatcher(liveBus, notificationService,
                new DispatchLanes(List.of(rejecting)), registry);

        assertThatCode(() -> full.dispatchCallLogDeleted("g1", "call-1")).doesNotThrowAnyException();

        assertThat(registry.counter("live.broadcast.failure.count").count()).isEqualTo(1.0);
        verifyNoInteractions(liveBus);
    }

    private static List<ConversationMember> members(String... ids) {
        return Arrays.stream(ids)
                .map(id -> ConversationMember.builder().conversationId("g1").userId(id).build())
                .toList();
    }
}
