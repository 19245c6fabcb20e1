package com.jz.hive.chat.dispatch;

import com.jz.hive.domain.dto.ChatMessageDTO;
import com.jz.hive.domain.dto.LiveEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LiveEventBus")
class LiveEventBusTest {

    private final LiveEventBus bus = new LiveEventBus();

    @Test
    void deliversInPublishOrderToSubscribersOfThatConversation() {
        RecordingSubscriber a = new RecordingSubscriber("a");
        RecordingSubscriber other = new RecordingSubscriber("o");
        bus.subscribe("c1", a);
        bus.subscribe("c2", other);

        bus.publish(LiveEvent.newMessage(dto("c1", "1")));
        bus.publish(LiveEvent.callLogDeleted("c1", "call-9"));

        assertThat(a.received).extracting(LiveEvent::getType)
                .containsExactly(LiveEvent.NEW_MESSAGE, LiveEvent.CALL_LOG_DELETED);
        assertThat(a.received.get(1).getCallId()).isEqualTo("call-9");
        assertThat(other.received).isEmpty();
    }

    @Test
    @DisplayName("a broken connection is dropped without affecting the others")
    void brokenSubscriberIsRemoved() {
        RecordingSubscriber ok = new RecordingSubscriber("ok");
        bus.subscribe("c1", ok);
        bus.subscribe("c1", new LiveSubscriber() {
            @Override
            public String id() {
                return "broken";
            }

            @Override
            public void send(LiveEvent event) throws IOException {
                throw new IOException("pipe closed");
            }
        });

        int failed = bus.publish(LiveEvent.newMessage(dto("c1", "1")));

        assertThat(failed).isEqualTo(1);
        assertThat(ok.received).hasSize(1);
        assertThat(bus.subscriberCount("c1")).isEqualTo(1);
    }

    @Test
    void publishWithoutSubscribersIsNoop() {
        assertThat(bus.publish(LiveEvent.newMessage(dto("nobody", "1")))).isZero();
    }

    @Test
    void unsubscribeRemovesEmptyChannel() {
        bus.subscribe("c1", new RecordingSubscriber("a"));
        bus.unsubscribe("c1", "a");

        assertThat(bus.subscriberCount("c1")).isZero();
    }

    private static ChatMessageDTO dto(String conversationId, String id) {
        return ChatMessageDTO.builder().id(id).conversationId(conversationId).content("x").build();
    }

    private static class RecordingSubscriber implements LiveSubscriber {
        private final String id;
        private final List<LiveEvent> received = new ArrayList<>();

        RecordingSubscriber(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public void send(LiveEvent event) {
            received.add(event);
        }
    }
}
