package io.liparakis.craftis.server.net;

import io.liparakis.craftis.player.Pose;
import io.liparakis.craftis.protocol.MessageCodec;
import io.liparakis.craftis.protocol.ServerMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BroadcasterTest {

    private Broadcaster broadcaster;

    @BeforeEach
    void setUp() {
        broadcaster = new Broadcaster(new MessageCodec());
    }

    /**
     * Sink that records what it was offered, up to a capacity.
     */
    private static final class RecordingSink implements MessageSink {
        private final long id;
        private final int capacity;
        final List<String> received = new ArrayList<>();
        final List<String> failures = new ArrayList<>();

        RecordingSink(long id, int capacity) {
            this.id = id;
            this.capacity = capacity;
        }

        @Override
        public long connectionId() {
            return id;
        }

        @Override
        public boolean offer(byte[] wire) {
            if (received.size() >= capacity) {
                return false;
            }
            received.add(new String(wire, StandardCharsets.UTF_8));
            return true;
        }

        @Override
        public void fail(String reason) {
            failures.add(reason);
        }
    }

    // ========== Fan-out ==========

    @Test
    void deliversToEverySubscriberInOrder() {
        RecordingSink a = new RecordingSink(1, 100);
        RecordingSink b = new RecordingSink(2, 100);
        broadcaster.subscribe(a);
        broadcaster.subscribe(b);

        broadcaster.publish(new ServerMessage.Talk("one"), 1);
        broadcaster.publish(new ServerMessage.Talk("two"), 1);

        assertThat(a.received).containsExactly("T,one\n", "T,two\n");
        assertThat(b.received).containsExactly("T,one\n", "T,two\n");
    }

    @Test
    void positionIsNotEchoedToOrigin() {
        RecordingSink origin = new RecordingSink(1, 100);
        RecordingSink other = new RecordingSink(2, 100);
        broadcaster.subscribe(origin);
        broadcaster.subscribe(other);

        int delivered = broadcaster.publish(new ServerMessage.PlayerPosition(1, Pose.ORIGIN), 1);

        assertThat(delivered).isEqualTo(1);
        assertThat(origin.received).isEmpty();
        assertThat(other.received).hasSize(1);
    }

    @Test
    void explicitEchoFlagOverridesMessagePolicy() {
        RecordingSink origin = new RecordingSink(1, 100);
        broadcaster.subscribe(origin);

        broadcaster.publish(new ServerMessage.Talk("joined"), 1, false);
        broadcaster.publish(new ServerMessage.PlayerPosition(1, Pose.ORIGIN), 1, true);

        assertThat(origin.received).containsExactly("P,1,0.0,0.0,0.0,0.0,0.0\n");
    }

    @Test
    void unsubscribedSinkReceivesNothing() {
        RecordingSink sink = new RecordingSink(1, 100);
        broadcaster.subscribe(sink);

        assertThat(broadcaster.unsubscribe(1)).isTrue();
        assertThat(broadcaster.unsubscribe(1)).isFalse();
        broadcaster.publish(new ServerMessage.Talk("x"), Broadcaster.NO_ORIGIN);

        assertThat(sink.received).isEmpty();
        assertThat(broadcaster.subscriberCount()).isZero();
    }

    // ========== Overflow ==========

    @Test
    void fullSinkIsFailedWithoutAffectingOthers() {
        RecordingSink slow = new RecordingSink(1, 2);
        RecordingSink fast = new RecordingSink(2, 100);
        broadcaster.subscribe(slow);
        broadcaster.subscribe(fast);

        for (int i = 0; i < 5; i++) {
            broadcaster.publish(new ServerMessage.Talk("m" + i), Broadcaster.NO_ORIGIN);
        }

        assertThat(fast.received).hasSize(5);
        assertThat(slow.received).hasSize(2);
        assertThat(slow.failures).isNotEmpty().allMatch(reason -> reason.contains("overflow"));
    }

    @Test
    void healthySinkIsNeverFailed() {
        MessageSink sink = mock(MessageSink.class);
        when(sink.connectionId()).thenReturn(9L);
        when(sink.offer(any())).thenReturn(true);
        broadcaster.subscribe(sink);

        broadcaster.publish(new ServerMessage.Redraw(0, 0), Broadcaster.NO_ORIGIN);

        verify(sink).offer(any());
        verify(sink, never()).fail(anyString());
    }
}
