package com.splitttr.realtime.websocket;

import com.splitttr.realtime.message.MessageCodec;
import com.splitttr.realtime.message.ServerMessage;
import com.splitttr.realtime.presence.PresenceTracker;
import com.splitttr.realtime.support.FakeChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ConnectionRegistryTest {

    private static final Instant AT = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    PresenceTracker presence;

    private ConnectionRegistry registry;
    private final List<String> failed = new ArrayList<>();

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry(presence, new MessageCodec());
        registry.onTransportFailure(failed::add);
    }

    @Test
    @DisplayName("the workspace broadcast lives as long as the workspace has a connection")
    void broadcastRegistration() {
        registry.register(new FakeChannel("c-1"), "alice", "ws-1");
        registry.register(new FakeChannel("c-2"), "bob", "ws-1");
        verify(presence, times(1)).registerBroadcast(eq("ws-1"), any());

        registry.unregister("c-1");
        verify(presence, never()).unregisterBroadcast("ws-1");

        registry.unregister("c-2");
        verify(presence).unregisterBroadcast("ws-1");
    }

    @Test
    @DisplayName("workspace broadcasts reach every connection in that workspace only")
    void broadcastToWorkspace() {
        FakeChannel alice = new FakeChannel("c-1");
        FakeChannel bob = new FakeChannel("c-2");
        FakeChannel carol = new FakeChannel("c-3");
        registry.register(alice, "alice", "ws-1");
        registry.register(bob, "bob", "ws-1");
        registry.register(carol, "carol", "ws-2");

        registry.broadcastToWorkspace("ws-1", ServerMessage.error("hi", "test", AT));

        assertThat(alice.frames()).hasSize(1);
        assertThat(bob.frames()).hasSize(1);
        assertThat(carol.frames()).isEmpty();
    }

    @Test
    @DisplayName("a user is reached through their most recently active open connection")
    void unicast() {
        FakeChannel laptop = new FakeChannel("c-1");
        FakeChannel phone = new FakeChannel("c-2");
        registry.register(laptop, "alice", "ws-1");
        registry.register(phone, "alice", "ws-1");

        registry.touch("c-1");
        registry.send("alice", ServerMessage.error("one", "test", AT));
        laptop.close(1000, "bye");
        registry.send("alice", ServerMessage.error("two", "test", AT));

        assertThat(laptop.frames()).hasSize(1);
        assertThat(phone.frames()).hasSize(1);
        assertThat(failed).isEmpty();
    }

    @Test
    @DisplayName("session traffic goes to the connection that joined the session, even when another one is more recent")
    void unicastPrefersSessionConnection() {
        FakeChannel editor = new FakeChannel("c-1");
        FakeChannel dashboard = new FakeChannel("c-2");
        registry.register(editor, "alice", "ws-1");
        registry.register(dashboard, "alice", "ws-1");
        registry.attach("c-1", "s-1");
        registry.touch("c-2");

        registry.send("alice", ServerMessage.userJoined("s-1", "bob", AT));
        registry.send("alice", ServerMessage.userJoined("s-2", "bob", AT));
        registry.send("alice", ServerMessage.error("no session", "test", AT));

        assertThat(editor.frames()).hasSize(1).allSatisfy(frame -> assertThat(frame).contains("\"sessionId\":\"s-1\""));
        assertThat(dashboard.frames()).hasSize(2);
    }

    @Test
    @DisplayName("send failures and closed channels are reported for cleanup")
    void failures() {
        FakeChannel broken = new FakeChannel("c-1");
        FakeChannel closed = new FakeChannel("c-2");
        registry.register(broken, "alice", "ws-1");
        registry.register(closed, "bob", "ws-1");
        broken.failSends();
        closed.close(1000, "bye");

        registry.sendToConnection("c-1", ServerMessage.error("x", "test", AT));
        registry.sendToConnection("c-2", ServerMessage.error("x", "test", AT));

        assertThat(failed).containsExactly("c-1", "c-2");
    }

    @Test
    @DisplayName("session membership is tracked per connection")
    void sessionMembership() {
        registry.register(new FakeChannel("c-1"), "alice", "ws-1");
        registry.register(new FakeChannel("c-2"), "alice", "ws-1");

        registry.attach("c-1", "s-1");
        registry.attach("c-2", "s-1");
        registry.detach("c-1", "s-1");

        assertThat(registry.isUserInSession("alice", "s-1")).isTrue();
        assertThat(registry.get("c-1").orElseThrow().sessionIds()).isEmpty();
        assertThat(registry.connectionsOf("alice")).hasSize(2);
        assertThat(registry.isUserInWorkspace("alice", "ws-1")).isTrue();
        assertThat(registry.isUserInWorkspace("alice", "ws-2")).isFalse();
    }
}
