package com.duoim.gateway.session;

import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionRegistryTest {

    private final List<String> events = new ArrayList<>();

    private ConnectionRegistry newRegistry() {
        ConnectionRegistry registry = new ConnectionRegistry();
        registry.addPresenceListener((userId, online) -> events.add(userId + ":" + (online ? "on" : "off")));
        return registry;
    }

    @Test
    void multipleConnections_ShouldEmitOneOnlineAndOneOfflineEdge() {
        ConnectionRegistry registry = newRegistry();
        EmbeddedChannel a = new EmbeddedChannel();
        EmbeddedChannel b = new EmbeddedChannel();
        EmbeddedChannel c = new EmbeddedChannel();

        assertThat(registry.register(7L, a)).isTrue();
        assertThat(registry.register(7L, b)).isFalse();
        assertThat(registry.register(7L, c)).isFalse();
        assertThat(registry.connectionCount(7L)).isEqualTo(3);

        assertThat(registry.unregister(b)).isFalse();
        assertThat(registry.unregister(a)).isFalse();
        assertThat(registry.isOnline(7L)).isTrue();
        assertThat(registry.unregister(c)).isTrue();

        assertThat(registry.isOnline(7L)).isFalse();
        assertThat(events).containsExactly("7:on", "7:off");
    }

    @Test
    void registerSameChannelTwice_ShouldCountOnce() {
        ConnectionRegistry registry = newRegistry();
        EmbeddedChannel a = new EmbeddedChannel();

        registry.register(1L, a);
        registry.register(1L, a);

        assertThat(registry.connectionCount(1L)).isEqualTo(1);
        registry.unregister(a);
        assertThat(registry.isOnline(1L)).isFalse();
        assertThat(events).containsExactly("1:on", "1:off");
    }

    @Test
    void unregisterUnknownOrTwice_ShouldBeNoop() {
        ConnectionRegistry registry = newRegistry();
        EmbeddedChannel a = new EmbeddedChannel();

        assertThat(registry.unregister(a)).isFalse();
        registry.register(2L, a);
        registry.unregister(a);
        assertThat(registry.unregister(a)).isFalse();

        assertThat(events).containsExactly("2:on", "2:off");
    }

    @Test
    void snapshot_ShouldListOnlineUsersAscending() {
        ConnectionRegistry registry = newRegistry();
        registry.register(30L, new EmbeddedChannel());
        registry.register(10L, new EmbeddedChannel());
        EmbeddedChannel gone = new EmbeddedChannel();
        registry.register(20L, gone);
        registry.unregister(gone);

        assertThat(registry.snapshotOnlineUsers()).containsExactly(10L, 30L);
        assertThat(registry.allConnections()).hasSize(2);
    }

    @Test
    void register_ShouldBindUserIdToChannel() {
        ConnectionRegistry registry = newRegistry();
        EmbeddedChannel a = new EmbeddedChannel();
        registry.register(5L, a);

        assertThat(a.attr(ConnectionRegistry.ATTR_USER_ID).get()).isEqualTo(5L);
        assertThat(registry.userIdOf(a)).isEqualTo(5L);
    }
}
