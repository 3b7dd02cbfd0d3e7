package com.roomchat.gateway.session;

import io.netty.channel.DefaultChannelId;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SessionRegistryTest {

    private final SessionRegistry registry = new SessionRegistry();

    @Test
    void registerRequiresAuthAndHappensOnce() {
        EmbeddedChannel ch = new EmbeddedChannel(DefaultChannelId.newInstance());
        assertThat(registry.register(ch)).isFalse();

        registry.authenticate(ch, 1L, null);
        assertThat(registry.register(ch)).isTrue();
        assertThat(registry.register(ch)).isFalse();
        assertThat(registry.getChannels(1L)).containsExactly(ch);
    }

    @Test
    void unbindIsIdempotentAndMultipleConnectionsAreTracked() {
        EmbeddedChannel c1 = new EmbeddedChannel(DefaultChannelId.newInstance());
        EmbeddedChannel c2 = new EmbeddedChannel(DefaultChannelId.newInstance());
        registry.authenticate(c1, 1L, null);
        registry.authenticate(c2, 1L, null);
        registry.register(c1);
        registry.register(c2);

        assertThat(registry.getAllChannels()).hasSize(2);
        assertThat(registry.unbind(c1)).isTrue();
        assertThat(registry.unbind(c1)).isFalse();
        assertThat(registry.getChannels(1L)).containsExactly(c2);
    }

    @Test
    void closeUserClosesAllChannels() {
        EmbeddedChannel c1 = new EmbeddedChannel(DefaultChannelId.newInstance());
        registry.authenticate(c1, 1L, null);
        registry.register(c1);

        assertThat(registry.closeUser(1L)).isEqualTo(1);
        assertThat(c1.isActive()).isFalse();
    }
}
