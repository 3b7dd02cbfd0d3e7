package com.roomchat.gateway.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomchat.gateway.config.PresenceProperties;
import com.roomchat.gateway.presence.PresenceRegistry;
import com.roomchat.gateway.presence.TypingRegistry;
import com.roomchat.gateway.session.ConversationRoomRegistry;
import com.roomchat.gateway.session.SessionRegistry;
import io.netty.channel.DefaultChannelId;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class WsFrameHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private SessionRegistry sessionRegistry;
    private ConversationRoomRegistry rooms;
    private WsConnectionService connectionService;
    private WsMessageHandler messageHandler;
    private WsPingHandler pingHandler;
    private EmbeddedChannel alice;
    private EmbeddedChannel bob;

    @BeforeEach
    void setUp() {
        sessionRegistry = new SessionRegistry();
        rooms = new ConversationRoomRegistry();
        WsWriter writer = new WsWriter(objectMapper);
        WsBroadcaster broadcaster = new WsBroadcaster(sessionRegistry, rooms, writer);
        PresenceRegistry presence = new PresenceRegistry();
        TypingRegistry typing = new TypingRegistry(new PresenceProperties(null, null, null, null, null));

        connectionService = mock(WsConnectionService.class);
        messageHandler = mock(WsMessageHandler.class);
        pingHandler = mock(WsPingHandler.class);
        WsFrameHandler handler = new WsFrameHandler(objectMapper, sessionRegistry, writer, connectionService,
                mock(WsAuthHandler.class), pingHandler,
                new WsPresenceHandler(sessionRegistry, rooms, presence, typing, broadcaster, writer),
                messageHandler, mock(WsConversationHandler.class));

        alice = new EmbeddedChannel(DefaultChannelId.newInstance(), handler);
        bob = new EmbeddedChannel(DefaultChannelId.newInstance());
    }

    private void login(EmbeddedChannel ch, long userId, Long expMs) {
        sessionRegistry.authenticate(ch, userId, expMs);
        sessionRegistry.register(ch);
    }

    private void send(String json) {
        alice.writeInbound(new TextWebSocketFrame(json));
        alice.runPendingTasks();
    }

    private List<JsonNode> drain(EmbeddedChannel ch) throws Exception {
        List<JsonNode> out = new ArrayList<>();
        Object o;
        while ((o = ch.readOutbound()) != null) {
            TextWebSocketFrame frame = (TextWebSocketFrame) o;
            out.add(objectMapper.readTree(frame.text()));
            frame.release();
        }
        return out;
    }

    @Test
    void malformedFrameGetsBadJson() throws Exception {
        send("{not json");

        List<JsonNode> frames = drain(alice);
        assertThat(frames).hasSize(1);
        assertThat(frames.get(0).get("reason").asText()).isEqualTo("bad_json");
        assertThat(alice.isActive()).isTrue();
    }

    @Test
    void unauthenticatedFrameIsRejectedAndClosed() throws Exception {
        send("{\"type\":\"send_message\",\"conversationId\":10,\"content\":\"hi\"}");

        List<JsonNode> frames = drain(alice);
        assertThat(frames.get(0).get("code").asText()).isEqualTo("authentication_failed");
        assertThat(frames.get(0).get("reason").asText()).isEqualTo("unauthorized");
        assertThat(alice.isActive()).isFalse();
        verify(messageHandler, never()).handleSend(any(), any());
    }

    @Test
    void expiredTokenClosesConnection() throws Exception {
        login(alice, 1L, System.currentTimeMillis() - 1_000L);

        send("{\"type\":\"ping\"}");

        assertThat(drain(alice).get(0).get("reason").asText()).isEqualTo("token_expired");
        assertThat(alice.isActive()).isFalse();
        verify(pingHandler, never()).handleClientPing(any());
    }

    @Test
    void authedFramesTouchPresenceAndDispatch() {
        login(alice, 1L, null);

        send("{\"type\":\"ping\"}");
        send("{\"type\":\"send_message\",\"conversationId\":10,\"content\":\"hi\",\"clientTempId\":\"t1\"}");

        verify(connectionService, times(2)).touch(1L);
        verify(pingHandler).handleClientPing(any());
        verify(messageHandler).handleSend(any(), any());
    }

    @Test
    void typingIsBroadcastOnlyOnChangeAndOnlyToOthers() throws Exception {
        login(alice, 1L, null);
        login(bob, 2L, null);
        rooms.join(10L, alice);
        rooms.join(10L, bob);

        send("{\"type\":\"typing_start\",\"conversationId\":10}");
        send("{\"type\":\"typing_start\",\"conversationId\":10}");
        send("{\"type\":\"typing_stop\",\"conversationId\":10}");

        List<JsonNode> bobFrames = drain(bob);
        assertThat(bobFrames).hasSize(2);
        assertThat(bobFrames.get(0).get("isTyping").asBoolean()).isTrue();
        assertThat(bobFrames.get(1).get("isTyping").asBoolean()).isFalse();
        assertThat(drain(alice)).isEmpty();
    }

    @Test
    void typingOutsideJoinedConversationIsDenied() throws Exception {
        login(alice, 1L, null);

        send("{\"type\":\"typing_start\",\"conversationId\":10}");

        JsonNode err = drain(alice).get(0);
        assertThat(err.get("code").asText()).isEqualTo("permission_denied");
        assertThat(err.get("reason").asText()).isEqualTo("not_in_conversation");
    }

    @Test
    void offlineIsNotASelectableStatus() throws Exception {
        login(alice, 1L, null);

        send("{\"type\":\"status_change\",\"status\":\"offline\"}");

        assertThat(drain(alice).get(0).get("reason").asText()).isEqualTo("invalid_status");
    }

    @Test
    void unknownTypeIsReported() throws Exception {
        login(alice, 1L, null);

        send("{\"type\":\"teleport\"}");

        assertThat(drain(alice).get(0).get("reason").asText()).isEqualTo("unsupported_type");
    }
}
