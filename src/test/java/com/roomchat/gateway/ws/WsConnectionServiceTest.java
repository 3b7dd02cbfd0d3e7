package com.roomchat.gateway.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomchat.domain.dto.CreatedConversation;
import com.roomchat.domain.entity.ConversationEntity;
import com.roomchat.domain.enums.ConversationStatus;
import com.roomchat.domain.enums.ConversationType;
import com.roomchat.domain.service.ConversationService;
import com.roomchat.gateway.config.PresenceProperties;
import com.roomchat.gateway.presence.LastActiveStore;
import com.roomchat.gateway.presence.PresenceRegistry;
import com.roomchat.gateway.presence.PresenceStatus;
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
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WsConnectionServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private SessionRegistry sessionRegistry;
    private ConversationRoomRegistry rooms;
    private PresenceRegistry presence;
    private TypingRegistry typing;
    private LastActiveStore lastActiveStore;
    private ConversationService conversationService;
    private MessageDeliveryPipeline pipeline;
    private WsConnectionService service;

    @BeforeEach
    void setUp() {
        sessionRegistry = new SessionRegistry();
        rooms = new ConversationRoomRegistry();
        presence = new PresenceRegistry();
        typing = new TypingRegistry(new PresenceProperties(null, null, null, null, null));
        lastActiveStore = mock(LastActiveStore.class);
        conversationService = mock(ConversationService.class);
        pipeline = mock(MessageDeliveryPipeline.class);
        WsWriter writer = new WsWriter(objectMapper);
        service = new WsConnectionService(sessionRegistry, rooms, presence, typing, lastActiveStore,
                conversationService, pipeline, new WsBroadcaster(sessionRegistry, rooms, writer), writer, Runnable::run);
    }

    private EmbeddedChannel authed(long userId) {
        EmbeddedChannel ch = new EmbeddedChannel(DefaultChannelId.newInstance());
        sessionRegistry.authenticate(ch, userId, null);
        return ch;
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

    private List<JsonNode> ofType(List<JsonNode> frames, String type) {
        List<JsonNode> out = new ArrayList<>();
        for (JsonNode n : frames) {
            if (type.equals(n.get("type").asText())) {
                out.add(n);
            }
        }
        return out;
    }

    @Test
    void registerSendsConnectedAndJoinsConversationRooms() throws Exception {
        when(conversationService.activeConversationIdsForUser(1L)).thenReturn(List.of(10L, 11L));
        EmbeddedChannel ch = authed(1L);

        assertThat(service.register(ch)).isTrue();
        ch.runPendingTasks();

        List<JsonNode> frames = drain(ch);
        assertThat(frames).hasSize(1);
        assertThat(frames.get(0).get("type").asText()).isEqualTo(WsEventTypes.CONNECTED);
        assertThat(frames.get(0).get("status").asText()).isEqualTo("online");
        assertThat(rooms.roomsOf(ch)).containsExactlyInAnyOrder(10L, 11L);
        assertThat(service.register(ch)).isFalse();
    }

    @Test
    void onlyFirstConnectAndLastDisconnectAreBroadcast() throws Exception {
        EmbeddedChannel observer = authed(2L);
        service.register(observer);
        drain(observer);

        EmbeddedChannel c1 = authed(1L);
        EmbeddedChannel c2 = authed(1L);
        service.register(c1);
        service.register(c2);

        List<JsonNode> onlineEvents = ofType(drain(observer), WsEventTypes.USER_STATUS_CHANGE);
        assertThat(onlineEvents).hasSize(1);
        assertThat(onlineEvents.get(0).get("status").asText()).isEqualTo("online");

        service.disconnect(c1);
        assertThat(drain(observer)).isEmpty();
        assertThat(presence.status(1L)).isEqualTo(PresenceStatus.ONLINE);

        service.disconnect(c2);
        service.disconnect(c2);
        List<JsonNode> offlineEvents = ofType(drain(observer), WsEventTypes.USER_STATUS_CHANGE);
        assertThat(offlineEvents).hasSize(1);
        assertThat(offlineEvents.get(0).get("status").asText()).isEqualTo("offline");
        assertThat(offlineEvents.get(0).get("lastSeen").asLong()).isPositive();
        assertThat(presence.status(1L)).isEqualTo(PresenceStatus.OFFLINE);
        verify(lastActiveStore).record(eq(1L), anyLong(), eq(true));
    }

    @Test
    void goingOfflineClearsTypingForRoomMates() throws Exception {
        EmbeddedChannel alice = authed(1L);
        EmbeddedChannel bob = authed(2L);
        service.register(alice);
        service.register(bob);
        rooms.join(10L, alice);
        rooms.join(10L, bob);
        typing.start(1L, 10L, System.currentTimeMillis());
        drain(bob);

        service.disconnect(alice);

        List<JsonNode> typingEvents = ofType(drain(bob), WsEventTypes.USER_TYPING);
        assertThat(typingEvents).hasSize(1);
        assertThat(typingEvents.get(0).get("isTyping").asBoolean()).isFalse();
        assertThat(typing.isTyping(1L, 10L, System.currentTimeMillis())).isFalse();
    }

    @Test
    void staleSweepClosesZombieChannelsAndBroadcastsOffline() throws Exception {
        EmbeddedChannel observer = authed(2L);
        service.register(observer);
        EmbeddedChannel zombie = authed(1L);
        service.register(zombie);
        drain(observer);
        observer.runPendingTasks();
        presence.touch(2L, System.currentTimeMillis() + 600_000L);

        int forced = service.sweepStalePresence(System.currentTimeMillis() + 600_000L, 300_000L);

        assertThat(forced).isEqualTo(1);
        assertThat(zombie.isActive()).isFalse();
        assertThat(ofType(drain(observer), WsEventTypes.USER_STATUS_CHANGE)).hasSize(1);
    }

    @Test
    void expiredTypingIsBroadcastAsStopped() throws Exception {
        EmbeddedChannel bob = authed(2L);
        service.register(bob);
        rooms.join(10L, bob);
        drain(bob);
        typing.start(1L, 10L, 0L);

        assertThat(service.sweepTyping(60_000L)).isEqualTo(1);
        assertThat(ofType(drain(bob), WsEventTypes.USER_TYPING)).hasSize(1);
    }

    @Test
    void newMatchConversationJoinsOnlineMembersAndPostsSystemMessage() throws Exception {
        when(pipeline.submitSystem(anyLong(), anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        EmbeddedChannel bob = authed(2L);
        service.register(bob);
        drain(bob);

        ConversationEntity conversation = new ConversationEntity();
        conversation.setId(10L);
        conversation.setType(ConversationType.DIRECT);
        conversation.setStatus(ConversationStatus.ACTIVE);
        conversation.setMatchId(5L);

        service.onConversationCreated(new CreatedConversation(conversation, List.of(1L, 2L), false));

        assertThat(rooms.isMember(10L, bob)).isTrue();
        assertThat(ofType(drain(bob), WsEventTypes.CONVERSATION_CREATED)).hasSize(1);
        verify(pipeline).submitSystem(10L, WsConnectionService.MATCH_SYSTEM_TYPE, WsConnectionService.MATCH_SYSTEM_CONTENT);
    }

    @Test
    void reusedConversationDoesNotRepeatSystemMessage() {
        ConversationEntity conversation = new ConversationEntity();
        conversation.setId(10L);
        conversation.setMatchId(5L);

        service.onConversationCreated(new CreatedConversation(conversation, List.of(1L, 2L), true));

        verify(pipeline, never()).submitSystem(anyLong(), anyString(), anyString());
        verify(lastActiveStore, never()).record(anyLong(), anyLong(), anyBoolean());
    }
}
