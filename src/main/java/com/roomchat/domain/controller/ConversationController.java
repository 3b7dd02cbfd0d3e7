package com.roomchat.domain.controller;

import com.roomchat.auth.web.AuthContext;
import com.roomchat.common.api.ApiCodes;
import com.roomchat.common.api.Result;
import com.roomchat.common.error.ChatErrors;
import com.roomchat.common.error.ChatException;
import com.roomchat.domain.dto.ConversationSummaryDto;
import com.roomchat.domain.dto.CreateConversationRequest;
import com.roomchat.domain.dto.CreatedConversation;
import com.roomchat.domain.dto.HistoryPage;
import com.roomchat.domain.dto.MarkReadRequest;
import com.roomchat.domain.dto.MuteRequest;
import com.roomchat.domain.dto.ReadReceipt;
import com.roomchat.domain.dto.SendMessageCommand;
import com.roomchat.domain.dto.SendMessageRequest;
import com.roomchat.domain.dto.StatusChangeRequest;
import com.roomchat.domain.entity.ConversationEntity;
import com.roomchat.domain.entity.MessageEntity;
import com.roomchat.domain.enums.ConversationStatus;
import com.roomchat.domain.enums.ConversationType;
import com.roomchat.domain.enums.MessageType;
import com.roomchat.domain.service.ChatDeliveryService;
import com.roomchat.domain.service.ConversationService;
import com.roomchat.domain.service.MessageService;
import com.roomchat.gateway.ws.MessageDeliveryPipeline;
import com.roomchat.gateway.ws.WsConnectionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * 会话 REST：列表、创建、状态、静音、历史、已读、发送。
 *
 * <p>发送与已读同样走网关的广播链路，在线成员会收到与 WS 发送一致的事件。</p>
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

    private final ConversationService conversationService;
    private final MessageService messageService;
    private final ChatDeliveryService deliveryService;
    private final MessageDeliveryPipeline pipeline;
    private final WsConnectionService connectionService;

    @GetMapping
    public Result<List<ConversationSummaryDto>> list() {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(conversationService.listForUser(userId));
    }

    @GetMapping("/unread")
    public Result<Map<String, Long>> unread() {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(Map.of("unreadCount", conversationService.totalUnread(userId)));
    }

    @PostMapping
    public Result<ConversationEntity> create(@Valid @RequestBody CreateConversationRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        ConversationType type = ConversationType.fromString(req.getType());
        if (type == null) {
            throw ChatException.validation("invalid_conversation_type");
        }
        CreatedConversation created = conversationService.createConversation(userId, type, req.getParticipantIds(),
                req.getTitle(), req.getMatchId(), req.getListingId());
        connectionService.onConversationCreated(created);
        return Result.ok(created.conversation());
    }

    @PatchMapping("/{id}/status")
    public Result<ConversationEntity> changeStatus(@PathVariable("id") Long id, @Valid @RequestBody StatusChangeRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(conversationService.changeStatus(id, userId, ConversationStatus.fromString(req.getStatus())));
    }

    @PutMapping("/{id}/mute")
    public Result<Void> mute(@PathVariable("id") Long id, @RequestBody(required = false) MuteRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        conversationService.setMute(id, userId, true, req == null ? null : req.getMuteUntil());
        return Result.okVoid();
    }

    @DeleteMapping("/{id}/mute")
    public Result<Void> unmute(@PathVariable("id") Long id) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        conversationService.setMute(id, userId, false, null);
        return Result.okVoid();
    }

    @GetMapping("/{id}/messages")
    public Result<HistoryPage> history(@PathVariable("id") Long id,
                                       @RequestParam(required = false) Long before,
                                       @RequestParam(required = false) Long after,
                                       @RequestParam(required = false) Integer limit) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        conversationService.requireConversation(id);
        conversationService.requireActiveParticipant(id, userId);
        return Result.ok(messageService.history(id, userId, before, after, limit));
    }

    @PostMapping("/{id}/read")
    public Result<ReadReceipt> markRead(@PathVariable("id") Long id, @RequestBody(required = false) MarkReadRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        ReadReceipt receipt = deliveryService.markConversationRead(id, userId, req == null ? null : req.getMessageIds());
        pipeline.publishReadReceipt(receipt);
        return Result.ok(receipt);
    }

    @PostMapping("/{id}/messages")
    public Result<MessageEntity> send(@PathVariable("id") Long id, @RequestBody SendMessageRequest req) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        MessageType type = req.getType() == null ? MessageType.TEXT : MessageType.fromString(req.getType());
        if (type == null) {
            throw ChatException.validation("invalid_message_type");
        }
        SendMessageCommand draft = new SendMessageCommand(0L, userId, id, req.getContent(), type,
                req.getMetadata(), req.getReplyToId(), req.getClientTempId());
        try {
            return Result.ok(pipeline.submit(draft, null).join().message());
        } catch (CompletionException e) {
            throw ChatErrors.translate(e);
        }
    }
}
