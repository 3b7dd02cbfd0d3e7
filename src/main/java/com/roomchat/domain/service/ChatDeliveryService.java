package com.roomchat.domain.service;

import com.roomchat.domain.dto.DeliveryUpdate;
import com.roomchat.domain.dto.ReactionUpdate;
import com.roomchat.domain.dto.ReadReceipt;
import com.roomchat.domain.dto.SendMessageCommand;
import com.roomchat.domain.dto.SendResult;
import com.roomchat.domain.entity.MessageEntity;
import com.roomchat.domain.enums.ReactionType;

import java.util.Collection;

/**
 * 消息状态机：sent → delivered → read，failed 只能从 sent 进入。
 *
 * <p>这里只做校验与持久化（同步、阻塞），广播与投递顺序由网关侧负责。</p>
 */
public interface ChatDeliveryService {

    /**
     * 校验成员与回复目标、落库为 sent、更新会话投影。
     */
    SendResult send(SendMessageCommand command);

    /**
     * 服务端生成的系统消息（匹配成功等），不做成员校验，senderId 为 0。
     */
    SendResult sendSystemMessage(long conversationId, String systemMessageType, String content);

    /**
     * 接收方在线时由服务端推进到 delivered。
     */
    DeliveryUpdate markDeliveredOnline(MessageEntity message);

    /**
     * 落库超时等场景 best-effort 标记为 failed（仅 sent 可进入）。
     */
    boolean markFailed(long messageId);

    DeliveryUpdate acknowledgeDelivered(long messageId, long userId);

    DeliveryUpdate acknowledgeRead(long messageId, long readerId);

    ReadReceipt markConversationRead(long conversationId, long readerId, Collection<Long> messageIds);

    MessageEntity edit(long messageId, long requesterId, String newContent);

    MessageEntity delete(long messageId, long requesterId, boolean forEveryone);

    ReactionUpdate react(long messageId, long userId, ReactionType reaction);

    ReactionUpdate removeReaction(long messageId, long userId);
}
