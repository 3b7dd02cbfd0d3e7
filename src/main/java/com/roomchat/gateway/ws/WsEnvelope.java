package com.roomchat.gateway.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * WS 文本帧的扁平信封：所有入站/出站事件共用，按 type 路由，未用到的字段不输出。
 *
 * <p>id 语义的 long 字段（conversationId/messageId/userIds...）按字符串下发，入站时字符串和数字都接受。</p>
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WsEnvelope {

    /** 事件类型，小写下划线，例如 send_message / new_message / error。 */
    public String type;

    /** 客户端生成的临时 id，用于把 message_sent / message_failed 对回本地气泡，也是重发幂等键。 */
    public String clientTempId;

    public Long conversationId;

    public Long messageId;

    /** 事件主体用户：状态变化/输入中/reaction 的发起人。 */
    public Long userId;

    public String content;

    /** 消息内容类型：text/image/file/location/shared_listing/system。 */
    public String msgType;

    public Map<String, Object> metadata;

    public Long replyToId;

    public String reaction;

    public Boolean forEveryone;

    /** 在线状态：online/away/busy/offline。 */
    public String status;

    public String activity;

    public String activityDetail;

    public Boolean isTyping;

    /** 毫秒时间戳。 */
    public Long deliveredAt;

    public Long readAt;

    public Long readerId;

    public Long lastSeen;

    /** 完整的消息对象（new_message / message_sent / message_edited ...）。 */
    public Object message;

    /** 会话对象（conversation_created）。 */
    public Object conversation;

    /** reaction 全量列表（message_reaction）。 */
    public Object reactions;

    public List<Long> messageIds;

    /** connected 时为当前在线用户。 */
    public List<Long> userIds;

    public List<Long> participantIds;

    /** create_conversation：direct/group/support。 */
    public String conversationType;

    public String title;

    public Long matchId;

    public Long listingId;

    /** 仅入站 auth 使用，不回写。 */
    public String token;

    /** error 事件：错误分类，例如 permission_denied。 */
    public String code;

    /** error / message_failed：具体原因，例如 not_participant。 */
    public String reason;

    public Long ts;
}
