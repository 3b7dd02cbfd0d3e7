package com.roomchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.roomchat.domain.entity.ConversationParticipantEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;
import java.util.List;

public interface ConversationParticipantMapper extends BaseMapper<ConversationParticipantEntity> {

    /**
     * 新消息：除发送者外、在会话中且未处于有效静音的成员 unread +1。
     */
    @Update("""
            update t_conversation_participant
            set unread_count = unread_count + 1, updated_at = #{now}
            where conversation_id = #{conversationId}
              and user_id <> #{senderId}
              and active = 1
              and (muted = 0 or (mute_until is not null and mute_until <= #{now}))
            """)
    int incrementUnread(@Param("conversationId") long conversationId,
                        @Param("senderId") long senderId,
                        @Param("now") LocalDateTime now);

    /**
     * 已读：unread 归零并推进已读游标。没有可变更内容时不更新（重复已读结果一致）。
     */
    @Update("""
            update t_conversation_participant
            set unread_count = 0,
                last_seen_at = #{at},
                last_read_message_id = greatest(ifnull(last_read_message_id, 0), #{messageId}),
                updated_at = #{at}
            where conversation_id = #{conversationId}
              and user_id = #{userId}
              and (unread_count > 0 or ifnull(last_read_message_id, 0) < #{messageId})
            """)
    int resetUnread(@Param("conversationId") long conversationId,
                    @Param("userId") long userId,
                    @Param("messageId") long messageId,
                    @Param("at") LocalDateTime at);

    @Update("""
            update t_conversation_participant
            set muted = #{muted}, mute_until = #{muteUntil}, updated_at = now(3)
            where conversation_id = #{conversationId} and user_id = #{userId} and active = 1
            """)
    int updateMute(@Param("conversationId") long conversationId,
                   @Param("userId") long userId,
                   @Param("muted") boolean muted,
                   @Param("muteUntil") LocalDateTime muteUntil);

    @Select("""
            select p.conversation_id
            from t_conversation_participant p
            join t_conversation c on c.id = p.conversation_id
            where p.user_id = #{userId}
              and p.active = 1
              and c.status = 1
            """)
    List<Long> selectActiveConversationIds(@Param("userId") long userId);

    @Select("""
            select ifnull(sum(p.unread_count), 0)
            from t_conversation_participant p
            join t_conversation c on c.id = p.conversation_id
            where p.user_id = #{userId}
              and p.active = 1
              and c.status = 1
            """)
    long sumUnread(@Param("userId") long userId);

    @Select("""
            select c.id
            from t_conversation c
            join t_conversation_participant a on a.conversation_id = c.id and a.user_id = #{userA} and a.active = 1
            join t_conversation_participant b on b.conversation_id = c.id and b.user_id = #{userB} and b.active = 1
            where c.type = 1
              and c.status = 1
            order by c.id
            limit 1
            """)
    Long selectActiveDirectConversationId(@Param("userA") long userA, @Param("userB") long userB);
}
