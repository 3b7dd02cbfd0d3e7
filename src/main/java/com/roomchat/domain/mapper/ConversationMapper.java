package com.roomchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.roomchat.domain.entity.ConversationEntity;
import com.roomchat.domain.enums.MessageType;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDate;
import java.time.LocalDateTime;

public interface ConversationMapper extends BaseMapper<ConversationEntity> {

    /**
     * 新消息投影：lastMessage + analytics 增量更新。
     *
     * <p>MySQL 单表 update 按从左到右赋值，后面的表达式看到的是前面已赋的新值：
     * average/response_count 必须写在 last_message_* 之前，messages_this_week/month 必须写在 week_start/month_start 之前。</p>
     */
    @Update("""
            update t_conversation
            set average_response_time_ms = if(last_message_sender_id is not null and last_message_sender_id <> #{senderId} and last_message_at is not null,
                    (average_response_time_ms * response_count + greatest(timestampdiff(MICROSECOND, last_message_at, #{at}) div 1000, 0)) div (response_count + 1),
                    average_response_time_ms),
                response_count = if(last_message_sender_id is not null and last_message_sender_id <> #{senderId} and last_message_at is not null,
                    response_count + 1,
                    response_count),
                messages_this_week = if(week_start = #{weekStart}, messages_this_week + 1, 1),
                week_start = #{weekStart},
                messages_this_month = if(month_start = #{monthStart}, messages_this_month + 1, 1),
                month_start = #{monthStart},
                total_messages = total_messages + 1,
                last_message_id = #{messageId},
                last_message_content = #{preview},
                last_message_sender_id = #{senderId},
                last_message_type = #{msgType},
                last_message_at = #{at},
                last_activity_at = #{at},
                updated_at = #{at}
            where id = #{conversationId}
            """)
    int applyNewMessage(@Param("conversationId") long conversationId,
                        @Param("messageId") long messageId,
                        @Param("senderId") long senderId,
                        @Param("msgType") MessageType msgType,
                        @Param("preview") String preview,
                        @Param("at") LocalDateTime at,
                        @Param("weekStart") LocalDate weekStart,
                        @Param("monthStart") LocalDate monthStart);

    @Update("""
            update t_conversation
            set last_message_content = #{preview}, updated_at = now(3)
            where id = #{conversationId} and last_message_id = #{messageId}
            """)
    int replaceLastMessagePreview(@Param("conversationId") long conversationId,
                                  @Param("messageId") long messageId,
                                  @Param("preview") String preview);
}
