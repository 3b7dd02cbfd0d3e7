package com.roomchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.roomchat.domain.entity.MessageReactionEntity;
import com.roomchat.domain.enums.ReactionType;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.LocalDateTime;
import java.util.List;

public interface MessageReactionMapper extends BaseMapper<MessageReactionEntity> {

    /**
     * last-write-wins：(message_id, user_id) 唯一键冲突时覆盖 reaction。
     */
    @Insert("""
            insert into t_message_reaction (id, message_id, user_id, reaction, created_at, updated_at)
            values (#{id}, #{messageId}, #{userId}, #{reaction}, #{at}, #{at})
            on duplicate key update reaction = values(reaction), updated_at = values(updated_at)
            """)
    int upsert(@Param("id") long id,
               @Param("messageId") long messageId,
               @Param("userId") long userId,
               @Param("reaction") ReactionType reaction,
               @Param("at") LocalDateTime at);

    @Delete("""
            delete from t_message_reaction
            where message_id = #{messageId} and user_id = #{userId}
            """)
    int deleteByMessageAndUser(@Param("messageId") long messageId, @Param("userId") long userId);

    @Select("""
            select *
            from t_message_reaction
            where message_id = #{messageId}
            order by updated_at, id
            """)
    List<MessageReactionEntity> selectByMessageId(@Param("messageId") long messageId);
}
