package com.roomchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.roomchat.domain.entity.MessageEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * 状态列的所有迁移都是带前置条件的单行 update，返回 0 表示状态已不满足（重复 ACK/并发），调用方按幂等处理。
 */
public interface MessageMapper extends BaseMapper<MessageEntity> {

    @Update("""
            update t_message
            set status = 1, delivered_at = #{at}, updated_at = #{at}
            where id = #{id} and status = 0
            """)
    int markDelivered(@Param("id") long id, @Param("at") LocalDateTime at);

    @Update("""
            update t_message
            set status = 2, read_at = #{at}, delivered_at = ifnull(delivered_at, #{at}), updated_at = #{at}
            where id = #{id} and status in (0, 1)
            """)
    int markRead(@Param("id") long id, @Param("at") LocalDateTime at);

    /**
     * 失败时释放 client_temp_id，客户端用同一个 clientTempId 重发时不会撞唯一键。
     */
    @Update("""
            update t_message
            set status = 3, client_temp_id = null, updated_at = #{at}
            where id = #{id} and status = 0
            """)
    int markFailed(@Param("id") long id, @Param("at") LocalDateTime at);

    /**
     * 会话内 reader 可标记为已读的消息 id：非本人发送、状态仍为 sent/delivered。ids 为空表示全部。
     */
    @Select("""
            <script>
            select id
            from t_message
            where conversation_id = #{conversationId}
              and sender_id &lt;&gt; #{readerId}
              and status in (0, 1)
              <if test="ids != null and ids.size() > 0">
                and id in
                <foreach collection="ids" item="mid" open="(" separator="," close=")">
                  #{mid}
                </foreach>
              </if>
            order by id
            limit 1000
            </script>
            """)
    List<Long> selectReadableIds(@Param("conversationId") long conversationId,
                                 @Param("readerId") long readerId,
                                 @Param("ids") Collection<Long> ids);

    @Update("""
            <script>
            update t_message
            set status = 2, read_at = #{at}, delivered_at = ifnull(delivered_at, #{at}), updated_at = #{at}
            where status in (0, 1)
              and id in
              <foreach collection="ids" item="mid" open="(" separator="," close=")">
                #{mid}
              </foreach>
            </script>
            """)
    int markReadByIds(@Param("ids") Collection<Long> ids, @Param("at") LocalDateTime at);

    /**
     * 编辑：仅本人、仅文本、未删除。original_content 只在首次编辑时写入（赋值顺序在 content 之前）。
     */
    @Update("""
            update t_message
            set original_content = ifnull(original_content, content),
                content = #{content},
                edited = 1,
                edited_at = #{at},
                updated_at = #{at}
            where id = #{id} and sender_id = #{senderId} and deleted = 0 and msg_type = 1
            """)
    int applyEdit(@Param("id") long id,
                  @Param("senderId") long senderId,
                  @Param("content") String content,
                  @Param("at") LocalDateTime at);

    /**
     * 软删除；全员删除时保留原文到 original_content 并替换 content。仅自己删除过的消息可再升级为全员删除。
     */
    @Update("""
            <script>
            update t_message
            set deleted = 1,
                deleted_at = #{at},
                deleted_by = #{senderId},
                <if test="forEveryone">
                original_content = ifnull(original_content, content),
                content = #{placeholder},
                deleted_for_everyone = 1,
                </if>
                updated_at = #{at}
            where id = #{id} and sender_id = #{senderId}
              <choose>
                <when test="forEveryone">and deleted_for_everyone = 0</when>
                <otherwise>and deleted = 0</otherwise>
              </choose>
            </script>
            """)
    int softDelete(@Param("id") long id,
                   @Param("senderId") long senderId,
                   @Param("forEveryone") boolean forEveryone,
                   @Param("placeholder") String placeholder,
                   @Param("at") LocalDateTime at);
}
