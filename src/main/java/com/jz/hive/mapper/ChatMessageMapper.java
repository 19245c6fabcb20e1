package com.jz.hive.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.hive.domain.entity.ChatMessage;
import org.apache.ibatis.annotations.*;

import java.time.LocalDateTime;
import java.util.List;


@Mapper
public interface ChatMessageMapper extends BaseMapper<ChatMessage> {

    @Select("""
        SELECT * FROM chat_message
         WHERE conversation_id = #{conversationId}
           AND seq > #{afterSeq}
         ORDER BY seq ASC
         LIMIT #{limit}
    """)
    List<ChatMessage> selectAfterSeq(@Param("conversationId") String conversationId,
                                     @Param("afterSeq") long afterSeq,
                                     @Param("limit") int limit);

    /** 只找还在 calling 状态的占位消息，已经结算过的不算 */
    @Select("""
        SELECT * FROM chat_message
         WHERE conversation_id = #{conversationId}
           AND call_id = #{callId}
           AND call_status = 'calling'
         LIMIT 1
    """)
    ChatMessage selectCallingPlaceholder(@Param("conversationId") String conversationId,
                                         @Param("callId") String callId);

    @Update("""
        UPDATE chat_message
           SET content = #{content},
               call_status = #{status},
               call_duration_ms = #{durationMs},
               updated_at = #{now}
         WHERE id = #{id} AND call_status = 'calling'
    """)
    int resolveCallPlaceholder(@Param("id") Long id,
                               @Param("content") String content,
                               @Param("status") String status,
                               @Param("durationMs") Long durationMs,
                               @Param("now") LocalDateTime now);

    @Delete("""
        DELETE FROM chat_message
         WHERE id = #{id} AND call_status = 'calling'
    """)
    int deleteCallPlaceholder(@Param("id") Long id);
}
