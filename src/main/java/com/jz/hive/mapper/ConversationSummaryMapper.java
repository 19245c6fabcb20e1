package com.jz.hive.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.hive.domain.entity.ConversationSummary;
import org.apache.ibatis.annotations.*;

import java.time.LocalDateTime;
import java.util.List;

@Mapper
public interface ConversationSummaryMapper extends BaseMapper<ConversationSummary> {

    /** 收件人：更新最后一条 + 未读原子 +1（不是先读后写） */
    @Update("""
        UPDATE conversation_summary
           SET last_message = #{lastMessage},
               updated_at = #{now},
               unread_count = unread_count + 1
         WHERE owner_user_id = #{ownerUserId} AND peer_id = #{peerId}
    """)
    int bumpUnread(@Param("ownerUserId") String ownerUserId,
                   @Param("peerId") String peerId,
                   @Param("lastMessage") String lastMessage,
                   @Param("now") LocalDateTime now);

    /** 发送者自己：只更新最后一条，未读不动 */
    @Update("""
        UPDATE conversation_summary
           SET last_message = #{lastMessage},
               updated_at = #{now}
         WHERE owner_user_id = #{ownerUserId} AND peer_id = #{peerId}
    """)
    int touch(@Param("ownerUserId") String ownerUserId,
              @Param("peerId") String peerId,
              @Param("lastMessage") String lastMessage,
              @Param("now") LocalDateTime now);

    @Update("""
        UPDATE conversation_summary
           SET unread_count = 0
         WHERE owner_user_id = #{ownerUserId} AND peer_id = #{peerId}
    """)
    int markRead(@Param("ownerUserId") String ownerUserId, @Param("peerId") String peerId);

    @Select("""
        SELECT * FROM conversation_summary
         WHERE owner_user_id = #{ownerUserId} AND peer_id = #{peerId}
    """)
    ConversationSummary selectByOwnerAndPeer(@Param("ownerUserId") String ownerUserId,
                                             @Param("peerId") String peerId);

    @Select("""
        SELECT * FROM conversation_summary
         WHERE owner_user_id = #{ownerUserId}
         ORDER BY updated_at DESC
    """)
    List<ConversationSummary> selectInbox(@Param("ownerUserId") String ownerUserId);

    @Delete("""
        DELETE FROM conversation_summary
         WHERE owner_user_id = #{ownerUserId} AND conversation_id = #{conversationId}
    """)
    int deleteByOwnerAndConversation(@Param("ownerUserId") String ownerUserId,
                                     @Param("conversationId") String conversationId);
}
