package com.jz.hive.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.hive.domain.entity.ConversationMember;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface ConversationMemberMapper extends BaseMapper<ConversationMember> {

    /** 按 user_id 排序：扇出时按固定顺序加行锁，避免两个并发批次互相死锁 */
    @Select("""
        SELECT * FROM conversation_member
         WHERE conversation_id = #{conversationId}
         ORDER BY user_id
    """)
    List<ConversationMember> selectByConversationId(@Param("conversationId") String conversationId);

    @Select("""
        SELECT COUNT(1) FROM conversation_member
         WHERE conversation_id = #{conversationId} AND user_id = #{userId}
    """)
    int countMember(@Param("conversationId") String conversationId, @Param("userId") String userId);

    @Delete("""
        DELETE FROM conversation_member
         WHERE conversation_id = #{conversationId} AND user_id = #{userId}
    """)
    int deleteMember(@Param("conversationId") String conversationId, @Param("userId") String userId);
}
