package com.jz.hive.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.hive.domain.entity.ModerationLog;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface ModerationLogMapper extends BaseMapper<ModerationLog> {

    @Select("""
        SELECT * FROM moderation_log
         ORDER BY id DESC
         LIMIT #{limit}
    """)
    List<ModerationLog> selectRecent(@Param("limit") int limit);

    @Select("""
        SELECT * FROM moderation_log
         WHERE user_id = #{userId}
         ORDER BY id DESC
         LIMIT #{limit}
    """)
    List<ModerationLog> selectRecentByUser(@Param("userId") String userId, @Param("limit") int limit);
}
