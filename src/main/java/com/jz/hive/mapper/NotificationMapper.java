package com.jz.hive.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.hive.domain.entity.Notification;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

@Mapper
public interface NotificationMapper extends BaseMapper<Notification> {

    @Select("""
        SELECT * FROM notification
         WHERE user_id = #{userId}
         ORDER BY id DESC
         LIMIT #{limit}
    """)
    List<Notification> selectRecent(@Param("userId") String userId, @Param("limit") int limit);

    @Update("""
        UPDATE notification SET is_read = TRUE
         WHERE id = #{id} AND user_id = #{userId}
    """)
    int markRead(@Param("id") Long id, @Param("userId") String userId);
}
