package com.jz.hive.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.jz.hive.domain.entity.UserModeration;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;

@Mapper
public interface UserModerationMapper extends BaseMapper<UserModeration> {

    /**
     * 当前读 + 行锁，持有到事务提交。
     * 可重复读下普通 SELECT 读的是事务快照，看不到并发事务刚提交的封禁，违规路径必须走这里。
     */
    @Select("SELECT * FROM user_moderation WHERE user_id = #{userId} FOR UPDATE")
    UserModeration selectForUpdate(@Param("userId") String userId);

    /**
     * 到期解封：条件写，只有一个并发读者能拿到 1，保证 suspension_removed 只记一次。
     */
    @Update("""
        UPDATE user_moderation
           SET warning_count = 0,
               suspension_ends_at = NULL,
               last_action = 'suspension_removed',
               last_action_at = #{now},
               updated_at = #{now}
         WHERE user_id = #{userId}
           AND suspension_ends_at IS NOT NULL
           AND suspension_ends_at <= #{now}
    """)
    int clearExpiredSuspension(@Param("userId") String userId, @Param("now") LocalDateTime now);

    /**
     * 原子 +1。封禁中的用户不加（返回 0）。
     * 这条 UPDATE 持有行锁直到事务提交，同一用户的并发违规在这里串行。
     */
    @Update("""
        UPDATE user_moderation
           SET warning_count = warning_count + 1,
               last_action = 'warning_incremented',
               last_action_at = #{now},
               updated_at = #{now}
         WHERE user_id = #{userId}
           AND suspension_ends_at IS NULL
    """)
    int incrementWarning(@Param("userId") String userId, @Param("now") LocalDateTime now);

    @Update("""
        UPDATE user_moderation
           SET suspension_ends_at = #{endsAt},
               last_action = 'suspended',
               last_action_at = #{now},
               updated_at = #{now}
         WHERE user_id = #{userId}
    """)
    int suspend(@Param("userId") String userId,
                @Param("endsAt") LocalDateTime endsAt,
                @Param("now") LocalDateTime now);
}
