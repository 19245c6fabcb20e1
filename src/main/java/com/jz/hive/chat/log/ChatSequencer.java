package com.jz.hive.chat.log;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/** 会话内消息序号，历史按它排序 */
@Component
@RequiredArgsConstructor
public class ChatSequencer {

    static final String KEY_PREFIX = "chat:seq:";

    private final StringRedisTemplate redis;

    public long next(String conversationId) {
        // key 例：chat:seq:u1_u2
        Long v = redis.opsForValue().increment(KEY_PREFIX + conversationId);
        if (v == null) {
            // pipeline/事务模式下才会是 null，这里不该出现
            throw new IllegalStateException("INCR returned null for conversation " + conversationId);
        }
        return v;
    }
}
