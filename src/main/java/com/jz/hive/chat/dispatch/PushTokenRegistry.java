package com.jz.hive.chat.dispatch;

import com.jz.hive.config.NotificationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/** 每个用户的推送 token 集合，Redis set：SADD 注册，SREM 注销/清理 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PushTokenRegistry {

    private final StringRedisTemplate redis;
    private final NotificationProperties props;

    public void register(String userId, String token) {
        redis.opsForSet().add(key(userId), token);
    }

    public void unregister(String userId, String token) {
        redis.opsForSet().remove(key(userId), token);
    }

    public List<String> tokensOf(String userId) {
        Set<String> members = redis.opsForSet().members(key(userId));
        return members == null ? List.of() : List.copyOf(members);
    }

    public void prune(String userId, Collection<String> invalidTokens) {
        if (invalidTokens == null || invalidTokens.isEmpty()) return;
        Long removed = redis.opsForSet().remove(key(userId), invalidTokens.toArray());
        log.info("pruned invalid push tokens, userId={}, requested={}, removed={}", userId, invalidTokens.size(), removed);
    }

    private String key(String userId) {
        return props.getTokenKeyPrefix() + userId;
    }
}
