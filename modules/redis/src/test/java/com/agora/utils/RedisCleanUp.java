package com.agora.utils;

import com.agora.config.redis.RedisConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redis 테스트 정리 유틸리티.
 * <p>
 * 테스트 간 격리를 위해 마스터의 모든 키를 지웁니다.
 * 테스트 환경에서만 사용해야 합니다.
 * </p>
 */
@Component
public class RedisCleanUp {

    private final RedisTemplate<String, String> redisTemplate;

    public RedisCleanUp(@Qualifier(RedisConfig.REDIS_TEMPLATE_MASTER) RedisTemplate<String, String> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    public void truncateAll() {
        redisTemplate.execute((RedisCallback<Void>) connection -> {
            connection.serverCommands().flushAll();
            return null;
        });
    }
}
