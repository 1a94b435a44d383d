package com.agora.config.redis;

/**
 * Redis 노드 주소.
 *
 * @author Agora
 * @version 1.0
 */
public record RedisNodeInfo(
        String host,
        int port
) {
    public RedisNodeInfo {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Redis 호스트가 비어 있습니다.");
        }
        if (port <= 0) {
            throw new IllegalArgumentException("Redis 포트가 올바르지 않습니다: " + port);
        }
    }
}
