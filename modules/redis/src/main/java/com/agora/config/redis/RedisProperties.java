package com.agora.config.redis;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Redis 접속 정보.
 * <p>
 * 마스터 한 대와 0대 이상의 레플리카로 구성됩니다. 명령 타임아웃을 지정하지 않으면 2초를 사용합니다.
 * 출석 락과 작업 큐는 이 타임아웃 안에 응답이 없으면 실패로 간주합니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@ConfigurationProperties(prefix = "datasource.redis")
public record RedisProperties(
        int database,
        RedisNodeInfo master,
        List<RedisNodeInfo> replicas,
        Duration commandTimeout,
        String clientName
) {
    private static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(2);

    public RedisProperties {
        if (master == null) {
            throw new IllegalArgumentException("datasource.redis.master 설정이 필요합니다.");
        }
        replicas = replicas != null ? List.copyOf(replicas) : List.of();
        commandTimeout = commandTimeout != null ? commandTimeout : DEFAULT_COMMAND_TIMEOUT;
        clientName = clientName != null && !clientName.isBlank() ? clientName : "agora-forum";
    }

    public boolean hasReplicas() {
        return !replicas.isEmpty();
    }
}
