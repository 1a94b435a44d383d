package com.agora.cache;

import java.time.Duration;

/**
 * 캐시 항목 하나를 가리키는 키.
 * <p>
 * Redis 키는 {@code namespace:name} 형태로 만들어지며, 메트릭은 namespace 단위로 집계됩니다.
 * </p>
 *
 * @param namespace 캐시 묶음 이름 (예: settings)
 * @param name 묶음 안에서의 항목 이름 (예: signin)
 * @param ttl 값이 유지되는 시간
 * @param type 저장되는 값의 타입
 * @param <T> 캐시 값의 타입
 * @author Agora
 * @version 1.0
 */
public record CacheKey<T>(
    String namespace,
    String name,
    Duration ttl,
    Class<T> type
) {

    public CacheKey {
        if (namespace == null || namespace.isBlank() || name == null || name.isBlank()) {
            throw new IllegalArgumentException("캐시 키의 namespace와 name은 비어 있을 수 없습니다.");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("캐시 TTL은 0보다 커야 합니다: " + ttl);
        }
        if (type == null) {
            throw new IllegalArgumentException("캐시 값 타입이 필요합니다.");
        }
    }

    public static <T> CacheKey<T> of(String namespace, String name, Duration ttl, Class<T> type) {
        return new CacheKey<>(namespace, name, ttl, type);
    }

    public String key() {
        return namespace + ":" + name;
    }
}
