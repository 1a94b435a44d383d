package com.agora.cache;

import java.util.function.Supplier;

/**
 * 원본 저장소 앞에 놓이는 읽기 캐시.
 * <p>
 * 캐시 장애는 호출자에게 전파되지 않습니다. 캐시를 읽지 못하면 로더로 원본을 읽습니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
public interface CacheTemplate {

    /**
     * 캐시 값을 반환하고, 없으면 로더 결과를 캐시에 저장한 뒤 반환합니다.
     * 로더가 null을 반환하면 저장하지 않습니다.
     *
     * @param cacheKey 캐시 키
     * @param loader 원본 조회 함수
     * @param <T> 캐시 값의 타입
     * @return 캐시 값 또는 로더 결과
     */
    <T> T getOrLoad(CacheKey<T> cacheKey, Supplier<T> loader);

    /**
     * 캐시 값을 지웁니다. 다음 조회는 원본을 다시 읽습니다.
     *
     * @param cacheKey 캐시 키
     */
    void evict(CacheKey<?> cacheKey);
}
