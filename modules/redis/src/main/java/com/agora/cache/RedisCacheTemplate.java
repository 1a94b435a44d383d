package com.agora.cache;

import com.agora.config.redis.RedisConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Redis 문자열 값에 JSON을 저장하는 {@link CacheTemplate}.
 * <p>
 * 조회는 레플리카 우선 템플릿으로, 저장과 삭제는 마스터 템플릿으로 보냅니다.
 * 설정을 바꾼 직후의 evict가 레플리카 지연 때문에 묻히지 않도록 하기 위함입니다.
 * </p>
 * <p>
 * 조회 결과는 {@code cache.requests} 카운터에 namespace와 결과(hit, miss, error)별로 기록됩니다.
 * 저장된 JSON이 현재 타입으로 복원되지 않으면 항목을 지우고 미스로 처리합니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Slf4j
@Component
public class RedisCacheTemplate implements CacheTemplate {

    static final String METRIC_NAME = "cache.requests";

    private final RedisTemplate<String, String> readTemplate;
    private final RedisTemplate<String, String> writeTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public RedisCacheTemplate(
        RedisTemplate<String, String> readTemplate,
        @Qualifier(RedisConfig.REDIS_TEMPLATE_MASTER) RedisTemplate<String, String> writeTemplate,
        ObjectMapper objectMapper,
        MeterRegistry meterRegistry
    ) {
        this.readTemplate = readTemplate;
        this.writeTemplate = writeTemplate;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public <T> T getOrLoad(CacheKey<T> cacheKey, Supplier<T> loader) {
        String json;
        try {
            json = readTemplate.opsForValue().get(cacheKey.key());
        } catch (DataAccessException e) {
            log.warn("캐시 조회 실패, 원본을 읽습니다: key={}", cacheKey.key(), e);
            count(cacheKey, "error");
            return loader.get();
        }

        if (json != null) {
            try {
                T cached = objectMapper.readValue(json, cacheKey.type());
                count(cacheKey, "hit");
                return cached;
            } catch (JsonProcessingException e) {
                log.warn("캐시 값 복원 실패, 항목을 제거합니다: key={}", cacheKey.key(), e);
                count(cacheKey, "error");
                evict(cacheKey);
            }
        } else {
            count(cacheKey, "miss");
        }

        T loaded = loader.get();
        if (loaded != null) {
            write(cacheKey, loaded);
        }
        return loaded;
    }

    @Override
    public void evict(CacheKey<?> cacheKey) {
        try {
            writeTemplate.delete(cacheKey.key());
        } catch (DataAccessException e) {
            log.warn("캐시 삭제 실패: key={}", cacheKey.key(), e);
        }
    }

    private <T> void write(CacheKey<T> cacheKey, T value) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("캐시 값 직렬화 실패: key={}, type={}", cacheKey.key(), cacheKey.type().getSimpleName(), e);
            return;
        }
        try {
            writeTemplate.opsForValue().set(cacheKey.key(), json, cacheKey.ttl());
        } catch (DataAccessException e) {
            log.warn("캐시 저장 실패: key={}", cacheKey.key(), e);
        }
    }

    private void count(CacheKey<?> cacheKey, String result) {
        Counter.builder(METRIC_NAME)
            .tag("name", cacheKey.namespace())
            .tag("result", result)
            .register(meterRegistry)
            .increment();
    }
}
