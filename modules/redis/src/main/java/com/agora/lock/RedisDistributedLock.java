package com.agora.lock;

import com.agora.config.redis.RedisConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis 기반 {@link DistributedLock} 구현체.
 * <p>
 * <b>동작 방식:</b>
 * <ul>
 *   <li>획득: {@code SET key token NX PX lease} 단일 명령으로 원자적으로 설정</li>
 *   <li>대기: 100ms 간격으로 재시도하다가 대기 시간이 지나면 {@link LockTimeoutException}</li>
 *   <li>해제: Lua 스크립트로 값 비교 후 삭제 (compare-and-delete)</li>
 * </ul>
 * </p>
 * <p>
 * 레플리카 지연으로 잘못된 값을 읽지 않도록 마스터 전용 템플릿을 사용합니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Slf4j
@Component
public class RedisDistributedLock implements DistributedLock {

    static final Duration RETRY_INTERVAL = Duration.ofMillis(100);

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
        "if redis.call('get', KEYS[1]) == ARGV[1] then "
            + "return redis.call('del', KEYS[1]) "
            + "else return 0 end",
        Long.class
    );

    private final RedisTemplate<String, String> redisTemplate;
    private final Counter acquiredCounter;
    private final Counter timeoutCounter;
    private final Counter releaseMismatchCounter;

    public RedisDistributedLock(
        @Qualifier(RedisConfig.REDIS_TEMPLATE_MASTER) RedisTemplate<String, String> redisTemplate,
        MeterRegistry meterRegistry
    ) {
        this.redisTemplate = redisTemplate;
        this.acquiredCounter = meterRegistry.counter("lock.acquired");
        this.timeoutCounter = meterRegistry.counter("lock.timeout");
        this.releaseMismatchCounter = meterRegistry.counter("lock.release.mismatch");
    }

    @Override
    public Optional<LockToken> tryAcquire(String key, Duration lease) {
        String value = UUID.randomUUID().toString();
        Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key, value, lease);
        if (Boolean.TRUE.equals(acquired)) {
            acquiredCounter.increment();
            return Optional.of(new LockToken(key, value));
        }
        return Optional.empty();
    }

    @Override
    public LockToken acquire(String key, Duration lease, Duration wait) {
        long deadline = System.nanoTime() + wait.toNanos();
        while (true) {
            Optional<LockToken> token = tryAcquire(key, lease);
            if (token.isPresent()) {
                return token.get();
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                timeoutCounter.increment();
                throw new LockTimeoutException(key, wait);
            }
            try {
                Thread.sleep(Math.min(RETRY_INTERVAL.toMillis(), Math.max(1L, remaining / 1_000_000L)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                timeoutCounter.increment();
                throw new LockTimeoutException(key, wait, e);
            }
        }
    }

    @Override
    public boolean release(LockToken token) {
        try {
            Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(token.key()), token.value());
            if (deleted == null || deleted == 0L) {
                releaseMismatchCounter.increment();
                log.warn("락 소유권 불일치로 해제하지 않음 (lease 만료 가능성): key={}", token.key());
                return false;
            }
            return true;
        } catch (Exception e) {
            // 해제에 실패해도 lease 만료로 풀린다
            log.warn("락 해제 실패: key={}", token.key(), e);
            return false;
        }
    }
}
