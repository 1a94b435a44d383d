package com.agora.lock;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisDistributedLockTest {

    private static final String KEY = "signin:lock:user-1";
    private static final Duration LEASE = Duration.ofSeconds(10);

    @Mock
    private RedisTemplate<String, String> redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private SimpleMeterRegistry meterRegistry;
    private RedisDistributedLock distributedLock;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        distributedLock = new RedisDistributedLock(redisTemplate, meterRegistry);
    }

    @DisplayName("락을 획득할 때,")
    @Nested
    class Acquire {

        @DisplayName("키가 비어 있으면 소유권 증표를 발급한다.")
        @Test
        void returnsToken_whenKeyIsFree() {
            // arrange
            when(redisTemplate.opsForValue()).thenReturn(valueOperations);
            when(valueOperations.setIfAbsent(eq(KEY), anyString(), eq(LEASE))).thenReturn(true);

            // act
            Optional<LockToken> token = distributedLock.tryAcquire(KEY, LEASE);

            // assert
            assertThat(token).isPresent();
            assertThat(token.get().key()).isEqualTo(KEY);
            assertThat(token.get().value()).isNotBlank();
            assertThat(meterRegistry.counter("lock.acquired").count()).isEqualTo(1.0);
        }

        @DisplayName("두 번째 시도에서 풀리면 대기 후 획득한다.")
        @Test
        void retriesUntilAcquired() {
            // arrange
            when(redisTemplate.opsForValue()).thenReturn(valueOperations);
            when(valueOperations.setIfAbsent(eq(KEY), anyString(), eq(LEASE))).thenReturn(false, true);

            // act
            LockToken token = distributedLock.acquire(KEY, LEASE, Duration.ofSeconds(1));

            // assert
            assertThat(token.key()).isEqualTo(KEY);
            verify(valueOperations, times(2)).setIfAbsent(eq(KEY), anyString(), eq(LEASE));
        }

        @DisplayName("대기 시간 안에 풀리지 않으면 LockTimeoutException이 발생한다.")
        @Test
        void throwsLockTimeout_whenWaitElapses() {
            // arrange
            when(redisTemplate.opsForValue()).thenReturn(valueOperations);
            when(valueOperations.setIfAbsent(eq(KEY), anyString(), eq(LEASE))).thenReturn(false);

            // act
            LockTimeoutException result = assertThrows(LockTimeoutException.class,
                () -> distributedLock.acquire(KEY, LEASE, Duration.ofMillis(250)));

            // assert
            assertThat(result.getKey()).isEqualTo(KEY);
            assertThat(meterRegistry.counter("lock.timeout").count()).isEqualTo(1.0);
        }
    }

    @DisplayName("락을 해제할 때,")
    @Nested
    class Release {

        @DisplayName("저장된 값이 증표와 같으면 삭제한다.")
        @Test
        void deletes_whenTokenMatches() {
            // arrange
            LockToken token = new LockToken(KEY, "owner");
            when(redisTemplate.execute(ArgumentMatchers.<RedisScript<Long>>any(), eq(List.of(KEY)), eq("owner")))
                .thenReturn(1L);

            // act
            boolean released = distributedLock.release(token);

            // assert
            assertThat(released).isTrue();
            assertThat(meterRegistry.counter("lock.release.mismatch").count()).isZero();
        }

        @DisplayName("다른 소유자의 락이면 예외 없이 아무것도 하지 않는다.")
        @Test
        void isNoOp_whenTokenMismatches() {
            // arrange
            LockToken staleToken = new LockToken(KEY, "expired-owner");
            when(redisTemplate.execute(ArgumentMatchers.<RedisScript<Long>>any(), eq(List.of(KEY)), eq("expired-owner")))
                .thenReturn(0L);

            // act
            boolean released = distributedLock.release(staleToken);

            // assert
            assertThat(released).isFalse();
            assertThat(meterRegistry.counter("lock.release.mismatch").count()).isEqualTo(1.0);
        }

        @DisplayName("Redis 장애로 해제에 실패해도 예외를 전파하지 않는다.")
        @Test
        void swallowsFailure_whenRedisIsDown() {
            // arrange
            LockToken token = new LockToken(KEY, "owner");
            when(redisTemplate.execute(ArgumentMatchers.<RedisScript<Long>>any(), eq(List.of(KEY)), eq("owner")))
                .thenThrow(new RedisConnectionFailureException("down"));

            // act
            boolean released = distributedLock.release(token);

            // assert
            assertThat(released).isFalse();
        }
    }

    @DisplayName("작업이 예외로 끝나도 락을 해제한다.")
    @Test
    void executeWithLock_releasesOnFailure() {
        // arrange
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq(KEY), anyString(), eq(LEASE))).thenReturn(true);

        // act
        assertThrows(IllegalStateException.class, () -> distributedLock.executeWithLock(
            KEY, LEASE, Duration.ofSeconds(1), () -> {
                throw new IllegalStateException("boom");
            }));

        // assert
        verify(redisTemplate).execute(ArgumentMatchers.<RedisScript<Long>>any(), eq(List.of(KEY)), anyString());
    }
}
