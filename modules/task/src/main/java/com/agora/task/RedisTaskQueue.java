package com.agora.task;

import com.agora.config.redis.RedisConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Redis 기반 {@link TaskQueue} 구현체.
 * <p>
 * <b>키 구성</b> (접두사가 {@code task}인 경우):
 * <ul>
 *   <li>{@code {task}:pending}: List, 왼쪽으로 넣고 오른쪽에서 꺼냄</li>
 *   <li>{@code {task}:processing}: ZSET, 점수는 가시성 만료 시각</li>
 *   <li>{@code {task}:delayed}: ZSET, 점수는 재시도 예정 시각</li>
 *   <li>{@code {task}:dead}: List, 최신 항목이 왼쪽</li>
 * </ul>
 * 키는 같은 해시 태그를 공유하므로 클러스터에서도 Lua 스크립트가 한 슬롯 안에서 실행됩니다.
 * 영역 간 이동은 모두 Lua 스크립트로 원자적으로 처리합니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Slf4j
@Component
public class RedisTaskQueue implements TaskQueue {

    private static final int PROMOTE_BATCH = 100;

    private static final RedisScript<String> POLL_SCRIPT = new DefaultRedisScript<>(
        "local raw = redis.call('RPOP', KEYS[1]) "
            + "if raw then redis.call('ZADD', KEYS[2], ARGV[1], raw) end "
            + "return raw",
        String.class
    );

    private static final RedisScript<Long> MOVE_DUE_SCRIPT = new DefaultRedisScript<>(
        "local due = redis.call('ZRANGEBYSCORE', KEYS[1], '-inf', ARGV[1], 'LIMIT', 0, tonumber(ARGV[2])) "
            + "for _, raw in ipairs(due) do "
            + "  redis.call('ZREM', KEYS[1], raw) "
            + "  redis.call('LPUSH', KEYS[2], raw) "
            + "end "
            + "return #due",
        Long.class
    );

    private static final RedisScript<Long> RETRY_SCRIPT = new DefaultRedisScript<>(
        "redis.call('ZREM', KEYS[1], ARGV[1]) "
            + "redis.call('ZADD', KEYS[2], ARGV[3], ARGV[2]) "
            + "return 1",
        Long.class
    );

    private static final RedisScript<Long> DEAD_LETTER_SCRIPT = new DefaultRedisScript<>(
        "redis.call('ZREM', KEYS[1], ARGV[1]) "
            + "redis.call('LPUSH', KEYS[2], ARGV[2]) "
            + "redis.call('LTRIM', KEYS[2], 0, tonumber(ARGV[3]) - 1) "
            + "return 1",
        Long.class
    );

    private static final RedisScript<Long> REQUEUE_SCRIPT = new DefaultRedisScript<>(
        "if redis.call('ZREM', KEYS[1], ARGV[1]) == 1 then "
            + "  redis.call('RPUSH', KEYS[2], ARGV[1]) "
            + "  return 1 "
            + "end "
            + "return 0",
        Long.class
    );

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final int deadLetterLimit;
    private final String pendingKey;
    private final String processingKey;
    private final String delayedKey;
    private final String deadKey;

    public RedisTaskQueue(
        @Qualifier(RedisConfig.REDIS_TEMPLATE_MASTER) RedisTemplate<String, String> redisTemplate,
        ObjectMapper objectMapper,
        TaskProperties taskProperties
    ) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.deadLetterLimit = taskProperties.deadLetterLimit();
        String prefix = "{" + taskProperties.keyPrefix() + "}";
        this.pendingKey = prefix + ":pending";
        this.processingKey = prefix + ":processing";
        this.delayedKey = prefix + ":delayed";
        this.deadKey = prefix + ":dead";
    }

    @Override
    public void push(TaskEnvelope envelope) {
        redisTemplate.opsForList().leftPush(pendingKey, serialize(envelope));
    }

    @Override
    public Optional<QueuedTask> poll(Duration visibilityTimeout) {
        long invisibleUntil = System.currentTimeMillis() + visibilityTimeout.toMillis();
        String raw = redisTemplate.execute(POLL_SCRIPT, List.of(pendingKey, processingKey), String.valueOf(invisibleUntil));
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new QueuedTask(deserialize(raw), raw));
        } catch (TaskSerializationException e) {
            // 읽을 수 없는 항목은 재시도해도 같으므로 원문 그대로 데드 레터로 보낸다
            log.error("작업 역직렬화 실패, 데드 레터로 이동: raw={}", raw, e);
            redisTemplate.execute(DEAD_LETTER_SCRIPT, List.of(processingKey, deadKey), raw, raw, String.valueOf(deadLetterLimit));
            return Optional.empty();
        }
    }

    @Override
    public void ack(QueuedTask task) {
        redisTemplate.opsForZSet().remove(processingKey, task.receipt());
    }

    @Override
    public void retry(QueuedTask task, TaskEnvelope updated, Duration delay) {
        long dueAt = System.currentTimeMillis() + delay.toMillis();
        redisTemplate.execute(RETRY_SCRIPT, List.of(processingKey, delayedKey),
            task.receipt(), serialize(updated), String.valueOf(dueAt));
    }

    @Override
    public void deadLetter(QueuedTask task, TaskEnvelope updated) {
        redisTemplate.execute(DEAD_LETTER_SCRIPT, List.of(processingKey, deadKey),
            task.receipt(), serialize(updated), String.valueOf(deadLetterLimit));
    }

    @Override
    public boolean requeue(QueuedTask task) {
        Long moved = redisTemplate.execute(REQUEUE_SCRIPT, List.of(processingKey, pendingKey), task.receipt());
        return moved != null && moved == 1L;
    }

    @Override
    public int promoteDue(Instant now) {
        String nowMillis = String.valueOf(now.toEpochMilli());
        String batch = String.valueOf(PROMOTE_BATCH);
        Long retried = redisTemplate.execute(MOVE_DUE_SCRIPT, List.of(delayedKey, pendingKey), nowMillis, batch);
        Long expired = redisTemplate.execute(MOVE_DUE_SCRIPT, List.of(processingKey, pendingKey), nowMillis, batch);
        if (expired != null && expired > 0) {
            log.warn("가시성 만료된 작업을 대기열로 되돌림: count={}", expired);
        }
        return (int) (nullToZero(retried) + nullToZero(expired));
    }

    @Override
    public long pendingCount() {
        Long size = redisTemplate.opsForList().size(pendingKey);
        return nullToZero(size);
    }

    @Override
    public List<TaskEnvelope> deadLetters(int limit) {
        List<String> raws = redisTemplate.opsForList().range(deadKey, 0, limit - 1L);
        if (raws == null) {
            return List.of();
        }
        List<TaskEnvelope> envelopes = new ArrayList<>();
        for (String raw : raws) {
            try {
                envelopes.add(deserialize(raw));
            } catch (TaskSerializationException e) {
                log.warn("데드 레터 항목을 읽을 수 없음: raw={}", raw);
            }
        }
        return envelopes;
    }

    private long nullToZero(Long value) {
        return value != null ? value : 0L;
    }

    private String serialize(TaskEnvelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new TaskSerializationException("작업 직렬화 실패: " + envelope.name(), e);
        }
    }

    private TaskEnvelope deserialize(String raw) {
        try {
            return objectMapper.readValue(raw, TaskEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new TaskSerializationException("작업 역직렬화 실패", e);
        }
    }
}
