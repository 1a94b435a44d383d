package com.agora.zset;

import com.agora.config.redis.RedisConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ZSetOperations.TypedTuple;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 랭킹용 Redis ZSET 접근.
 * <p>
 * 점수는 항상 높은 순으로 읽습니다. 쓰기는 마스터 템플릿으로 보내고, 조회는 레플리카 우선 템플릿을 씁니다.
 * </p>
 * <p>
 * <b>버전 점수:</b> {@link #putScoreIfNewer}와 {@link #mergeIfNewer}는 멤버별 버전을
 * {@code {key}:version} 해시에 함께 기록하고, 더 낮은 버전의 쓰기는 무시합니다.
 * DB 스냅샷으로 재구성하는 동안 들어온 실시간 갱신이 오래된 스냅샷에 덮이지 않습니다.
 * </p>
 * <p>
 * <b>실패 처리:</b>
 * <ul>
 *   <li>{@link #putScore}, {@link #putScoreIfNewer}, {@link #expireIfPersistent}: 요청 흐름의 부가 작업이므로 경고 로그 후 false</li>
 *   <li>조회와 재구성용 병합: {@link DataAccessException}을 호출자에게 전파</li>
 * </ul>
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Slf4j
@Component
public class RedisZSetTemplate {

    private static final int MERGE_BATCH = 500;

    private static final RedisScript<Long> PUT_IF_NEWER_SCRIPT = new DefaultRedisScript<>(
        "local updated = 0 "
            + "for i = 1, #ARGV, 3 do "
            + "  local current = redis.call('HGET', KEYS[2], ARGV[i]) "
            + "  if (not current) or tonumber(current) <= tonumber(ARGV[i + 2]) then "
            + "    redis.call('ZADD', KEYS[1], ARGV[i + 1], ARGV[i]) "
            + "    redis.call('HSET', KEYS[2], ARGV[i], ARGV[i + 2]) "
            + "    updated = updated + 1 "
            + "  end "
            + "end "
            + "return updated",
        Long.class
    );

    private static final RedisScript<Long> REMOVE_OLDER_SCRIPT = new DefaultRedisScript<>(
        "local floor = tonumber(ARGV[1]) "
            + "local removed = 0 "
            + "for _, member in ipairs(redis.call('ZRANGE', KEYS[1], 0, -1)) do "
            + "  local version = redis.call('HGET', KEYS[2], member) "
            + "  if (not version) or tonumber(version) < floor then "
            + "    redis.call('ZREM', KEYS[1], member) "
            + "    redis.call('HDEL', KEYS[2], member) "
            + "    removed = removed + 1 "
            + "  end "
            + "end "
            + "for _, member in ipairs(redis.call('HKEYS', KEYS[2])) do "
            + "  if tonumber(redis.call('HGET', KEYS[2], member)) < floor then "
            + "    redis.call('HDEL', KEYS[2], member) "
            + "  end "
            + "end "
            + "return removed",
        Long.class
    );

    private final RedisTemplate<String, String> readTemplate;
    private final RedisTemplate<String, String> writeTemplate;

    public RedisZSetTemplate(
        RedisTemplate<String, String> readTemplate,
        @Qualifier(RedisConfig.REDIS_TEMPLATE_MASTER) RedisTemplate<String, String> writeTemplate
    ) {
        this.readTemplate = readTemplate;
        this.writeTemplate = writeTemplate;
    }

    /**
     * 멤버의 점수를 주어진 값으로 덮어씁니다. 누적하지 않습니다.
     *
     * @return 반영 여부
     */
    public boolean putScore(String key, String member, double score) {
        try {
            writeTemplate.opsForZSet().add(key, member, score);
            return true;
        } catch (DataAccessException e) {
            log.warn("ZSET 점수 기록 실패: key={}, member={}, score={}", key, member, score, e);
            return false;
        }
    }

    /**
     * 기록된 버전보다 낮지 않을 때만 멤버의 점수를 덮어씁니다.
     *
     * @return 쓰기 시도가 Redis에 전달되었으면 true (버전이 낮아 무시된 경우 포함)
     */
    public boolean putScoreIfNewer(String key, VersionedScore score) {
        try {
            executePutIfNewer(key, List.of(score));
            return true;
        } catch (DataAccessException e) {
            log.warn("ZSET 버전 점수 기록 실패: key={}, member={}, score={}, version={}",
                key, score.member(), score.score(), score.version(), e);
            return false;
        }
    }

    /**
     * 만료 시간이 걸려 있지 않은 키에만 TTL을 겁니다. 이미 걸린 TTL은 연장하지 않습니다.
     *
     * @return 반영 여부
     */
    public boolean expireIfPersistent(String key, Duration ttl) {
        try {
            applyTtlIfPersistent(key, ttl);
            return true;
        } catch (DataAccessException e) {
            log.warn("ZSET TTL 설정 실패: key={}, ttl={}", key, ttl, e);
            return false;
        }
    }

    /**
     * 점수 집합을 기존 키에 더합니다. 집합에 없는 기존 멤버는 그대로 둡니다.
     *
     * @param key ZSET 키
     * @param scores 멤버별 점수
     * @param ttl 키에 만료 시간이 없을 때 걸 TTL, null이면 걸지 않음
     */
    public void mergeScores(String key, Map<String, Double> scores, Duration ttl) {
        if (scores.isEmpty()) {
            return;
        }
        Set<TypedTuple<String>> tuples = scores.entrySet().stream()
            .filter(entry -> entry.getValue() != null)
            .map(entry -> TypedTuple.of(entry.getKey(), entry.getValue()))
            .collect(Collectors.toSet());
        writeTemplate.opsForZSet().add(key, tuples);
        if (ttl != null) {
            applyTtlIfPersistent(key, ttl);
        }
    }

    /**
     * 버전 점수 집합을 기존 키에 병합합니다. 멤버마다 기록된 버전보다 낮은 항목은 건너뜁니다.
     *
     * @return 실제로 갱신된 멤버 수
     */
    public int mergeIfNewer(String key, Collection<VersionedScore> scores) {
        List<VersionedScore> all = List.copyOf(scores);
        int updated = 0;
        for (int from = 0; from < all.size(); from += MERGE_BATCH) {
            updated += executePutIfNewer(key, all.subList(from, Math.min(from + MERGE_BATCH, all.size())));
        }
        return updated;
    }

    /**
     * 버전이 {@code minVersion}보다 낮거나 버전이 없는 멤버를 지웁니다.
     *
     * @return 지운 멤버 수
     */
    public int removeOlderThan(String key, long minVersion) {
        Long removed = writeTemplate.execute(REMOVE_OLDER_SCRIPT, List.of(key, versionKey(key)), String.valueOf(minVersion));
        return removed != null ? removed.intValue() : 0;
    }

    /**
     * 점수가 높은 순으로 0부터 센 순위. 멤버가 없으면 empty.
     */
    public Optional<Long> rankOf(String key, String member) {
        return Optional.ofNullable(readTemplate.opsForZSet().reverseRank(key, member));
    }

    /**
     * 점수가 높은 순으로 상위 {@code count}개 멤버를 읽습니다.
     * 같은 점수는 Redis의 사전 역순 정렬을 따릅니다.
     *
     * @param key ZSET 키
     * @param count 읽을 개수
     * @return 멤버와 점수, 키가 없으면 빈 목록
     */
    public List<ZSetEntry> top(String key, int count) {
        if (count <= 0) {
            return List.of();
        }
        Set<TypedTuple<String>> tuples = readTemplate.opsForZSet().reverseRangeWithScores(key, 0, count - 1L);
        if (tuples == null) {
            return List.of();
        }
        return tuples.stream()
            .filter(tuple -> tuple.getValue() != null && tuple.getScore() != null)
            .map(tuple -> new ZSetEntry(tuple.getValue(), tuple.getScore()))
            .toList();
    }

    static String versionKey(String key) {
        return key + ":version";
    }

    private int executePutIfNewer(String key, List<VersionedScore> scores) {
        List<String> args = new ArrayList<>(scores.size() * 3);
        for (VersionedScore score : scores) {
            args.add(score.member());
            args.add(String.valueOf(score.score()));
            args.add(String.valueOf(score.version()));
        }
        Long updated = writeTemplate.execute(PUT_IF_NEWER_SCRIPT, List.of(key, versionKey(key)), args.toArray());
        return updated != null ? updated.intValue() : 0;
    }

    private void applyTtlIfPersistent(String key, Duration ttl) {
        Long remaining = writeTemplate.getExpire(key);
        if (remaining != null && remaining == -1L) {
            writeTemplate.expire(key, ttl);
        }
    }
}
