package com.agora.zset;

import com.agora.config.redis.RedisConfig;
import com.agora.testcontainers.RedisTestContainersConfig;
import com.agora.utils.RedisCleanUp;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.core.RedisTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest(
    classes = {
        RedisTestContainersConfig.class,
        RedisConfig.class,
        RedisZSetTemplate.class,
        RedisCleanUp.class
    },
    properties = "spring.config.import=classpath:redis.yml"
)
@DisplayName("RedisZSetTemplate 통합 테스트")
class RedisZSetTemplateIntegrationTest {

    private static final String DAILY_KEY = "signin:ranking:daily:20241215";
    private static final String CONTINUOUS_KEY = "signin:ranking:continuous";
    private static final long YESTERDAY = 20072L;
    private static final long TODAY = 20073L;

    @Autowired
    private RedisZSetTemplate zSetTemplate;

    @Autowired
    @Qualifier(RedisConfig.REDIS_TEMPLATE_MASTER)
    private RedisTemplate<String, String> redisTemplate;

    @Autowired
    private RedisCleanUp redisCleanUp;

    @AfterEach
    void tearDown() {
        redisCleanUp.truncateAll();
    }

    @DisplayName("순위를 조회할 때,")
    @Nested
    class Rank {

        @DisplayName("점수가 높은 멤버가 1위(0부터 세면 0)가 된다.")
        @Test
        void ranksHigherScoreFirst() {
            // arrange
            zSetTemplate.putScore(DAILY_KEY, "A", 20);
            zSetTemplate.putScore(DAILY_KEY, "B", 50);

            // act
            List<ZSetEntry> top = zSetTemplate.top(DAILY_KEY, 10);

            // assert
            assertThat(top).extracting(ZSetEntry::member).containsExactly("B", "A");
            assertThat(top).extracting(ZSetEntry::scoreAsLong).containsExactly(50L, 20L);
            assertThat(zSetTemplate.rankOf(DAILY_KEY, "B")).contains(0L);
            assertThat(zSetTemplate.rankOf(DAILY_KEY, "A")).contains(1L);
            assertThat(zSetTemplate.rankOf(DAILY_KEY, "C")).isEmpty();
        }

        @DisplayName("같은 멤버를 다시 기록하면 점수를 누적하지 않고 덮어쓴다.")
        @Test
        void overwritesScore() {
            // arrange
            zSetTemplate.putScore(CONTINUOUS_KEY, "A", 3);

            // act
            zSetTemplate.putScore(CONTINUOUS_KEY, "A", 4);

            // assert
            assertThat(zSetTemplate.top(CONTINUOUS_KEY, 1)).containsExactly(new ZSetEntry("A", 4.0));
        }

        @DisplayName("키가 없으면 빈 목록을 돌려준다.")
        @Test
        void returnsEmpty_whenKeyIsMissing() {
            // act & assert
            assertThat(zSetTemplate.top("signin:ranking:daily:19990101", 10)).isEmpty();
        }
    }

    @DisplayName("TTL을 걸 때,")
    @Nested
    class Expire {

        @DisplayName("만료 시간이 없는 키에만 걸고, 이미 걸린 TTL은 연장하지 않는다.")
        @Test
        void appliesOnlyWhenPersistent() {
            // arrange
            zSetTemplate.putScore(DAILY_KEY, "A", 20);
            zSetTemplate.expireIfPersistent(DAILY_KEY, Duration.ofSeconds(100));

            // act
            zSetTemplate.expireIfPersistent(DAILY_KEY, Duration.ofDays(30));

            // assert
            assertThat(redisTemplate.getExpire(DAILY_KEY, TimeUnit.SECONDS)).isBetween(1L, 100L);
        }
    }

    @DisplayName("버전 점수를 기록할 때,")
    @Nested
    class Versioned {

        @DisplayName("기록된 버전보다 낮은 쓰기는 무시된다.")
        @Test
        void ignoresOlderVersion() {
            // arrange
            zSetTemplate.putScoreIfNewer(CONTINUOUS_KEY, new VersionedScore("A", 3, TODAY));

            // act
            zSetTemplate.putScoreIfNewer(CONTINUOUS_KEY, new VersionedScore("A", 2, YESTERDAY));

            // assert
            assertThat(zSetTemplate.top(CONTINUOUS_KEY, 10)).containsExactly(new ZSetEntry("A", 3.0));
        }

        @DisplayName("재구성 스냅샷을 병합해도, 스냅샷 이후 기록된 더 최신 점수는 유지된다.")
        @Test
        void keepsNewerLiveScore_whenSnapshotIsStale() {
            // arrange
            zSetTemplate.putScoreIfNewer(CONTINUOUS_KEY, new VersionedScore("A", 3, TODAY));
            List<VersionedScore> staleSnapshot = List.of(
                new VersionedScore("A", 2, YESTERDAY),
                new VersionedScore("B", 5, YESTERDAY)
            );

            // act
            int updated = zSetTemplate.mergeIfNewer(CONTINUOUS_KEY, staleSnapshot);

            // assert
            assertThat(updated).isEqualTo(1);
            assertThat(zSetTemplate.top(CONTINUOUS_KEY, 10))
                .containsExactly(new ZSetEntry("B", 5.0), new ZSetEntry("A", 3.0));
        }

        @DisplayName("버전이 기준보다 오래된 멤버와 버전이 없는 멤버는 지워진다.")
        @Test
        void removesStaleMembers() {
            // arrange
            zSetTemplate.mergeIfNewer(CONTINUOUS_KEY, List.of(
                new VersionedScore("A", 3, TODAY),
                new VersionedScore("B", 5, YESTERDAY),
                new VersionedScore("C", 9, YESTERDAY - 1)
            ));
            zSetTemplate.putScore(CONTINUOUS_KEY, "D", 1);

            // act
            int removed = zSetTemplate.removeOlderThan(CONTINUOUS_KEY, YESTERDAY);

            // assert
            assertThat(removed).isEqualTo(2);
            assertThat(zSetTemplate.top(CONTINUOUS_KEY, 10)).extracting(ZSetEntry::member).containsExactly("B", "A");
            assertThat(redisTemplate.opsForHash().keys(RedisZSetTemplate.versionKey(CONTINUOUS_KEY)))
                .containsExactlyInAnyOrder("A", "B");
        }
    }

    @DisplayName("일간 점수를 병합할 때,")
    @Nested
    class MergeScores {

        @DisplayName("스냅샷에 없는 기존 멤버는 남기고, 키에 TTL을 건다.")
        @Test
        void keepsExistingMembers_andAppliesTtl() {
            // arrange
            zSetTemplate.putScore(DAILY_KEY, "C", 30);

            // act
            zSetTemplate.mergeScores(DAILY_KEY, Map.of("A", 20.0, "B", 50.0), Duration.ofDays(30));

            // assert
            assertThat(zSetTemplate.top(DAILY_KEY, 10)).extracting(ZSetEntry::member).containsExactly("B", "C", "A");
            assertThat(redisTemplate.getExpire(DAILY_KEY, TimeUnit.SECONDS)).isPositive();
        }
    }
}
