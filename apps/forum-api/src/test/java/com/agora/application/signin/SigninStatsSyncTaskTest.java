package com.agora.application.signin;

import com.agora.application.ranking.SigninRankingService;
import com.agora.config.SigninProperties;
import com.agora.domain.reward.SigninSettingsProvider;
import com.agora.task.TaskEnvelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SigninStatsSyncTaskTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 12, 15);

    @Mock
    private SigninRankingService rankingService;

    @Mock
    private SigninSettingsProvider settingsProvider;

    private SigninStatsSyncTask task;

    @BeforeEach
    void setUp() {
        SigninProperties properties = new SigninProperties(
            Duration.ofSeconds(10), Duration.ofSeconds(5), Duration.ofSeconds(60),
            Duration.ofDays(30), Duration.ofMinutes(5), "Asia/Seoul");
        Clock clock = Clock.fixed(Instant.parse("2024-12-15T03:00:00Z"), ZoneId.of("Asia/Seoul"));
        task = new SigninStatsSyncTask(rankingService, settingsProvider, properties, clock);
    }

    @DisplayName("5분마다, 시작하자마자 한 번 실행되는 주기 작업이다.")
    @Test
    void runsEveryFiveMinutes_andOnStart() {
        assertThat(task.interval()).isEqualTo(Duration.ofMinutes(5));
        assertThat(task.runOnStart()).isTrue();
        assertThat(task.name()).isEqualTo(SigninStatsSyncTask.TASK_NAME);
    }

    @DisplayName("설정 캐시를 비우고 두 랭킹을 오늘 기준으로 다시 만든다.")
    @Test
    void refreshesSettings_andRebuildsRankings() {
        // act
        task.handle(TaskEnvelope.create(SigninStatsSyncTask.TASK_NAME, "{}"));

        // assert
        verify(settingsProvider).refresh();
        verify(rankingService).rebuildContinuous(TODAY);
        verify(rankingService).rebuildDaily(TODAY);
    }

    @DisplayName("한 단계가 실패해도 나머지 단계는 계속하고 예외를 던지지 않는다.")
    @Test
    void continues_whenOneStepFails() {
        // arrange
        doThrow(new RedisConnectionFailureException("down")).when(settingsProvider).refresh();
        when(rankingService.rebuildContinuous(TODAY)).thenThrow(new RedisConnectionFailureException("down"));

        // act
        assertDoesNotThrow(() -> task.handle(TaskEnvelope.create(SigninStatsSyncTask.TASK_NAME, "{}")));

        // assert
        verify(rankingService).rebuildDaily(TODAY);
    }
}
