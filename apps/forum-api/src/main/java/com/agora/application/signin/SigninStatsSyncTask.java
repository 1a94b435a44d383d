package com.agora.application.signin;

import com.agora.application.ranking.SigninRankingService;
import com.agora.config.SigninProperties;
import com.agora.domain.reward.SigninSettingsProvider;
import com.agora.task.RecurringTask;
import com.agora.task.TaskEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;

/**
 * 출석 랭킹 동기화 주기 작업.
 * <p>
 * 출석 직후의 랭킹 반영은 실패해도 무시되므로, 이 작업이 DB 기준으로 랭킹을 다시 만듭니다.
 * <b>수행 내용:</b>
 * <ul>
 *   <li>출석 설정 캐시 비우기</li>
 *   <li>연속 출석 랭킹 재구성 (연속이 살아 있는 사용자만)</li>
 *   <li>오늘 일간 랭킹 재구성</li>
 * </ul>
 * 각 단계는 독립적으로 실패하며, 실패해도 다음 단계와 다음 주기는 계속됩니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class SigninStatsSyncTask implements RecurringTask {
    public static final String TASK_NAME = "signin.stats-sync";

    private final SigninRankingService rankingService;
    private final SigninSettingsProvider settingsProvider;
    private final SigninProperties signinProperties;
    private final Clock clock;

    @Override
    public String name() {
        return TASK_NAME;
    }

    @Override
    public Duration interval() {
        return signinProperties.statsSyncInterval();
    }

    @Override
    public boolean runOnStart() {
        return true;
    }

    @Override
    public void handle(TaskEnvelope task) {
        LocalDate today = LocalDate.now(clock);

        try {
            settingsProvider.refresh();
        } catch (RuntimeException e) {
            log.warn("출석 설정 캐시 갱신 실패", e);
        }

        try {
            int count = rankingService.rebuildContinuous(today);
            log.info("연속 출석 랭킹 재구성 완료: date={}, users={}", today, count);
        } catch (RuntimeException e) {
            log.warn("연속 출석 랭킹 재구성 실패: date={}", today, e);
        }

        try {
            int count = rankingService.rebuildDaily(today);
            log.info("일간 출석 랭킹 재구성 완료: date={}, users={}", today, count);
        } catch (RuntimeException e) {
            log.warn("일간 출석 랭킹 재구성 실패: date={}", today, e);
        }
    }
}
