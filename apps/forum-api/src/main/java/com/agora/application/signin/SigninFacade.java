package com.agora.application.signin;

import com.agora.application.ranking.SigninRankingService;
import com.agora.config.SigninProperties;
import com.agora.domain.reward.SigninSettings;
import com.agora.domain.reward.SigninSettingsProvider;
import com.agora.domain.signin.SigninOutcome;
import com.agora.domain.signin.SigninService;
import com.agora.domain.signin.SigninStatus;
import com.agora.lock.DistributedLock;
import com.agora.lock.LockTimeoutException;
import com.agora.support.error.CoreException;
import com.agora.support.error.ErrorType;
import com.agora.task.TaskManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * 출석 파사드.
 * <p>
 * <b>처리 흐름:</b>
 * <ol>
 *   <li>출석 기능이 꺼져 있으면 거부</li>
 *   <li>사용자별 분산 락 안에서 출석 트랜잭션 실행</li>
 *   <li>커밋 후 랭킹 반영 (best-effort)</li>
 *   <li>경험치 지급 작업 등록 (best-effort)</li>
 * </ol>
 * 락 해제는 항상 finally에서 토큰 비교 후 수행됩니다.
 * 커밋 이후 단계의 실패는 출석 결과를 바꾸지 않습니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class SigninFacade {
    static final String LOCK_KEY_PREFIX = "signin:lock:";

    private final SigninService signinService;
    private final SigninSettingsProvider settingsProvider;
    private final SigninRankingService rankingService;
    private final DistributedLock distributedLock;
    private final TaskManager taskManager;
    private final SigninProperties signinProperties;
    private final Clock clock;

    /**
     * 오늘 출석을 처리합니다.
     *
     * @param userId 사용자 ID
     * @return 출석 결과
     * @throws CoreException 기능 비활성화(SIGNIN_DISABLED), 중복 출석(ALREADY_SIGNED_IN),
     *                       락 대기 초과(LOCK_TIMEOUT), 저장소 장애(INTERNAL_ERROR)
     */
    public SigninInfo signin(String userId) {
        validateUserId(userId);
        SigninSettings settings = settingsProvider.current();
        if (!settings.enabled()) {
            throw new CoreException(ErrorType.SIGNIN_DISABLED);
        }

        SigninOutcome outcome;
        try {
            outcome = distributedLock.executeWithLock(
                LOCK_KEY_PREFIX + userId,
                signinProperties.lockLease(),
                signinProperties.lockWait(),
                () -> signinService.signin(userId, LocalDate.now(clock), settings)
            );
        } catch (LockTimeoutException e) {
            log.warn("출석 락 획득 실패: userId={}, wait={}", userId, e.getWaitTime());
            throw new CoreException(ErrorType.LOCK_TIMEOUT, ErrorType.LOCK_TIMEOUT.getMessage(), e);
        } catch (DataAccessException e) {
            log.error("출석 처리 중 저장소 오류: userId={}", userId, e);
            throw new CoreException(ErrorType.INTERNAL_ERROR, ErrorType.INTERNAL_ERROR.getMessage(), e);
        }

        log.info("출석 완료: userId={}, date={}, points={}, continuous={}",
            userId, outcome.signDate(), outcome.rewardPoints(), outcome.continuousDays());

        recordRanking(outcome);
        enqueueReward(outcome);
        return SigninInfo.from(outcome);
    }

    /**
     * 사용자의 출석 현황을 조회합니다.
     *
     * @param userId 사용자 ID
     * @return 출석 현황, 출석한 적이 없으면 0으로 채운 현황
     */
    public SigninStatusInfo getStatus(String userId) {
        validateUserId(userId);
        LocalDate today = LocalDate.now(clock);
        SigninStatus status = signinService.findStatus(userId).orElseGet(() -> SigninStatus.initial(userId));

        boolean todaySigned = status.isSignedOn(today);
        LocalDate nextSigninDate = todaySigned ? today.plusDays(1) : today;
        int tomorrowReward = settingsProvider.current().rewardPolicy().preview(status.streakIfSignedOn(nextSigninDate));

        return new SigninStatusInfo(
            todaySigned,
            status.getLastSigninDate(),
            status.getContinuousDays(),
            status.getTotalDays(),
            tomorrowReward
        );
    }

    private void recordRanking(SigninOutcome outcome) {
        try {
            rankingService.recordSignin(outcome);
        } catch (RuntimeException e) {
            log.warn("출석 랭킹 반영 중 오류, 다음 동기화에서 복구: userId={}", outcome.userId(), e);
        }
    }

    private void enqueueReward(SigninOutcome outcome) {
        SigninRewardPayload payload = new SigninRewardPayload(
            outcome.userId(), outcome.signDate(), outcome.rewardPoints(), outcome.experience());
        try {
            taskManager.enqueue(SigninRewardTaskHandler.TASK_NAME, payload);
        } catch (RuntimeException e) {
            log.warn("출석 후속 작업 등록 실패: userId={}, date={}", outcome.userId(), outcome.signDate(), e);
        }
    }

    private void validateUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new CoreException(ErrorType.BAD_REQUEST, "사용자 ID는 필수입니다.");
        }
    }
}
