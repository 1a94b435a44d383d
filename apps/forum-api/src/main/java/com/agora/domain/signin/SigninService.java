package com.agora.domain.signin;

import com.agora.domain.balance.BalanceChangeCommand;
import com.agora.domain.balance.BalanceService;
import com.agora.domain.balance.BalanceType;
import com.agora.domain.reward.RewardPolicy;
import com.agora.domain.reward.SigninSettings;
import com.agora.support.error.CoreException;
import com.agora.support.error.ErrorType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 출석 도메인 서비스.
 * <p>
 * 출석 기록, 상태 갱신, 포인트 지급을 하나의 트랜잭션으로 처리합니다.
 * 사용자별 분산 락 안에서 호출되는 것을 전제로 하며,
 * 락이 뚫리더라도 (user_id, sign_date) 유니크 제약이 중복 지급을 막습니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class SigninService {

    static final String BALANCE_REASON = "출석 보상";
    static final String RELATED_TYPE = "signin";

    private final SigninStatusRepository signinStatusRepository;
    private final SigninLogRepository signinLogRepository;
    private final BalanceService balanceService;

    /**
     * 출석을 처리합니다.
     * <p>
     * <b>처리 순서:</b>
     * <ol>
     *   <li>상태 조회 (없으면 생성)</li>
     *   <li>오늘 이미 출석했다면 거부</li>
     *   <li>연속/누적 일수 반영 후 보상 포인트 계산</li>
     *   <li>출석 기록 저장 (유니크 제약 위반은 중복 출석으로 변환)</li>
     *   <li>상태 저장, 포인트 지급 및 장부 기록</li>
     * </ol>
     * 어느 단계에서든 실패하면 전체가 롤백됩니다.
     * </p>
     *
     * @param userId 사용자 ID
     * @param today 출석 날짜
     * @param settings 이번 출석에 적용할 설정
     * @return 출석 결과
     * @throws CoreException 이미 출석한 경우 ALREADY_SIGNED_IN
     */
    @Transactional
    public SigninOutcome signin(String userId, LocalDate today, SigninSettings settings) {
        SigninStatus status = signinStatusRepository.findByUserId(userId)
            .orElseGet(() -> SigninStatus.initial(userId));

        status.advance(today);

        RewardPolicy policy = settings.rewardPolicy();
        int points = policy.points(status.getContinuousDays(), ThreadLocalRandom.current());

        SigninLog signinLog;
        try {
            signinLog = signinLogRepository.save(SigninLog.of(userId, today, points));
        } catch (DataIntegrityViolationException e) {
            log.warn("출석 기록 유니크 제약 위반, 중복 출석으로 처리: userId={}, date={}", userId, today);
            throw new CoreException(ErrorType.ALREADY_SIGNED_IN, ErrorType.ALREADY_SIGNED_IN.getMessage(), e);
        }

        signinStatusRepository.save(status);
        balanceService.change(BalanceChangeCommand.bySystem(
            userId, BalanceType.POINTS, points, BALANCE_REASON, RELATED_TYPE, String.valueOf(signinLog.getId())
        ));

        return new SigninOutcome(
            signinLog.getId(),
            userId,
            today,
            points,
            settings.experienceReward(),
            status.getContinuousDays(),
            status.getTotalDays()
        );
    }

    @Transactional(readOnly = true)
    public Optional<SigninStatus> findStatus(String userId) {
        return signinStatusRepository.findByUserId(userId);
    }

    @Transactional(readOnly = true)
    public List<SigninStatus> findStatuses(Collection<String> userIds) {
        return signinStatusRepository.findAllByUserIdIn(userIds);
    }

    /**
     * 연속 출석이 끊기지 않은 상태를 조회합니다.
     *
     * @param today 기준 날짜
     * @return 마지막 출석일이 어제 이후인 상태 목록
     */
    @Transactional(readOnly = true)
    public List<SigninStatus> findLiveStreaks(LocalDate today) {
        return signinStatusRepository.findAllByLastSigninDateGreaterThanEqual(today.minusDays(1));
    }

    @Transactional(readOnly = true)
    public List<SigninLog> findLogs(LocalDate signDate) {
        return signinLogRepository.findAllBySignDate(signDate);
    }
}
