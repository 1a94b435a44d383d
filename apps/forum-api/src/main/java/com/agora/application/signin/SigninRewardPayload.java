package com.agora.application.signin;

import java.time.LocalDate;

/**
 * 출석 후속 처리 작업의 페이로드.
 * <p>
 * 출석 시점에 계산한 보상을 그대로 담아, 작업이 재시도되어도 보상이 다시 계산되지 않습니다.
 * </p>
 *
 * @param userId 사용자 ID
 * @param signDate 출석 날짜
 * @param rewardPoints 지급한 포인트
 * @param experience 지급할 경험치
 */
public record SigninRewardPayload(String userId, LocalDate signDate, int rewardPoints, int experience) {
}
