package com.agora.domain.signin;

import java.time.LocalDate;

/**
 * 커밋된 출석 한 건의 결과.
 *
 * @param signinLogId 출석 기록 ID
 * @param userId 사용자 ID
 * @param signDate 출석 날짜
 * @param rewardPoints 지급한 포인트
 * @param experience 지급 예정 경험치
 * @param continuousDays 반영 후 연속 출석 일수
 * @param totalDays 반영 후 누적 출석 일수
 */
public record SigninOutcome(
    Long signinLogId,
    String userId,
    LocalDate signDate,
    int rewardPoints,
    int experience,
    int continuousDays,
    int totalDays
) {
}
