package com.agora.application.signin;

import java.time.LocalDate;

/**
 * 사용자 출석 현황.
 *
 * @param todaySigned 오늘 출석 여부
 * @param lastSigninDate 마지막 출석일, 출석한 적이 없으면 null
 * @param continuousDays 연속 출석 일수
 * @param totalDays 누적 출석 일수
 * @param tomorrowReward 다음 출석 시 예상 포인트 (무작위 모드는 최댓값)
 */
public record SigninStatusInfo(
    boolean todaySigned,
    LocalDate lastSigninDate,
    int continuousDays,
    int totalDays,
    int tomorrowReward
) {
}
