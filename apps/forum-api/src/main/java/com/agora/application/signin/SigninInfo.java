package com.agora.application.signin;

import com.agora.domain.signin.SigninOutcome;

import java.time.LocalDate;

/**
 * 출석 처리 결과 정보.
 *
 * @param signDate 출석 날짜
 * @param rewardPoints 지급한 포인트
 * @param experience 지급 예정 경험치 (비동기 지급)
 * @param continuousDays 연속 출석 일수
 * @param totalDays 누적 출석 일수
 * @param message 연속 일수에 따른 안내 메시지
 * @author Agora
 * @version 1.0
 */
public record SigninInfo(
    LocalDate signDate,
    int rewardPoints,
    int experience,
    int continuousDays,
    int totalDays,
    String message
) {

    public static SigninInfo from(SigninOutcome outcome) {
        return new SigninInfo(
            outcome.signDate(),
            outcome.rewardPoints(),
            outcome.experience(),
            outcome.continuousDays(),
            outcome.totalDays(),
            streakMessage(outcome.continuousDays())
        );
    }

    static String streakMessage(int continuousDays) {
        if (continuousDays <= 1) {
            return "출석 완료!";
        }
        if (continuousDays < 7) {
            return continuousDays + "일 연속 출석!";
        }
        if (continuousDays < 30) {
            return continuousDays + "일 연속 출석, 계속 이어가세요!";
        }
        return continuousDays + "일 연속 출석, 대단해요!";
    }
}
