package com.agora.domain.reward;

import lombok.extern.slf4j.Slf4j;

import java.util.random.RandomGenerator;

/**
 * 연속 출석할수록 늘어나는 포인트를 지급합니다.
 * <p>
 * 주기({@code cycleLength})의 n번째 날에 {@code base + (n - 1) * step}을 지급하고,
 * 주기가 끝나면 증가분만 처음으로 돌아갑니다. 연속 출석 일수 자체는 초기화되지 않습니다.
 * 예) base=10, step=2, cycle=7: 1일차 10, 7일차 22, 8일차 10
 * </p>
 *
 * @param base 주기 첫날 포인트
 * @param step 하루마다 늘어나는 포인트
 * @param cycleLength 증가 주기 (일), 1 미만이면 기본 주기를 사용
 */
@Slf4j
public record IncrementalReward(int base, int step, int cycleLength) implements RewardPolicy {

    public IncrementalReward {
        if (cycleLength < 1) {
            log.warn("증가형 보상 주기가 1 미만, 기본값 사용: cycle={}, default={}",
                cycleLength, SigninSettings.DEFAULT_INCREMENT_CYCLE);
            cycleLength = SigninSettings.DEFAULT_INCREMENT_CYCLE;
        }
    }

    @Override
    public int points(int continuousDays, RandomGenerator random) {
        int day = Math.max(1, continuousDays);
        int dayInCycle = (day - 1) % cycleLength + 1;
        return Math.max(MIN_POINTS, base + (dayInCycle - 1) * step);
    }

    @Override
    public int preview(int continuousDays) {
        return points(continuousDays, null);
    }
}
