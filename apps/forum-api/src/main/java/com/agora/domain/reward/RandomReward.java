package com.agora.domain.reward;

import java.util.random.RandomGenerator;

/**
 * [min, max] 구간에서 균등하게 뽑은 포인트를 지급합니다.
 * <p>
 * 설정이 뒤바뀌어 min이 max보다 크면 두 값을 맞바꿉니다.
 * </p>
 *
 * @param min 최소 포인트 (포함)
 * @param max 최대 포인트 (포함)
 */
public record RandomReward(int min, int max) implements RewardPolicy {

    public RandomReward {
        if (min > max) {
            int tmp = min;
            min = max;
            max = tmp;
        }
    }

    @Override
    public int points(int continuousDays, RandomGenerator random) {
        int sampled = min == max ? min : random.nextInt(min, max + 1);
        return Math.max(MIN_POINTS, sampled);
    }

    @Override
    public int preview(int continuousDays) {
        return Math.max(MIN_POINTS, max);
    }
}
