package com.agora.domain.reward;

import java.util.random.RandomGenerator;

/**
 * 매일 같은 포인트를 지급합니다.
 *
 * @param amount 지급 포인트
 */
public record FixedReward(int amount) implements RewardPolicy {

    @Override
    public int points(int continuousDays, RandomGenerator random) {
        return Math.max(MIN_POINTS, amount);
    }

    @Override
    public int preview(int continuousDays) {
        return points(continuousDays, null);
    }
}
