package com.agora.domain.reward;

import java.util.random.RandomGenerator;

/**
 * 연속 출석 일수로 지급 포인트를 정하는 보상 정책.
 * <p>
 * 계산 방식마다 하나의 구현체가 있으며, 모두 부수효과 없는 순수 함수입니다.
 * 무작위 정책도 난수 생성기를 인자로 받으므로 테스트에서 결과를 고정할 수 있습니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
public sealed interface RewardPolicy permits FixedReward, IncrementalReward, RandomReward {

    /** 어떤 정책이든 지급 포인트는 최소 1입니다. */
    int MIN_POINTS = 1;

    /**
     * 오늘 지급할 포인트를 계산합니다.
     *
     * @param continuousDays 오늘 출석을 반영한 연속 출석 일수 (1 이상)
     * @param random 난수 생성기
     * @return 지급 포인트
     */
    int points(int continuousDays, RandomGenerator random);

    /**
     * 미리보기용 예상 포인트를 계산합니다. 무작위 정책은 최댓값을 보여줍니다.
     *
     * @param continuousDays 예상 연속 출석 일수
     * @return 예상 포인트
     */
    int preview(int continuousDays);
}
