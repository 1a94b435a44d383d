package com.agora.domain.reward;

/**
 * 출석 기능 설정 스냅샷.
 * <p>
 * 설정 저장소에서 읽은 값을 한 번에 묶어 두므로, 한 번의 출석 처리 동안 설정이 바뀌어도
 * 같은 값으로 계산됩니다.
 * </p>
 *
 * @param enabled 출석 기능 사용 여부
 * @param mode 보상 계산 방식
 * @param fixedReward 고정 보상 포인트
 * @param incrementBase 증가형 주기 첫날 포인트
 * @param incrementStep 증가형 일일 증가분
 * @param incrementCycle 증가형 주기 (일)
 * @param randomMin 무작위 최소 포인트
 * @param randomMax 무작위 최대 포인트
 * @param experienceReward 출석마다 지급하는 경험치
 * @author Agora
 * @version 1.0
 */
public record SigninSettings(
    boolean enabled,
    RewardMode mode,
    int fixedReward,
    int incrementBase,
    int incrementStep,
    int incrementCycle,
    int randomMin,
    int randomMax,
    int experienceReward
) {

    public static final int DEFAULT_INCREMENT_CYCLE = 7;

    public static SigninSettings defaults() {
        return new SigninSettings(true, RewardMode.FIXED, 10, 5, 1, DEFAULT_INCREMENT_CYCLE, 5, 20, 5);
    }

    /**
     * 현재 모드에 해당하는 보상 정책을 만듭니다.
     *
     * @return 보상 정책
     */
    public RewardPolicy rewardPolicy() {
        return switch (mode) {
            case FIXED -> new FixedReward(fixedReward);
            case INCREMENTAL -> new IncrementalReward(incrementBase, incrementStep, incrementCycle);
            case RANDOM -> new RandomReward(randomMin, randomMax);
        };
    }
}
