package com.agora.domain.reward;

import java.util.Arrays;
import java.util.Optional;

/**
 * 출석 보상 계산 방식.
 *
 * @author Agora
 * @version 1.0
 */
public enum RewardMode {
    FIXED("fixed"),
    INCREMENTAL("increment"),
    RANDOM("random");

    private final String settingValue;

    RewardMode(String settingValue) {
        this.settingValue = settingValue;
    }

    /**
     * 설정 값 문자열로 모드를 찾습니다. 대소문자와 enum 이름 표기를 모두 허용합니다.
     *
     * @param value 설정 값 (예: "fixed", "increment", "INCREMENTAL")
     * @return 일치하는 모드, 없으면 empty
     */
    public static Optional<RewardMode> fromSettingValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
            .filter(mode -> mode.settingValue.equalsIgnoreCase(normalized) || mode.name().equalsIgnoreCase(normalized))
            .findFirst();
    }
}
