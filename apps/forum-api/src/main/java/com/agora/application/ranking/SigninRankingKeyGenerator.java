package com.agora.application.ranking;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * 출석 랭킹 키 생성 유틸리티.
 *
 * @author Agora
 * @version 1.0
 */
@Component
public class SigninRankingKeyGenerator {
    private static final String DAILY_KEY_PREFIX = "signin:ranking:daily:";
    private static final String CONTINUOUS_KEY = "signin:ranking:continuous";
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMdd");

    /**
     * 일간 랭킹 키를 생성합니다.
     * <p>
     * 예: signin:ranking:daily:20241215
     * </p>
     *
     * @param date 날짜
     * @return 일간 랭킹 키
     */
    public String generateDailyKey(LocalDate date) {
        return DAILY_KEY_PREFIX + date.format(DATE_FORMATTER);
    }

    public String continuousKey() {
        return CONTINUOUS_KEY;
    }
}
