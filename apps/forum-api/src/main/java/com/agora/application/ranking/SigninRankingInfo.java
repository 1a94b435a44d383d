package com.agora.application.ranking;

import java.util.List;

/**
 * 출석 랭킹 조회 결과.
 *
 * @param items 순위 항목 (점수 내림차순)
 * @param myRank 요청자의 순위 (1부터 시작), 요청자가 없거나 랭킹에 없으면 null
 */
public record SigninRankingInfo(List<Item> items, Long myRank) {

    /**
     * @param rank 순위 (1부터 시작)
     * @param userId 사용자 ID
     * @param score 일간 랭킹은 획득 포인트, 연속 랭킹은 연속 출석 일수
     * @param totalDays 누적 출석 일수, 일간 랭킹에서는 null
     */
    public record Item(long rank, String userId, long score, Integer totalDays) {
    }

    public static SigninRankingInfo empty(Long myRank) {
        return new SigninRankingInfo(List.of(), myRank);
    }
}
