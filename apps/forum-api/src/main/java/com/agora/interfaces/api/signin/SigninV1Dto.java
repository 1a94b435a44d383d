package com.agora.interfaces.api.signin;

import com.agora.application.ranking.SigninRankingInfo;
import com.agora.application.signin.SigninInfo;
import com.agora.application.signin.SigninStatusInfo;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;
import java.util.List;

/**
 * 출석 API v1의 데이터 전송 객체(DTO) 컨테이너.
 *
 * @author Agora
 * @version 1.0
 */
public class SigninV1Dto {

    /**
     * 출석 응답 데이터.
     *
     * @param signDate 출석 날짜 (yyyy-MM-dd)
     * @param rewardPoints 지급 포인트
     * @param experience 지급 경험치
     * @param continuousDays 연속 출석 일수
     * @param totalDays 누적 출석 일수
     * @param message 안내 메시지
     */
    public record SigninResponse(
        String signDate,
        int rewardPoints,
        int experience,
        int continuousDays,
        int totalDays,
        String message
    ) {
        public static SigninResponse from(SigninInfo info) {
            return new SigninResponse(
                info.signDate().toString(),
                info.rewardPoints(),
                info.experience(),
                info.continuousDays(),
                info.totalDays(),
                info.message()
            );
        }
    }

    /**
     * 출석 현황 응답 데이터.
     *
     * @param todaySigned 오늘 출석 여부
     * @param lastSigninDate 마지막 출석일 (yyyy-MM-dd), 없으면 null
     * @param continuousDays 연속 출석 일수
     * @param totalDays 누적 출석 일수
     * @param tomorrowReward 다음 출석 예상 포인트
     */
    public record StatusResponse(
        boolean todaySigned,
        String lastSigninDate,
        int continuousDays,
        int totalDays,
        int tomorrowReward
    ) {
        public static StatusResponse from(SigninStatusInfo info) {
            LocalDate last = info.lastSigninDate();
            return new StatusResponse(
                info.todaySigned(),
                last != null ? last.toString() : null,
                info.continuousDays(),
                info.totalDays(),
                info.tomorrowReward()
            );
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RankingItemResponse(long rank, String userId, long score, Integer totalDays) {
        public static RankingItemResponse from(SigninRankingInfo.Item item) {
            return new RankingItemResponse(item.rank(), item.userId(), item.score(), item.totalDays());
        }
    }

    /**
     * 랭킹 응답 데이터.
     *
     * @param items 랭킹 항목 목록
     * @param myRank 요청자 순위, 랭킹에 없으면 응답에서 생략
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RankingResponse(List<RankingItemResponse> items, Long myRank) {
        public static RankingResponse from(SigninRankingInfo info) {
            return new RankingResponse(
                info.items().stream().map(RankingItemResponse::from).toList(),
                info.myRank()
            );
        }
    }
}
