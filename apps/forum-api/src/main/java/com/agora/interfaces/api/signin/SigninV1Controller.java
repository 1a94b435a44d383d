package com.agora.interfaces.api.signin;

import com.agora.application.ranking.SigninRankingService;
import com.agora.application.signin.SigninFacade;
import com.agora.interfaces.api.ApiResponse;
import com.agora.support.error.CoreException;
import com.agora.support.error.ErrorType;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * 출석 API v1 컨트롤러.
 * <p>
 * 사용자 식별은 {@code X-USER-ID} 헤더로 받습니다.
 * 랭킹 조회는 헤더가 없어도 되며, 있으면 요청자의 순위를 함께 돌려줍니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/signin")
public class SigninV1Controller {
    static final int MIN_LIMIT = 1;
    static final int MAX_LIMIT = 100;

    private final SigninFacade signinFacade;
    private final SigninRankingService rankingService;
    private final Clock clock;

    /**
     * 오늘 출석합니다.
     *
     * @param userId X-USER-ID 헤더
     * @return 출석 결과
     */
    @PostMapping
    public ApiResponse<SigninV1Dto.SigninResponse> signin(@RequestHeader("X-USER-ID") String userId) {
        return ApiResponse.success(SigninV1Dto.SigninResponse.from(signinFacade.signin(userId)));
    }

    @GetMapping("/status")
    public ApiResponse<SigninV1Dto.StatusResponse> getStatus(@RequestHeader("X-USER-ID") String userId) {
        return ApiResponse.success(SigninV1Dto.StatusResponse.from(signinFacade.getStatus(userId)));
    }

    /**
     * 일간 출석 랭킹을 조회합니다.
     *
     * @param userId X-USER-ID 헤더 (선택)
     * @param date 날짜 (yyyy-MM-dd, 기본값: 오늘)
     * @param limit 조회 개수 (1~100, 기본값: 10)
     * @return 랭킹
     */
    @GetMapping("/ranking/daily")
    public ApiResponse<SigninV1Dto.RankingResponse> getDailyRanking(
        @RequestHeader(value = "X-USER-ID", required = false) String userId,
        @RequestParam(required = false) String date,
        @RequestParam(required = false, defaultValue = "10") int limit
    ) {
        validateLimit(limit);
        LocalDate targetDate = parseDate(date);
        return ApiResponse.success(SigninV1Dto.RankingResponse.from(
            rankingService.getDailyRanking(targetDate, limit, userId)));
    }

    @GetMapping("/ranking/continuous")
    public ApiResponse<SigninV1Dto.RankingResponse> getContinuousRanking(
        @RequestHeader(value = "X-USER-ID", required = false) String userId,
        @RequestParam(required = false, defaultValue = "10") int limit
    ) {
        validateLimit(limit);
        return ApiResponse.success(SigninV1Dto.RankingResponse.from(
            rankingService.getContinuousRanking(limit, userId)));
    }

    private void validateLimit(int limit) {
        if (limit < MIN_LIMIT || limit > MAX_LIMIT) {
            throw new CoreException(ErrorType.BAD_REQUEST,
                String.format("limit은 %d 이상 %d 이하여야 합니다.", MIN_LIMIT, MAX_LIMIT));
        }
    }

    private LocalDate parseDate(String date) {
        if (date == null || date.isBlank()) {
            return LocalDate.now(clock);
        }
        try {
            return LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            throw new CoreException(ErrorType.BAD_REQUEST, "date는 yyyy-MM-dd 형식이어야 합니다.");
        }
    }
}
