package com.agora.application.ranking;

import com.agora.config.SigninProperties;
import com.agora.domain.signin.SigninLog;
import com.agora.domain.signin.SigninOutcome;
import com.agora.domain.signin.SigninService;
import com.agora.domain.signin.SigninStatus;
import com.agora.support.error.CoreException;
import com.agora.support.error.ErrorType;
import com.agora.zset.RedisZSetTemplate;
import com.agora.zset.VersionedScore;
import com.agora.zset.ZSetEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 출석 랭킹 서비스.
 * <p>
 * 랭킹은 도메인 데이터가 아니라 Redis ZSET에 둔 파생 View입니다.
 * <b>점수 기준:</b>
 * <ul>
 *   <li>일간 랭킹: 그날 획득한 포인트</li>
 *   <li>연속 랭킹: 현재 연속 출석 일수</li>
 * </ul>
 * </p>
 * <p>
 * 출석 직후의 갱신은 best-effort입니다. 실패해도 출석은 성공으로 남고,
 * 주기적인 {@link #rebuildContinuous(LocalDate)}/{@link #rebuildDaily(LocalDate)}가 DB 기준으로 채워 넣습니다.
 * 조회 실패는 숨기지 않고 INTERNAL_ERROR로 응답합니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SigninRankingService {
    static final int MAX_LIMIT = 100;

    private final RedisZSetTemplate zSetTemplate;
    private final SigninRankingKeyGenerator keyGenerator;
    private final SigninService signinService;
    private final SigninProperties signinProperties;

    /**
     * 커밋된 출석을 두 랭킹에 반영합니다.
     *
     * @param outcome 출석 결과
     * @return 두 랭킹 모두 반영되었으면 true
     */
    public boolean recordSignin(SigninOutcome outcome) {
        String dailyKey = keyGenerator.generateDailyKey(outcome.signDate());
        boolean daily = zSetTemplate.putScore(dailyKey, outcome.userId(), outcome.rewardPoints());
        if (daily) {
            zSetTemplate.expireIfPersistent(dailyKey, signinProperties.dailyRankingTtl());
        }
        boolean continuous = zSetTemplate.putScoreIfNewer(keyGenerator.continuousKey(),
            new VersionedScore(outcome.userId(), outcome.continuousDays(), outcome.signDate().toEpochDay()));
        if (!daily || !continuous) {
            log.warn("출석 랭킹 반영 실패, 다음 동기화에서 복구: userId={}, date={}, daily={}, continuous={}",
                outcome.userId(), outcome.signDate(), daily, continuous);
        }
        return daily && continuous;
    }

    /**
     * 일간 랭킹을 조회합니다.
     *
     * @param date 날짜
     * @param limit 조회 개수 (1 이상, 최대 100으로 제한)
     * @param requesterId 요청자 ID, 없으면 null
     * @return 랭킹 조회 결과
     * @throws CoreException limit이 1 미만이면 BAD_REQUEST, Redis 조회 실패 시 INTERNAL_ERROR
     */
    public SigninRankingInfo getDailyRanking(LocalDate date, int limit, String requesterId) {
        String key = keyGenerator.generateDailyKey(date);
        try {
            List<ZSetEntry> entries = zSetTemplate.top(key, effectiveLimit(limit));
            List<SigninRankingInfo.Item> items = new ArrayList<>();
            for (int i = 0; i < entries.size(); i++) {
                ZSetEntry entry = entries.get(i);
                items.add(new SigninRankingInfo.Item(i + 1, entry.member(), entry.scoreAsLong(), null));
            }
            return new SigninRankingInfo(items, findMyRank(key, requesterId));
        } catch (DataAccessException e) {
            log.error("일간 랭킹 조회 실패: date={}", date, e);
            throw new CoreException(ErrorType.INTERNAL_ERROR, "랭킹을 조회하지 못했습니다.", e);
        }
    }

    /**
     * 연속 출석 랭킹을 조회합니다.
     * <p>
     * 누적 출석 일수는 출석 상태를 배치로 조회해 채웁니다.
     * </p>
     *
     * @param limit 조회 개수 (1 이상, 최대 100으로 제한)
     * @param requesterId 요청자 ID, 없으면 null
     * @return 랭킹 조회 결과
     * @throws CoreException limit이 1 미만이면 BAD_REQUEST, Redis 조회 실패 시 INTERNAL_ERROR
     */
    public SigninRankingInfo getContinuousRanking(int limit, String requesterId) {
        String key = keyGenerator.continuousKey();
        List<ZSetEntry> entries;
        Long myRank;
        try {
            entries = zSetTemplate.top(key, effectiveLimit(limit));
            myRank = findMyRank(key, requesterId);
        } catch (DataAccessException e) {
            log.error("연속 출석 랭킹 조회 실패", e);
            throw new CoreException(ErrorType.INTERNAL_ERROR, "랭킹을 조회하지 못했습니다.", e);
        }
        if (entries.isEmpty()) {
            return SigninRankingInfo.empty(myRank);
        }

        List<String> userIds = entries.stream().map(ZSetEntry::member).toList();
        Map<String, Integer> totalDaysByUser = signinService.findStatuses(userIds).stream()
            .collect(Collectors.toMap(SigninStatus::getUserId, SigninStatus::getTotalDays));

        List<SigninRankingInfo.Item> items = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            ZSetEntry entry = entries.get(i);
            items.add(new SigninRankingInfo.Item(
                i + 1, entry.member(), entry.scoreAsLong(), totalDaysByUser.get(entry.member())));
        }
        return new SigninRankingInfo(items, myRank);
    }

    /**
     * 연속 출석 랭킹을 DB 기준으로 다시 맞춥니다.
     * <p>
     * 마지막 출석일이 어제 이후인, 즉 연속이 끊기지 않은 사용자만 병합합니다.
     * 점수의 버전은 마지막 출석일이므로, 스냅샷을 읽은 뒤 들어온 출석이 기록한 점수는 덮이지 않습니다.
     * 병합 후 마지막 출석일이 어제보다 오래된 멤버는 지웁니다.
     * </p>
     *
     * @param today 기준 날짜
     * @return 스냅샷으로 갱신된 사용자 수
     */
    public int rebuildContinuous(LocalDate today) {
        List<VersionedScore> scores = new ArrayList<>();
        for (SigninStatus status : signinService.findLiveStreaks(today)) {
            scores.add(new VersionedScore(
                status.getUserId(), status.getContinuousDays(), status.getLastSigninDate().toEpochDay()));
        }
        String key = keyGenerator.continuousKey();
        int updated = zSetTemplate.mergeIfNewer(key, scores);
        int removed = zSetTemplate.removeOlderThan(key, today.minusDays(1).toEpochDay());
        log.debug("연속 출석 랭킹 동기화: snapshot={}, updated={}, removed={}", scores.size(), updated, removed);
        return updated;
    }

    /**
     * 일간 랭킹에 그날의 출석 기록을 병합합니다.
     * <p>
     * 하루의 보상 포인트는 한 번 정해지면 바뀌지 않으므로 기존 멤버를 지우지 않고 더하기만 합니다.
     * </p>
     *
     * @param date 날짜
     * @return 반영한 사용자 수
     */
    public int rebuildDaily(LocalDate date) {
        Map<String, Double> scores = new HashMap<>();
        for (SigninLog signinLog : signinService.findLogs(date)) {
            scores.put(signinLog.getUserId(), (double) signinLog.getRewardPoints());
        }
        zSetTemplate.mergeScores(keyGenerator.generateDailyKey(date), scores, signinProperties.dailyRankingTtl());
        return scores.size();
    }

    private Long findMyRank(String key, String requesterId) {
        if (requesterId == null || requesterId.isBlank()) {
            return null;
        }
        Optional<Long> rank = zSetTemplate.rankOf(key, requesterId);
        return rank.map(r -> r + 1).orElse(null);
    }

    private int effectiveLimit(int limit) {
        if (limit < 1) {
            throw new CoreException(ErrorType.BAD_REQUEST, "limit은 1 이상이어야 합니다.");
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
