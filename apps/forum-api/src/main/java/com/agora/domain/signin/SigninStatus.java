package com.agora.domain.signin;

import com.agora.domain.BaseEntity;
import com.agora.support.error.CoreException;
import com.agora.support.error.ErrorType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 사용자별 출석 누적 상태.
 * <p>
 * <b>연속 출석 규칙:</b>
 * <ul>
 *   <li>첫 출석이거나 하루 이상 빠졌다면 연속 일수는 1로 초기화</li>
 *   <li>마지막 출석이 어제라면 연속 일수 + 1</li>
 *   <li>오늘 이미 출석했다면 아무것도 바꾸지 않고 거부</li>
 * </ul>
 * 누적 일수는 출석이 성공할 때마다 1씩 늘어납니다.
 * 마지막 출석일이 오늘보다 미래인 경우(시계 차이)도 이미 출석한 것으로 봅니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Entity
@Table(
    name = "signin_status",
    uniqueConstraints = @UniqueConstraint(name = "uk_signin_status_user", columnNames = "user_id"),
    indexes = @Index(name = "idx_signin_status_last_date", columnList = "last_signin_date")
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class SigninStatus extends BaseEntity {

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "last_signin_date")
    private LocalDate lastSigninDate;

    @Column(name = "continuous_days", nullable = false)
    private int continuousDays;

    @Column(name = "total_days", nullable = false)
    private int totalDays;

    private SigninStatus(String userId) {
        this.userId = userId;
    }

    /**
     * 한 번도 출석하지 않은 상태를 만듭니다.
     *
     * @param userId 사용자 ID
     * @return 초기 상태
     */
    public static SigninStatus initial(String userId) {
        return new SigninStatus(userId);
    }

    /**
     * 주어진 날짜에 이미 출석했는지 확인합니다.
     *
     * @param today 기준 날짜
     * @return 마지막 출석일이 기준 날짜와 같거나 이후면 true
     */
    public boolean isSignedOn(LocalDate today) {
        return lastSigninDate != null && !lastSigninDate.isBefore(today);
    }

    /**
     * 주어진 날짜에 출석한다면 연속 일수가 몇 일이 되는지 계산합니다.
     *
     * @param date 출석할 날짜
     * @return 예상 연속 일수
     */
    public int streakIfSignedOn(LocalDate date) {
        if (lastSigninDate != null && lastSigninDate.plusDays(1).equals(date)) {
            return continuousDays + 1;
        }
        return 1;
    }

    /**
     * 출석을 반영합니다.
     *
     * @param today 출석 날짜
     * @throws CoreException 이미 출석한 날짜인 경우
     */
    public void advance(LocalDate today) {
        if (isSignedOn(today)) {
            throw new CoreException(ErrorType.ALREADY_SIGNED_IN);
        }
        this.continuousDays = streakIfSignedOn(today);
        this.totalDays += 1;
        this.lastSigninDate = today;
    }

    @Override
    protected void guard() {
        if (continuousDays < 0 || totalDays < 0) {
            throw new CoreException(ErrorType.INTERNAL_ERROR, "출석 일수는 음수일 수 없습니다.");
        }
        if (continuousDays > totalDays) {
            throw new CoreException(ErrorType.INTERNAL_ERROR, "연속 출석 일수가 누적 출석 일수보다 클 수 없습니다.");
        }
    }
}
