package com.agora.domain.signin;

import com.agora.domain.BaseEntity;
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
 * 하루 한 번의 출석 기록.
 * <p>
 * (user_id, sign_date) 유니크 제약이 같은 날 중복 출석을 막는 마지막 방어선입니다.
 * 지급한 포인트를 함께 남겨 일간 랭킹을 이 테이블만으로 재구성할 수 있습니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Entity
@Table(
    name = "signin_log",
    uniqueConstraints = @UniqueConstraint(name = "uk_signin_log_user_date", columnNames = {"user_id", "sign_date"}),
    indexes = @Index(name = "idx_signin_log_date", columnList = "sign_date")
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class SigninLog extends BaseEntity {

    @Column(name = "user_id", nullable = false, length = 64, updatable = false)
    private String userId;

    @Column(name = "sign_date", nullable = false, updatable = false)
    private LocalDate signDate;

    @Column(name = "reward_points", nullable = false, updatable = false)
    private int rewardPoints;

    private SigninLog(String userId, LocalDate signDate, int rewardPoints) {
        this.userId = userId;
        this.signDate = signDate;
        this.rewardPoints = rewardPoints;
    }

    public static SigninLog of(String userId, LocalDate signDate, int rewardPoints) {
        return new SigninLog(userId, signDate, rewardPoints);
    }
}
