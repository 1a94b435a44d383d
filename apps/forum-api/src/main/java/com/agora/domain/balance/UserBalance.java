package com.agora.domain.balance;

import com.agora.domain.BaseEntity;
import com.agora.support.error.CoreException;
import com.agora.support.error.ErrorType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 사용자별 현재 잔액.
 * <p>
 * 잔액 변경은 반드시 {@link BalanceService}를 거쳐 {@link BalanceLog}와 함께 기록됩니다.
 * 경험치는 장부 대상이 아니므로 이 엔티티에만 누적합니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Entity
@Table(
    name = "user_balance",
    uniqueConstraints = @UniqueConstraint(name = "uk_user_balance_user", columnNames = "user_id")
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class UserBalance extends BaseEntity {

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "points", nullable = false)
    private long points;

    @Column(name = "currency", nullable = false)
    private long currency;

    @Column(name = "experience", nullable = false)
    private long experience;

    private UserBalance(String userId) {
        this.userId = userId;
    }

    public static UserBalance empty(String userId) {
        return new UserBalance(userId);
    }

    public long amountOf(BalanceType type) {
        return switch (type) {
            case POINTS -> points;
            case CURRENCY -> currency;
        };
    }

    /**
     * 잔액을 변경합니다.
     *
     * @param type 자산 종류
     * @param amount 변경량 (음수면 차감)
     * @throws CoreException 차감 후 잔액이 음수가 되는 경우
     */
    public void change(BalanceType type, long amount) {
        long after = Math.addExact(amountOf(type), amount);
        if (after < 0) {
            throw new CoreException(ErrorType.BAD_REQUEST,
                String.format("잔액이 부족합니다. (type: %s, balance: %d, amount: %d)", type, amountOf(type), amount));
        }
        switch (type) {
            case POINTS -> this.points = after;
            case CURRENCY -> this.currency = after;
        }
    }

    /**
     * 경험치를 지급합니다.
     *
     * @param amount 지급량 (0 이상)
     */
    public void gainExperience(long amount) {
        if (amount < 0) {
            throw new CoreException(ErrorType.BAD_REQUEST, "경험치는 음수로 지급할 수 없습니다.");
        }
        this.experience = Math.addExact(this.experience, amount);
    }
}
