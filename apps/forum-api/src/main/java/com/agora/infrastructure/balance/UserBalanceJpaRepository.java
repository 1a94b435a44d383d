package com.agora.infrastructure.balance;

import com.agora.domain.balance.UserBalance;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface UserBalanceJpaRepository extends JpaRepository<UserBalance, Long> {

    /**
     * 사용자 잔액을 SELECT ... FOR UPDATE로 조회합니다.
     * <p>
     * UNIQUE(user_id) 인덱스로 조회하므로 해당 행만 잠깁니다.
     * </p>
     *
     * @param userId 사용자 ID
     * @return 잔액을 담은 Optional
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM UserBalance b WHERE b.userId = :userId")
    Optional<UserBalance> findByUserIdForUpdate(@Param("userId") String userId);
}
