package com.agora.domain.balance;

import java.util.Optional;

/**
 * UserBalance 엔티티에 대한 저장소 인터페이스.
 *
 * @author Agora
 * @version 1.0
 */
public interface UserBalanceRepository {

    UserBalance save(UserBalance userBalance);

    /**
     * 사용자 잔액을 비관적 쓰기 락과 함께 조회합니다.
     * <p>
     * 같은 사용자의 잔액 변경이 동시에 들어와도 before/after 값이 어긋나지 않도록
     * 트랜잭션이 끝날 때까지 행을 잠급니다.
     * </p>
     *
     * @param userId 사용자 ID
     * @return 잔액을 담은 Optional
     */
    Optional<UserBalance> findByUserIdForUpdate(String userId);
}
