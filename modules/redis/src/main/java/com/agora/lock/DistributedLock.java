package com.agora.lock;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 여러 프로세스가 공유하는 분산 락.
 * <p>
 * 락은 lease 시간이 지나면 자동으로 만료되어 보유자가 비정상 종료되어도 영원히 잠기지 않습니다.
 * 해제는 소유권 증표가 일치할 때만 이루어지며, lease가 만료된 뒤 다른 요청이 새로 얻은 락을
 * 이전 보유자가 지우는 일은 없습니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
public interface DistributedLock {

    /**
     * 대기 없이 한 번만 락 획득을 시도합니다.
     *
     * @param key 락 키
     * @param lease 락 유지 시간
     * @return 획득 시 소유권 증표, 이미 잠겨 있으면 empty
     */
    Optional<LockToken> tryAcquire(String key, Duration lease);

    /**
     * 최대 {@code wait} 동안 재시도하며 락을 획득합니다.
     *
     * @param key 락 키
     * @param lease 락 유지 시간
     * @param wait 최대 대기 시간
     * @return 소유권 증표
     * @throws LockTimeoutException 대기 시간 안에 획득하지 못한 경우
     */
    LockToken acquire(String key, Duration lease, Duration wait);

    /**
     * 락을 해제합니다.
     * <p>
     * 저장된 값이 증표와 다르면 (lease 만료 후 다른 소유자가 획득한 경우) 아무것도 하지 않습니다.
     * 해제 실패는 예외로 전파하지 않습니다.
     * </p>
     *
     * @param token 소유권 증표
     * @return 실제로 락을 삭제했으면 true
     */
    boolean release(LockToken token);

    /**
     * 락을 획득한 상태에서 작업을 실행하고, 어떤 경로로 종료되든 락을 해제합니다.
     *
     * @param key 락 키
     * @param lease 락 유지 시간 (작업의 최악 소요 시간보다 길어야 함)
     * @param wait 최대 대기 시간
     * @param action 락 안에서 실행할 작업
     * @param <T> 작업 결과 타입
     * @return 작업 결과
     * @throws LockTimeoutException 대기 시간 안에 획득하지 못한 경우
     */
    default <T> T executeWithLock(String key, Duration lease, Duration wait, Supplier<T> action) {
        LockToken token = acquire(key, lease, wait);
        try {
            return action.get();
        } finally {
            release(token);
        }
    }
}
