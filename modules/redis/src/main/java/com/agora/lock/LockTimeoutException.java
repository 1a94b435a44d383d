package com.agora.lock;

import lombok.Getter;

import java.time.Duration;

/**
 * 대기 시간 안에 락을 얻지 못했을 때 발생합니다.
 * <p>
 * 경합 상황일 뿐 데이터 손상을 의미하지 않으므로 호출자가 재시도할 수 있습니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Getter
public class LockTimeoutException extends RuntimeException {

    private final String key;
    private final Duration waitTime;

    public LockTimeoutException(String key, Duration waitTime) {
        this(key, waitTime, null);
    }

    public LockTimeoutException(String key, Duration waitTime, Throwable cause) {
        super(String.format("락 획득 대기 시간 초과: key=%s, wait=%dms", key, waitTime.toMillis()), cause);
        this.key = key;
        this.waitTime = waitTime;
    }
}
