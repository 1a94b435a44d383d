package com.agora.task;

/**
 * 작업 봉투나 페이로드를 JSON으로 변환하지 못했을 때 발생합니다.
 *
 * @author Agora
 * @version 1.0
 */
public class TaskSerializationException extends RuntimeException {

    public TaskSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
