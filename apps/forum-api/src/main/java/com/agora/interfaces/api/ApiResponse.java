package com.agora.interfaces.api;

/**
 * 모든 API 응답의 공통 형식.
 *
 * @param meta 처리 결과
 * @param data 응답 본문
 * @param <T> 응답 본문 타입
 * @author Agora
 * @version 1.0
 */
public record ApiResponse<T>(Metadata meta, T data) {
    public record Metadata(Result result, String errorCode, String message, Boolean retryable) {
        public enum Result {
            SUCCESS, FAIL
        }

        public static Metadata success() {
            return new Metadata(Result.SUCCESS, null, null, null);
        }

        public static Metadata fail(String errorCode, String errorMessage, boolean retryable) {
            return new Metadata(Result.FAIL, errorCode, errorMessage, retryable);
        }
    }

    public static ApiResponse<Object> success() {
        return new ApiResponse<>(Metadata.success(), null);
    }

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(Metadata.success(), data);
    }

    public static ApiResponse<Object> fail(String errorCode, String errorMessage, boolean retryable) {
        return new ApiResponse<>(Metadata.fail(errorCode, errorMessage, retryable), null);
    }
}
