package com.agora.interfaces.api;

import com.agora.support.error.CoreException;
import com.agora.support.error.ErrorType;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 출석 API의 예외를 {@link ApiResponse} 실패 응답으로 바꿉니다.
 * <p>
 * 상태 코드와 오류 코드는 {@link ErrorType}이 정합니다. 재시도 가능한 오류(락 대기 초과 등)에는
 * {@code Retry-After} 헤더를 함께 내려 클라이언트가 바로 다시 요청하지 않도록 합니다.
 * 서버 측 오류는 요청 경로와 함께 error 로그로, 클라이언트 오류는 warn 로그로 남깁니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@RestControllerAdvice
@Slf4j
public class ApiControllerAdvice {

    static final String RETRY_AFTER_SECONDS = "1";

    @ExceptionHandler
    public ResponseEntity<ApiResponse<?>> handle(CoreException e, HttpServletRequest request) {
        ErrorType errorType = e.getErrorType();
        if (errorType.getStatus().is5xxServerError()) {
            log.error("[{} {}] {}: {}", request.getMethod(), request.getRequestURI(), errorType.getCode(), e.getMessage(), e);
        } else {
            log.warn("[{} {}] {}: {}", request.getMethod(), request.getRequestURI(), errorType.getCode(), e.getMessage());
        }
        return failure(errorType, e.getCustomMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        MissingRequestHeaderException.class,
        HttpRequestMethodNotSupportedException.class
    })
    public ResponseEntity<ApiResponse<?>> handleBinding(Exception e, HttpServletRequest request) {
        String message = describeBindingFailure(e);
        log.warn("[{} {}] 요청 형식 오류: {}", request.getMethod(), request.getRequestURI(), message);
        return failure(ErrorType.BAD_REQUEST, message);
    }

    @ExceptionHandler
    public ResponseEntity<ApiResponse<?>> handleNotFound(NoResourceFoundException e) {
        return failure(ErrorType.NOT_FOUND, null);
    }

    @ExceptionHandler
    public ResponseEntity<ApiResponse<?>> handle(Throwable e, HttpServletRequest request) {
        log.error("[{} {}] 처리되지 않은 예외", request.getMethod(), request.getRequestURI(), e);
        return failure(ErrorType.INTERNAL_ERROR, null);
    }

    private String describeBindingFailure(Exception e) {
        if (e instanceof MethodArgumentTypeMismatchException mismatch) {
            return String.format("요청 파라미터 '%s'의 값 '%s'을(를) 해석할 수 없습니다.", mismatch.getName(), mismatch.getValue());
        }
        if (e instanceof MissingServletRequestParameterException missing) {
            return String.format("필수 요청 파라미터 '%s'가 누락되었습니다.", missing.getParameterName());
        }
        if (e instanceof MissingRequestHeaderException missing) {
            return String.format("필수 요청 헤더 '%s'가 누락되었습니다.", missing.getHeaderName());
        }
        if (e instanceof HttpRequestMethodNotSupportedException unsupported) {
            return String.format("지원하지 않는 메서드입니다: %s", unsupported.getMethod());
        }
        return ErrorType.BAD_REQUEST.getMessage();
    }

    private ResponseEntity<ApiResponse<?>> failure(ErrorType errorType, String customMessage) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(errorType.getStatus());
        if (errorType.isRetryable()) {
            builder.header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
        }
        String message = customMessage != null ? customMessage : errorType.getMessage();
        return builder.body(ApiResponse.fail(errorType.getCode(), message, errorType.isRetryable()));
    }
}
