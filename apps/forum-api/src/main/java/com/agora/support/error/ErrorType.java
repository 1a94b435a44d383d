package com.agora.support.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * API 오류 유형.
 * <p>
 * 상태 코드와 함께 클라이언트가 분기할 수 있는 오류 코드, 기본 메시지를 가집니다.
 * {@code retryable}이 true인 오류는 같은 요청을 잠시 뒤 다시 보내도 안전합니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@Getter
@RequiredArgsConstructor
public enum ErrorType {
    /** 범용 에러 */
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase(), "일시적인 오류가 발생했습니다.", false),
    BAD_REQUEST(HttpStatus.BAD_REQUEST, HttpStatus.BAD_REQUEST.getReasonPhrase(), "잘못된 요청입니다.", false),
    NOT_FOUND(HttpStatus.NOT_FOUND, HttpStatus.NOT_FOUND.getReasonPhrase(), "존재하지 않는 요청입니다.", false),
    CONFLICT(HttpStatus.CONFLICT, HttpStatus.CONFLICT.getReasonPhrase(), "이미 존재하는 리소스입니다.", false),
    FORBIDDEN(HttpStatus.FORBIDDEN, HttpStatus.FORBIDDEN.getReasonPhrase(), "허용되지 않은 요청입니다.", false),

    /** 출석 */
    SIGNIN_DISABLED(HttpStatus.FORBIDDEN, "SIGNIN_DISABLED", "출석 기능이 비활성화되어 있습니다.", false),
    ALREADY_SIGNED_IN(HttpStatus.CONFLICT, "ALREADY_SIGNED_IN", "오늘은 이미 출석했습니다.", false),
    LOCK_TIMEOUT(HttpStatus.INTERNAL_SERVER_ERROR, "LOCK_TIMEOUT", "요청이 몰려 처리하지 못했습니다. 잠시 후 다시 시도해주세요.", true);

    private final HttpStatus status;
    private final String code;
    private final String message;
    private final boolean retryable;
}
