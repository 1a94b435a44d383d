package com.agora.domain.signin;

import java.time.LocalDate;
import java.util.List;

/**
 * SigninLog 엔티티에 대한 저장소 인터페이스.
 *
 * @author Agora
 * @version 1.0
 */
public interface SigninLogRepository {

    /**
     * 출석 기록을 저장하고 즉시 flush합니다.
     * <p>
     * 유니크 제약 위반이 커밋 시점이 아니라 이 호출에서 드러나도록 합니다.
     * </p>
     *
     * @param signinLog 출석 기록
     * @return 저장된 출석 기록
     * @throws org.springframework.dao.DataIntegrityViolationException 같은 날 기록이 이미 있는 경우
     */
    SigninLog save(SigninLog signinLog);

    List<SigninLog> findAllBySignDate(LocalDate signDate);
}
