package com.agora.domain.signin;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * SigninStatus 엔티티에 대한 저장소 인터페이스.
 *
 * @author Agora
 * @version 1.0
 */
public interface SigninStatusRepository {

    SigninStatus save(SigninStatus signinStatus);

    Optional<SigninStatus> findByUserId(String userId);

    /**
     * 여러 사용자의 출석 상태를 한 번에 조회합니다.
     *
     * @param userIds 사용자 ID 목록
     * @return 조회된 상태 목록 (없는 사용자는 빠짐)
     */
    List<SigninStatus> findAllByUserIdIn(Collection<String> userIds);

    /**
     * 마지막 출석일이 기준일 이후인 상태를 조회합니다.
     *
     * @param since 기준일 (포함)
     * @return 조회된 상태 목록
     */
    List<SigninStatus> findAllByLastSigninDateGreaterThanEqual(LocalDate since);
}
