package com.agora.infrastructure.signin;

import com.agora.domain.signin.SigninStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface SigninStatusJpaRepository extends JpaRepository<SigninStatus, Long> {

    Optional<SigninStatus> findByUserId(String userId);

    List<SigninStatus> findAllByUserIdIn(Collection<String> userIds);

    List<SigninStatus> findAllByLastSigninDateGreaterThanEqual(LocalDate since);
}
