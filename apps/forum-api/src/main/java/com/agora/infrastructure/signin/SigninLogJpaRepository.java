package com.agora.infrastructure.signin;

import com.agora.domain.signin.SigninLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;

public interface SigninLogJpaRepository extends JpaRepository<SigninLog, Long> {

    List<SigninLog> findAllBySignDate(LocalDate signDate);
}
