package com.agora.infrastructure.signin;

import com.agora.domain.signin.SigninLog;
import com.agora.domain.signin.SigninLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

@RequiredArgsConstructor
@Component
public class SigninLogRepositoryImpl implements SigninLogRepository {
    private final SigninLogJpaRepository signinLogJpaRepository;

    @Override
    public SigninLog save(SigninLog signinLog) {
        return signinLogJpaRepository.saveAndFlush(signinLog);
    }

    @Override
    public List<SigninLog> findAllBySignDate(LocalDate signDate) {
        return signinLogJpaRepository.findAllBySignDate(signDate);
    }
}
