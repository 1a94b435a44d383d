package com.agora.infrastructure.signin;

import com.agora.domain.signin.SigninStatus;
import com.agora.domain.signin.SigninStatusRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@RequiredArgsConstructor
@Component
public class SigninStatusRepositoryImpl implements SigninStatusRepository {
    private final SigninStatusJpaRepository signinStatusJpaRepository;

    @Override
    public SigninStatus save(SigninStatus signinStatus) {
        return signinStatusJpaRepository.save(signinStatus);
    }

    @Override
    public Optional<SigninStatus> findByUserId(String userId) {
        return signinStatusJpaRepository.findByUserId(userId);
    }

    @Override
    public List<SigninStatus> findAllByUserIdIn(Collection<String> userIds) {
        if (userIds.isEmpty()) {
            return List.of();
        }
        return signinStatusJpaRepository.findAllByUserIdIn(userIds);
    }

    @Override
    public List<SigninStatus> findAllByLastSigninDateGreaterThanEqual(LocalDate since) {
        return signinStatusJpaRepository.findAllByLastSigninDateGreaterThanEqual(since);
    }
}
