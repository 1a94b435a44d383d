package com.agora.infrastructure.balance;

import com.agora.domain.balance.UserBalance;
import com.agora.domain.balance.UserBalanceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

@RequiredArgsConstructor
@Component
public class UserBalanceRepositoryImpl implements UserBalanceRepository {
    private final UserBalanceJpaRepository userBalanceJpaRepository;

    @Override
    public UserBalance save(UserBalance userBalance) {
        return userBalanceJpaRepository.save(userBalance);
    }

    @Override
    public Optional<UserBalance> findByUserIdForUpdate(String userId) {
        return userBalanceJpaRepository.findByUserIdForUpdate(userId);
    }
}
