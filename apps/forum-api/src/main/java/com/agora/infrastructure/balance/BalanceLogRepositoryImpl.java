package com.agora.infrastructure.balance;

import com.agora.domain.balance.BalanceLog;
import com.agora.domain.balance.BalanceLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@RequiredArgsConstructor
@Component
public class BalanceLogRepositoryImpl implements BalanceLogRepository {
    private final BalanceLogJpaRepository balanceLogJpaRepository;

    @Override
    public BalanceLog save(BalanceLog balanceLog) {
        return balanceLogJpaRepository.save(balanceLog);
    }
}
