package com.agora.infrastructure.balance;

import com.agora.domain.balance.BalanceLog;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BalanceLogJpaRepository extends JpaRepository<BalanceLog, Long> {
}
