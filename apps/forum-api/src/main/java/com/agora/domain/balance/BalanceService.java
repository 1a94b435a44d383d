package com.agora.domain.balance;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 잔액 변경 도메인 서비스.
 * <p>
 * 잔액 변경과 장부 기록을 하나의 트랜잭션으로 묶습니다.
 * 호출자가 이미 트랜잭션을 열었다면 그 트랜잭션에 참여하므로,
 * 출석 기록이 롤백되면 포인트 지급도 함께 롤백됩니다.
 * </p>
 *
 * @author Agora
 * @version 1.0
 */
@RequiredArgsConstructor
@Component
public class BalanceService {

    private final UserBalanceRepository userBalanceRepository;
    private final BalanceLogRepository balanceLogRepository;

    /**
     * 잔액을 변경하고 장부에 기록합니다.
     * <p>
     * 잔액 행이 없으면 0에서 시작하는 행을 만듭니다.
     * </p>
     *
     * @param command 변경 요청
     * @return 기록된 장부 항목
     * @throws com.agora.support.error.CoreException 잔액이 부족하거나 사유가 비어 있는 경우
     */
    @Transactional
    public BalanceLog change(BalanceChangeCommand command) {
        UserBalance balance = loadForUpdate(command.userId());

        long before = balance.amountOf(command.type());
        balance.change(command.type(), command.amount());
        long after = balance.amountOf(command.type());

        BalanceLog entry = BalanceLog.of(command, before, after);
        userBalanceRepository.save(balance);
        return balanceLogRepository.save(entry);
    }

    /**
     * 경험치를 지급합니다. 경험치는 장부에 남기지 않습니다.
     *
     * @param userId 사용자 ID
     * @param amount 지급량
     * @return 지급 후 누적 경험치
     */
    @Transactional
    public long grantExperience(String userId, long amount) {
        UserBalance balance = loadForUpdate(userId);
        balance.gainExperience(amount);
        return userBalanceRepository.save(balance).getExperience();
    }

    private UserBalance loadForUpdate(String userId) {
        return userBalanceRepository.findByUserIdForUpdate(userId)
            .orElseGet(() -> userBalanceRepository.save(UserBalance.empty(userId)));
    }
}
