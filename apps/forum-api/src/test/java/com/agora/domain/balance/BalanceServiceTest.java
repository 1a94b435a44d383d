package com.agora.domain.balance;

import com.agora.support.error.CoreException;
import com.agora.support.error.ErrorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BalanceServiceTest {

    private static final String USER_ID = "user-1";

    @Mock
    private UserBalanceRepository userBalanceRepository;

    @Mock
    private BalanceLogRepository balanceLogRepository;

    @InjectMocks
    private BalanceService balanceService;

    @DisplayName("잔액을 변경하면 변경 전후 잔액이 장부에 남는다.")
    @Test
    void recordsBeforeAndAfter() {
        // arrange
        UserBalance balance = UserBalance.empty(USER_ID);
        balance.change(BalanceType.POINTS, 100);
        when(userBalanceRepository.findByUserIdForUpdate(USER_ID)).thenReturn(Optional.of(balance));
        when(userBalanceRepository.save(any(UserBalance.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(balanceLogRepository.save(any(BalanceLog.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // act
        BalanceLog entry = balanceService.change(BalanceChangeCommand.bySystem(
            USER_ID, BalanceType.POINTS, 15, "출석 보상", "signin", "42"));

        // assert
        assertThat(entry.getBeforeAmount()).isEqualTo(100);
        assertThat(entry.getAfterAmount()).isEqualTo(115);
        assertThat(entry.getRelatedId()).isEqualTo("42");
        assertThat(balance.getPoints()).isEqualTo(115);
    }

    @DisplayName("잔액 행이 없으면 0에서 시작하는 행을 만든다.")
    @Test
    void createsBalance_whenMissing() {
        // arrange
        when(userBalanceRepository.findByUserIdForUpdate(USER_ID)).thenReturn(Optional.empty());
        when(userBalanceRepository.save(any(UserBalance.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(balanceLogRepository.save(any(BalanceLog.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // act
        BalanceLog entry = balanceService.change(BalanceChangeCommand.bySystem(
            USER_ID, BalanceType.POINTS, 10, "출석 보상", "signin", "1"));

        // assert
        assertThat(entry.getBeforeAmount()).isZero();
        assertThat(entry.getAfterAmount()).isEqualTo(10);
    }

    @DisplayName("잔액이 부족하면 장부를 남기지 않는다.")
    @Test
    void doesNotRecord_whenOverdrawn() {
        // arrange
        when(userBalanceRepository.findByUserIdForUpdate(USER_ID)).thenReturn(Optional.of(UserBalance.empty(USER_ID)));

        // act
        CoreException result = assertThrows(CoreException.class, () -> balanceService.change(
            BalanceChangeCommand.bySystem(USER_ID, BalanceType.CURRENCY, -1, "차감", null, null)));

        // assert
        assertThat(result.getErrorType()).isEqualTo(ErrorType.BAD_REQUEST);
        verify(balanceLogRepository, never()).save(any(BalanceLog.class));
    }

    @DisplayName("경험치는 잔액에만 누적되고 장부에는 남지 않는다.")
    @Test
    void grantsExperienceWithoutLedger() {
        // arrange
        UserBalance balance = UserBalance.empty(USER_ID);
        when(userBalanceRepository.findByUserIdForUpdate(USER_ID)).thenReturn(Optional.of(balance));
        when(userBalanceRepository.save(any(UserBalance.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // act
        long experience = balanceService.grantExperience(USER_ID, 5);

        // assert
        assertThat(experience).isEqualTo(5);
        ArgumentCaptor<UserBalance> captor = ArgumentCaptor.forClass(UserBalance.class);
        verify(userBalanceRepository).save(captor.capture());
        assertThat(captor.getValue().getExperience()).isEqualTo(5);
        verify(balanceLogRepository, never()).save(any(BalanceLog.class));
    }
}
