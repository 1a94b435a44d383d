package com.agora.domain.balance;

import com.agora.support.error.CoreException;
import com.agora.support.error.ErrorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BalanceLogTest {

    private static final String USER_ID = "user-1";

    @DisplayName("장부 항목을 만들 때,")
    @Nested
    class Create {

        @DisplayName("변경 전후 잔액이 변경량과 맞으면 생성된다.")
        @Test
        void createsEntry_whenAmountsMatch() {
            // arrange
            BalanceChangeCommand command = BalanceChangeCommand.bySystem(
                USER_ID, BalanceType.POINTS, 10, "출석 보상", "signin", "1");

            // act
            BalanceLog entry = BalanceLog.of(command, 100, 110);

            // assert
            assertThat(entry.getBeforeAmount()).isEqualTo(100);
            assertThat(entry.getAfterAmount()).isEqualTo(110);
            assertThat(entry.getRelatedType()).isEqualTo("signin");
            assertThat(entry.isSystemInitiated()).isTrue();
        }

        @DisplayName("변경 전후 잔액이 변경량과 맞지 않으면 생성되지 않는다.")
        @Test
        void rejectsMismatchedAmounts() {
            // arrange
            BalanceChangeCommand command = BalanceChangeCommand.bySystem(
                USER_ID, BalanceType.POINTS, 10, "출석 보상", "signin", "1");

            // act
            CoreException result = assertThrows(CoreException.class, () -> BalanceLog.of(command, 100, 120));

            // assert
            assertThat(result.getErrorType()).isEqualTo(ErrorType.INTERNAL_ERROR);
        }

        @DisplayName("사유가 비어 있으면 생성되지 않는다.")
        @Test
        void rejectsBlankReason() {
            // arrange
            BalanceChangeCommand command = BalanceChangeCommand.bySystem(
                USER_ID, BalanceType.POINTS, 10, " ", null, null);

            // act
            CoreException result = assertThrows(CoreException.class, () -> BalanceLog.of(command, 0, 10));

            // assert
            assertThat(result.getErrorType()).isEqualTo(ErrorType.BAD_REQUEST);
        }

        @DisplayName("관리자가 변경했다면 관리자 정보를 남긴다.")
        @Test
        void recordsOperator() {
            // arrange
            BalanceChangeCommand command = new BalanceChangeCommand(
                USER_ID, BalanceType.CURRENCY, -5, "관리자 회수", null, null, new BalanceOperator(7L, "admin"));

            // act
            BalanceLog entry = BalanceLog.of(command, 5, 0);

            // assert
            assertThat(entry.getOperatorId()).isEqualTo(7L);
            assertThat(entry.getOperatorName()).isEqualTo("admin");
            assertThat(entry.isSystemInitiated()).isFalse();
        }
    }

    @DisplayName("잔액을 변경할 때,")
    @Nested
    class Change {

        @DisplayName("잔액보다 많이 차감하면 BAD_REQUEST 예외가 발생한다.")
        @ParameterizedTest
        @ValueSource(longs = {-11L, -100L})
        void rejectsOverdraft(long amount) {
            // arrange
            UserBalance balance = UserBalance.empty(USER_ID);
            balance.change(BalanceType.POINTS, 10);

            // act
            CoreException result = assertThrows(CoreException.class, () -> balance.change(BalanceType.POINTS, amount));

            // assert
            assertThat(result.getErrorType()).isEqualTo(ErrorType.BAD_REQUEST);
            assertThat(balance.getPoints()).isEqualTo(10);
        }

        @DisplayName("자산 종류별로 따로 누적된다.")
        @Test
        void keepsTypesSeparate() {
            // arrange
            UserBalance balance = UserBalance.empty(USER_ID);

            // act
            balance.change(BalanceType.POINTS, 10);
            balance.change(BalanceType.CURRENCY, 3);
            balance.gainExperience(5);

            // assert
            assertThat(balance.getPoints()).isEqualTo(10);
            assertThat(balance.getCurrency()).isEqualTo(3);
            assertThat(balance.getExperience()).isEqualTo(5);
        }
    }
}
