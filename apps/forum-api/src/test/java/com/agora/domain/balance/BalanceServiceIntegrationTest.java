package com.agora.domain.balance;

import com.agora.infrastructure.balance.BalanceLogJpaRepository;
import com.agora.infrastructure.balance.UserBalanceJpaRepository;
import com.agora.support.error.CoreException;
import com.agora.support.error.ErrorType;
import com.agora.utils.DatabaseCleanUp;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
@DisplayName("BalanceService 통합 테스트")
class BalanceServiceIntegrationTest {

    private static final String USER_ID = "user-1";

    @Autowired
    private BalanceService balanceService;

    @Autowired
    private UserBalanceJpaRepository userBalanceJpaRepository;

    @Autowired
    private BalanceLogJpaRepository balanceLogJpaRepository;

    @Autowired
    private DatabaseCleanUp databaseCleanUp;

    @AfterEach
    void tearDown() {
        databaseCleanUp.truncateAllTables();
    }

    private BalanceChangeCommand points(long amount) {
        return BalanceChangeCommand.bySystem(USER_ID, BalanceType.POINTS, amount, "테스트", null, null);
    }

    @DisplayName("같은 사용자의 잔액을 동시에 바꿔도, 행 잠금으로 갱신이 유실되지 않고 장부의 전후 금액이 이어진다.")
    @Test
    void serializesConcurrentChanges_withRowLock() throws Exception {
        // arrange
        balanceService.change(points(100));
        int threadCount = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<BalanceLog>> futures = new ArrayList<>();

        // act
        for (int i = 0; i < threadCount; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return balanceService.change(points(-10));
            }));
        }
        start.countDown();
        for (Future<BalanceLog> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // assert
        UserBalance balance = userBalanceJpaRepository.findAll().get(0);
        assertThat(balance.getPoints()).isZero();

        List<BalanceLog> entries = balanceLogJpaRepository.findAll().stream()
            .sorted(Comparator.comparing(BalanceLog::getBeforeAmount).reversed())
            .toList();
        assertThat(entries).hasSize(threadCount + 1);
        for (int i = 1; i < entries.size(); i++) {
            assertThat(entries.get(i).getBeforeAmount()).isEqualTo(entries.get(i - 1).getAfterAmount());
        }
    }

    @DisplayName("잔액보다 많이 차감하면 BAD_REQUEST 예외가 발생하고 장부에 남지 않는다.")
    @Test
    void rejectsOverdraft() {
        // arrange
        balanceService.change(points(5));

        // act
        CoreException result = assertThrows(CoreException.class, () -> balanceService.change(points(-10)));

        // assert
        assertThat(result.getErrorType()).isEqualTo(ErrorType.BAD_REQUEST);
        assertThat(userBalanceJpaRepository.findAll().get(0).getPoints()).isEqualTo(5L);
        assertThat(balanceLogJpaRepository.count()).isEqualTo(1L);
    }
}
