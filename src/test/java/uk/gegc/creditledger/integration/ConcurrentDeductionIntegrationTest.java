package uk.gegc.creditledger.integration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import uk.gegc.creditledger.features.reservation.application.ReservationService;
import uk.gegc.creditledger.features.wallet.api.dto.WalletBalanceDto;
import uk.gegc.creditledger.features.wallet.application.LedgerReconciliationService;
import uk.gegc.creditledger.features.wallet.application.WalletService;
import uk.gegc.creditledger.features.wallet.domain.exception.InsufficientCreditsException;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs without a test transaction so each call commits and competes for the wallet row lock.
 */
@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
@TestPropertySource(properties = {
    "spring.jpa.hibernate.ddl-auto=create-drop",
    "spring.flyway.enabled=false",
    "credits.default-grace-limit=0"
})
@DisplayName("Concurrent deductions")
class ConcurrentDeductionIntegrationTest {

    private static final int CREDITS = 10;

    @Autowired
    private WalletService walletService;

    @Autowired
    private ReservationService reservationService;

    @Autowired
    private LedgerReconciliationService reconciliationService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private final List<UUID> users = new ArrayList<>();

    @AfterEach
    void cleanUp() {
        for (UUID userId : users) {
            jdbcTemplate.update("DELETE FROM credit_reservations WHERE user_id = ?", userId);
            jdbcTemplate.update("DELETE FROM wallet_ledger_entries WHERE user_id = ?", userId);
            jdbcTemplate.update("DELETE FROM user_credits WHERE user_id = ?", userId);
            jdbcTemplate.update("DELETE FROM wallets WHERE user_id = ?", userId);
        }
        users.clear();
    }

    private UUID fundedUser() {
        UUID userId = UUID.randomUUID();
        users.add(userId);
        walletService.addTopUpCredits(userId, CREDITS, "pi_seed", null);
        return userId;
    }

    private int race(int calls, Runnable call) throws InterruptedException, ExecutionException {
        ExecutorService executor = Executors.newFixedThreadPool(calls);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < calls; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    try {
                        call.run();
                        return true;
                    } catch (InsufficientCreditsException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int successes = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    successes++;
                }
            }
            return successes;
        } finally {
            executor.shutdown();
            executor.awaitTermination(30, TimeUnit.SECONDS);
        }
    }

    @Test
    @DisplayName("N+1 single-credit deductions against N credits: exactly N succeed")
    void concurrentDeductions_neverOverspend() throws Exception {
        UUID userId = fundedUser();

        int successes = race(CREDITS + 1,
                () -> walletService.deductCredits(userId, 1, "QUIZ_GENERATION", null, null));

        assertThat(successes).isEqualTo(CREDITS);
        WalletBalanceDto balance = walletService.getBalance(userId);
        assertThat(balance.topUpCredits()).isZero();
        assertThat(balance.graceUsed()).isZero();
        assertThat(reconciliationService.reconcileUser(userId).isBalanced()).isTrue();
    }

    @Test
    @DisplayName("concurrent reservations never take more than the wallet holds")
    void concurrentReservations_neverOverspend() throws Exception {
        UUID userId = fundedUser();

        int successes = race(6, () -> reservationService.reserve(userId, 3, "QUIZ_GENERATION", null));

        assertThat(successes).isEqualTo(3);
        assertThat(walletService.getBalance(userId).topUpCredits()).isEqualTo(1);
        assertThat(reconciliationService.reconcileUser(userId).isBalanced()).isTrue();
    }

    @Test
    @DisplayName("concurrent first top-ups on a user without a wallet create one wallet and lose no credits")
    void concurrentFirstUse_createsSingleWallet() throws Exception {
        UUID userId = UUID.randomUUID();
        users.add(userId);

        int successes = race(8, () -> walletService.addTopUpCredits(userId, 1, null, null));

        assertThat(successes).isEqualTo(8);
        assertThat(walletService.getBalance(userId).topUpCredits()).isEqualTo(8);
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM wallets WHERE user_id = ?", Integer.class, userId))
                .isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject("SELECT credits FROM user_credits WHERE user_id = ?", Integer.class, userId))
                .isEqualTo(8);
        assertThat(reconciliationService.reconcileUser(userId).isBalanced()).isTrue();
    }
}
