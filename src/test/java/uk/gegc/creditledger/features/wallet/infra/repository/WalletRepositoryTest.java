package uk.gegc.creditledger.features.wallet.infra.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.creditledger.features.wallet.domain.model.LedgerEntry;
import uk.gegc.creditledger.features.wallet.domain.model.LedgerEntryKind;
import uk.gegc.creditledger.features.wallet.domain.model.Wallet;
import uk.gegc.creditledger.features.wallet.domain.model.WalletPool;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("Wallet & Ledger Repository Tests")
class WalletRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private WalletRepository walletRepository;

    @Autowired
    private LedgerEntryRepository ledgerEntryRepository;

    private final LocalDateTime now = LocalDateTime.of(2026, 3, 1, 10, 0);

    @Nested
    @DisplayName("insertIfAbsent")
    class InsertIfAbsent {

        @Test
        @DisplayName("first insert creates the wallet, second is ignored")
        void insertIfAbsent_isIdempotent() {
            UUID userId = UUID.randomUUID();

            int first = walletRepository.insertIfAbsent(userId, 200, 50, now);
            int second = walletRepository.insertIfAbsent(userId, 999, 0, now);

            assertThat(first).isEqualTo(1);
            assertThat(second).isZero();

            Wallet wallet = walletRepository.findByUserIdForUpdate(userId).orElseThrow();
            assertThat(wallet.getTopUpCredits()).isEqualTo(200);
            assertThat(wallet.getSubscriptionCredits()).isZero();
            assertThat(wallet.getGraceLimit()).isEqualTo(50);
            assertThat(wallet.getGraceUsed()).isZero();
        }

        @Test
        @DisplayName("existsByUserId reflects the native insert")
        void existsByUserId_afterInsert() {
            UUID userId = UUID.randomUUID();
            assertThat(walletRepository.existsByUserId(userId)).isFalse();

            walletRepository.insertIfAbsent(userId, 0, 50, now);

            assertThat(walletRepository.existsByUserId(userId)).isTrue();
            assertThat(walletRepository.findAllUserIds()).contains(userId);
        }
    }

    @Nested
    @DisplayName("Ledger ordering")
    class LedgerOrdering {

        private LedgerEntry entry(UUID userId, int amount, int before) {
            return LedgerEntry.builder()
                    .userId(userId)
                    .pool(WalletPool.TOPUP)
                    .kind(LedgerEntryKind.CREDIT)
                    .amount(amount)
                    .balanceBefore(before)
                    .balanceAfter(before + amount)
                    .sourceType("PAYMENT")
                    .createdAt(now)
                    .build();
        }

        @Test
        @DisplayName("history is newest first and limited, replay order is oldest first")
        void ledger_ordersByAppendSequence() {
            UUID userId = UUID.randomUUID();
            ledgerEntryRepository.save(entry(userId, 10, 0));
            ledgerEntryRepository.save(entry(userId, 20, 10));
            ledgerEntryRepository.save(entry(userId, 30, 30));
            ledgerEntryRepository.save(entry(UUID.randomUUID(), 99, 0));
            entityManager.flush();

            List<LedgerEntry> newest = ledgerEntryRepository.findByUserIdOrderByIdDesc(userId, PageRequest.of(0, 2));
            List<LedgerEntry> replay = ledgerEntryRepository.findByUserIdOrderByIdAsc(userId);

            assertThat(newest).extracting(LedgerEntry::getAmount).containsExactly(30, 20);
            assertThat(replay).extracting(LedgerEntry::getAmount).containsExactly(10, 20, 30);
            assertThat(ledgerEntryRepository.countByUserId(userId)).isEqualTo(3);
        }
    }
}
