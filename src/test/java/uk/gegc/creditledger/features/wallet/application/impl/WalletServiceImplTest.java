package uk.gegc.creditledger.features.wallet.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.creditledger.features.wallet.api.dto.DeductResultDto;
import uk.gegc.creditledger.features.wallet.application.CreditMetricsService;
import uk.gegc.creditledger.features.wallet.application.CreditsProperties;
import uk.gegc.creditledger.features.wallet.domain.exception.InsufficientCreditsException;
import uk.gegc.creditledger.features.wallet.domain.exception.InvalidAmountException;
import uk.gegc.creditledger.features.wallet.domain.model.LedgerEntry;
import uk.gegc.creditledger.features.wallet.domain.model.LedgerEntryKind;
import uk.gegc.creditledger.features.wallet.domain.model.LedgerSources;
import uk.gegc.creditledger.features.wallet.domain.model.Wallet;
import uk.gegc.creditledger.features.wallet.domain.model.WalletPool;
import uk.gegc.creditledger.features.wallet.domain.service.DeductionEngine;
import uk.gegc.creditledger.features.wallet.infra.mapping.LedgerEntryMapper;
import uk.gegc.creditledger.features.wallet.infra.mapping.WalletMapper;
import uk.gegc.creditledger.features.wallet.infra.repository.WalletRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("WalletServiceImpl Tests")
class WalletServiceImplTest {

    @Mock
    private WalletStore walletStore;

    @Mock
    private WalletRepository walletRepository;

    @Mock
    private LedgerWriter ledgerWriter;

    @Mock
    private LegacyBalanceSync legacyBalanceSync;

    @Mock
    private CreditMetricsService metricsService;

    @Mock
    private WalletMapper walletMapper;

    @Mock
    private LedgerEntryMapper ledgerEntryMapper;

    private final LedgerMetadataCodec metadataCodec = new LedgerMetadataCodec(new ObjectMapper());
    private final CreditsProperties creditsProperties = new CreditsProperties();
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private WalletServiceImpl walletService;
    private UUID userId;

    @BeforeEach
    void setUp() {
        walletService = new WalletServiceImpl(walletStore, walletRepository, ledgerWriter, legacyBalanceSync,
                new DeductionEngine(), metadataCodec, creditsProperties, metricsService,
                walletMapper, ledgerEntryMapper, clock);
        userId = UUID.randomUUID();

        lenient().when(ledgerWriter.entry(any(), any(), any())).thenAnswer(inv -> LedgerEntry.builder()
                .userId(inv.getArgument(0))
                .pool(inv.getArgument(1))
                .kind(inv.getArgument(2)));
        lenient().when(ledgerWriter.append(any())).thenAnswer(inv -> inv.getArgument(0));
    }

    private Wallet wallet(int subscription, int topUp, int graceLimit) {
        Wallet wallet = new Wallet();
        wallet.setUserId(userId);
        wallet.setSubscriptionCredits(subscription);
        wallet.setTopUpCredits(topUp);
        wallet.setGraceLimit(graceLimit);
        return wallet;
    }

    private List<LedgerEntry> appendedEntries(int expected) {
        ArgumentCaptor<LedgerEntry> captor = ArgumentCaptor.forClass(LedgerEntry.class);
        verify(ledgerWriter, times(expected)).append(captor.capture());
        return captor.getAllValues();
    }

    @Nested
    @DisplayName("deductCredits")
    class DeductCredits {

        @Test
        @DisplayName("deductCredits: when subscription covers cost then one subscription debit")
        void deductCredits_whenSubscriptionCovers_thenSingleSubscriptionDebit() {
            // Given
            Wallet wallet = wallet(100, 0, 0);
            when(walletStore.getOrCreate(userId)).thenReturn(wallet);

            // When
            DeductResultDto result = walletService.deductCredits(userId, 30, "QUIZ_GENERATION", "job-1", null);

            // Then
            assertThat(result.subscriptionDeducted()).isEqualTo(30);
            assertThat(result.topUpDeducted()).isZero();
            assertThat(result.balanceAfter()).isEqualTo(70);
            assertThat(wallet.getSubscriptionCredits()).isEqualTo(70);

            List<LedgerEntry> entries = appendedEntries(1);
            LedgerEntry debit = entries.get(0);
            assertThat(debit.getPool()).isEqualTo(WalletPool.SUBSCRIPTION);
            assertThat(debit.getKind()).isEqualTo(LedgerEntryKind.DEBIT);
            assertThat(debit.getAmount()).isEqualTo(30);
            assertThat(debit.getBalanceBefore()).isEqualTo(100);
            assertThat(debit.getBalanceAfter()).isEqualTo(70);
            assertThat(debit.getSourceId()).isEqualTo("job-1");
            assertThat(debit.getDescription()).isEqualTo("Usage");

            verify(walletRepository).save(wallet);
            verify(legacyBalanceSync).sync(wallet);
            verify(metricsService).incrementCreditsDeducted(WalletPool.SUBSCRIPTION, 30, "QUIZ_GENERATION");
        }

        @Test
        @DisplayName("deductCredits: when cost spans both pools then one debit per pool, subscription first")
        void deductCredits_whenCostSpansPools_thenTwoDebits() {
            // Given
            Wallet wallet = wallet(5, 10, 0);
            when(walletStore.getOrCreate(userId)).thenReturn(wallet);

            // When
            walletService.deductCredits(userId, 12, "EXPORT", null, "Export run");

            // Then
            List<LedgerEntry> entries = appendedEntries(2);
            assertThat(entries.get(0).getPool()).isEqualTo(WalletPool.SUBSCRIPTION);
            assertThat(entries.get(0).getAmount()).isEqualTo(5);
            assertThat(entries.get(1).getPool()).isEqualTo(WalletPool.TOPUP);
            assertThat(entries.get(1).getAmount()).isEqualTo(7);
            assertThat(entries.get(1).getBalanceBefore()).isEqualTo(10);
            assertThat(entries.get(1).getBalanceAfter()).isEqualTo(3);
            assertThat(entries).allSatisfy(e -> assertThat(e.getDescription()).isEqualTo("Export run"));
            assertThat(wallet.getTotalCredits()).isEqualTo(3);
        }

        @Test
        @DisplayName("deductCredits: when grace is drawn then balance-neutral grace entry with metadata")
        void deductCredits_whenGraceDrawn_thenGraceEntry() {
            // Given
            Wallet wallet = wallet(0, 20, 10);
            when(walletStore.getOrCreate(userId)).thenReturn(wallet);

            // When
            DeductResultDto result = walletService.deductCredits(userId, 25, "QUIZ_GENERATION", "job-2", "Quiz");

            // Then
            assertThat(result.graceUsed()).isEqualTo(5);
            assertThat(result.totalDeducted()).isEqualTo(25);
            assertThat(wallet.getTopUpCredits()).isZero();
            assertThat(wallet.getGraceLimit()).isEqualTo(5);
            assertThat(wallet.getGraceUsed()).isEqualTo(5);

            List<LedgerEntry> entries = appendedEntries(2);
            LedgerEntry grace = entries.get(1);
            assertThat(grace.getPool()).isEqualTo(WalletPool.TOPUP);
            assertThat(grace.getKind()).isEqualTo(LedgerEntryKind.DEBIT);
            assertThat(grace.getAmount()).isEqualTo(5);
            assertThat(grace.getBalanceBefore()).isZero();
            assertThat(grace.getBalanceAfter()).isZero();
            assertThat(grace.getDescription()).isEqualTo("Quiz (grace: 5 credits)");
            assertThat(metadataCodec.read(grace.getMetadata()))
                    .containsEntry("graceUsed", true)
                    .containsEntry("graceAmount", 5);

            verify(metricsService).incrementGraceConsumed(5);
        }

        @Test
        @DisplayName("deductCredits: when insufficient then nothing written and rejection counted")
        void deductCredits_whenInsufficient_thenNoWrites() {
            // Given
            Wallet wallet = wallet(70, 0, 0);
            when(walletStore.getOrCreate(userId)).thenReturn(wallet);

            // When / Then
            assertThatThrownBy(() -> walletService.deductCredits(userId, 150, "QUIZ_GENERATION", null, null))
                    .isInstanceOfSatisfying(InsufficientCreditsException.class, ex -> {
                        assertThat(ex.getRequired()).isEqualTo(150);
                        assertThat(ex.getAvailable()).isEqualTo(70);
                    });

            assertThat(wallet.getSubscriptionCredits()).isEqualTo(70);
            verify(walletRepository, never()).save(any());
            verify(ledgerWriter, never()).append(any());
            verify(legacyBalanceSync, never()).sync(any());
            verify(metricsService).incrementDeductionRejected("QUIZ_GENERATION");
        }

        @Test
        @DisplayName("deductCredits: when cost is zero then InvalidAmountException before the wallet is touched")
        void deductCredits_whenCostZero_thenInvalidAmount() {
            assertThatThrownBy(() -> walletService.deductCredits(userId, 0, "QUIZ_GENERATION", null, null))
                    .isInstanceOf(InvalidAmountException.class);

            verifyNoInteractions(walletStore, ledgerWriter, legacyBalanceSync);
        }

        @Test
        @DisplayName("deductCredits: when source type is blank then IllegalArgumentException")
        void deductCredits_whenSourceTypeBlank_thenIllegalArgument() {
            assertThatThrownBy(() -> walletService.deductCredits(userId, 5, " ", null, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("sourceType");

            verifyNoInteractions(walletStore);
        }
    }

    @Nested
    @DisplayName("addTopUpCredits and refundCredits")
    class Credits {

        @Test
        @DisplayName("addTopUpCredits: adds to top-up with PAYMENT source and default description")
        void addTopUpCredits_addsToTopUp() {
            // Given
            Wallet wallet = wallet(0, 80, 50);
            when(walletStore.getOrCreate(userId)).thenReturn(wallet);

            // When
            walletService.addTopUpCredits(userId, 100, "pi_123", null);

            // Then
            assertThat(wallet.getTopUpCredits()).isEqualTo(180);
            LedgerEntry entry = appendedEntries(1).get(0);
            assertThat(entry.getPool()).isEqualTo(WalletPool.TOPUP);
            assertThat(entry.getKind()).isEqualTo(LedgerEntryKind.CREDIT);
            assertThat(entry.getBalanceBefore()).isEqualTo(80);
            assertThat(entry.getBalanceAfter()).isEqualTo(180);
            assertThat(entry.getSourceType()).isEqualTo(LedgerSources.PAYMENT);
            assertThat(entry.getSourceId()).isEqualTo("pi_123");
            assertThat(entry.getDescription()).isEqualTo("Top-up purchase");
            verify(legacyBalanceSync).sync(wallet);
            verify(metricsService).incrementTopUpAdded(100);
        }

        @Test
        @DisplayName("addTopUpCredits: when amount is negative then InvalidAmountException")
        void addTopUpCredits_whenNegative_thenInvalidAmount() {
            assertThatThrownBy(() -> walletService.addTopUpCredits(userId, -5, null, null))
                    .isInstanceOfSatisfying(InvalidAmountException.class,
                            ex -> assertThat(ex.getField()).isEqualTo("amount"));
            verifyNoInteractions(walletStore);
        }

        @Test
        @DisplayName("refundCredits: lands in top-up even when originally from subscription")
        void refundCredits_landsInTopUp() {
            // Given
            Wallet wallet = wallet(40, 0, 50);
            when(walletStore.getOrCreate(userId)).thenReturn(wallet);

            // When
            walletService.refundCredits(userId, 20, WalletPool.SUBSCRIPTION, "Generation failed", "res-1");

            // Then
            assertThat(wallet.getSubscriptionCredits()).isEqualTo(40);
            assertThat(wallet.getTopUpCredits()).isEqualTo(20);
            LedgerEntry entry = appendedEntries(1).get(0);
            assertThat(entry.getKind()).isEqualTo(LedgerEntryKind.REFUND);
            assertThat(entry.getPool()).isEqualTo(WalletPool.TOPUP);
            assertThat(entry.getSourceType()).isEqualTo(LedgerSources.SYSTEM);
            assertThat(entry.getDescription()).isEqualTo("Generation failed");
            assertThat(metadataCodec.read(entry.getMetadata())).containsEntry("originalPool", "SUBSCRIPTION");
            verify(metricsService).incrementCreditsRefunded(20);
        }
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("hasCredits: counts remaining grace without locking")
        void hasCredits_countsGrace() {
            when(walletStore.peek(userId)).thenReturn(wallet(0, 0, 5));

            assertThat(walletService.hasCredits(userId, 5)).isTrue();
            assertThat(walletService.hasCredits(userId, 6)).isFalse();
            verify(walletStore, never()).getOrCreate(any());
        }

        @Test
        @DisplayName("getTransactionHistory: limit below 1 uses default, large limit is capped")
        void getTransactionHistory_clampsLimit() {
            when(ledgerWriter.history(eq(userId), anyInt())).thenReturn(List.of());
            when(ledgerEntryMapper.toDtos(any())).thenReturn(List.of());

            walletService.getTransactionHistory(userId, 0);
            walletService.getTransactionHistory(userId, 10_000);
            walletService.getTransactionHistory(userId, 7);

            verify(ledgerWriter).history(userId, 50);
            verify(ledgerWriter).history(userId, 200);
            verify(ledgerWriter).history(userId, 7);
        }
    }
}
