package uk.gegc.creditledger.features.wallet.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creditledger.features.wallet.application.CreditMetricsService;
import uk.gegc.creditledger.features.wallet.application.LedgerReconciliationService;
import uk.gegc.creditledger.features.wallet.domain.model.Wallet;
import uk.gegc.creditledger.features.wallet.infra.repository.WalletRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger replay reconciliation. Runs on {@code credits.reconciliation-cron} and on demand.
 * Reports drift through logs and metrics, never corrects balances.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerReconciliationServiceImpl implements LedgerReconciliationService {

    private final WalletRepository walletRepository;
    private final LedgerWriter ledgerWriter;
    private final LedgerReplayer ledgerReplayer;
    private final LegacyBalanceSync legacyBalanceSync;
    private final CreditMetricsService metricsService;

    @Override
    @Transactional(readOnly = true)
    public ReconciliationResult reconcileUser(UUID userId) {
        try {
            Optional<Wallet> walletOpt = walletRepository.findByUserId(userId);
            if (walletOpt.isEmpty()) {
                return new ReconciliationResult(userId, true, 0, 0, 0, 0,
                        legacyBalanceSync.legacyCredits(userId), "No wallet found for user");
            }

            Wallet wallet = walletOpt.get();
            LedgerReplayer.ReplayedBalances replayed = ledgerReplayer.replay(ledgerWriter.replayOrder(userId));
            int legacy = legacyBalanceSync.legacyCredits(userId);

            boolean balanced = replayed.subscriptionCredits() == wallet.getSubscriptionCredits()
                    && replayed.topUpCredits() == wallet.getTopUpCredits()
                    && legacy == wallet.getTotalCredits();

            String details = String.format(
                    "Subscription replayed: %d, actual: %d; top-up replayed: %d, actual: %d; legacy: %d; forfeited: %d; grace drawn: %d",
                    replayed.subscriptionCredits(), wallet.getSubscriptionCredits(),
                    replayed.topUpCredits(), wallet.getTopUpCredits(),
                    legacy, replayed.forfeitedCredits(), replayed.graceDrawn()
            );

            ReconciliationResult result = new ReconciliationResult(
                    userId, balanced,
                    replayed.subscriptionCredits(), wallet.getSubscriptionCredits(),
                    replayed.topUpCredits(), wallet.getTopUpCredits(),
                    legacy, details
            );

            if (balanced) {
                metricsService.recordReconciliationSuccess();
            } else {
                metricsService.recordReconciliationDrift(result.driftAmount());
                log.warn("Ledger drift detected for user {}: {}", userId, details);
            }
            return result;

        } catch (RuntimeException e) {
            log.error("Error during ledger reconciliation for user {}: {}", userId, e.getMessage(), e);
            metricsService.recordReconciliationFailure();
            return new ReconciliationResult(userId, false, 0, 0, 0, 0, 0,
                    "Error during reconciliation: " + e.getMessage());
        }
    }

    @Override
    @Transactional(readOnly = true)
    public ReconciliationSummary reconcileAllUsers() {
        log.info("Starting ledger reconciliation for all wallets");

        List<ReconciliationResult> driftResults = new ArrayList<>();
        List<UUID> userIds = walletRepository.findAllUserIds();

        for (UUID userId : userIds) {
            ReconciliationResult result = reconcileUser(userId);
            if (result.hasDrift()) {
                driftResults.add(result);
            }
        }

        long totalDrift = driftResults.stream()
                .mapToLong(ReconciliationResult::driftAmount)
                .sum();
        ReconciliationSummary summary = new ReconciliationSummary(
                userIds.size(), userIds.size() - driftResults.size(), driftResults.size(), totalDrift, driftResults
        );

        log.info("Ledger reconciliation completed: {} wallets, {} balanced, {} with drift, total drift: {}",
                summary.totalUsers(), summary.balancedUsers(), summary.usersWithDrift(), summary.totalDriftAmount());
        return summary;
    }

    @Scheduled(cron = "${credits.reconciliation-cron:0 0 2 * * SUN}")
    public void performScheduledReconciliation() {
        ReconciliationSummary summary = reconcileAllUsers();
        if (!summary.isSuccessful()) {
            log.warn("Scheduled reconciliation found drift in {} wallets, total drift: {} credits",
                    summary.usersWithDrift(), summary.totalDriftAmount());
        }
    }
}
