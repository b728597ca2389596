package uk.gegc.creditledger.features.wallet.application;

import java.util.List;
import java.util.UUID;

/**
 * Replays each wallet's ledger and compares the result with the stored pools and the legacy balance.
 */
public interface LedgerReconciliationService {

    ReconciliationResult reconcileUser(UUID userId);

    ReconciliationSummary reconcileAllUsers();

    /**
     * Drift is replayed minus stored, per pool.
     */
    record ReconciliationResult(
            UUID userId,
            boolean isBalanced,
            long replayedSubscriptionCredits,
            long actualSubscriptionCredits,
            long replayedTopUpCredits,
            long actualTopUpCredits,
            long legacyCredits,
            String details
    ) {
        public long subscriptionDrift() {
            return replayedSubscriptionCredits - actualSubscriptionCredits;
        }

        public long topUpDrift() {
            return replayedTopUpCredits - actualTopUpCredits;
        }

        public long legacyDrift() {
            return legacyCredits - (actualSubscriptionCredits + actualTopUpCredits);
        }

        public long driftAmount() {
            return Math.abs(subscriptionDrift()) + Math.abs(topUpDrift()) + Math.abs(legacyDrift());
        }

        public boolean hasDrift() {
            return !isBalanced;
        }
    }

    record ReconciliationSummary(
            int totalUsers,
            int balancedUsers,
            int usersWithDrift,
            long totalDriftAmount,
            List<ReconciliationResult> driftResults
    ) {
        public boolean isSuccessful() {
            return usersWithDrift == 0;
        }
    }
}
