package uk.gegc.creditledger.features.subscription.application.impl;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creditledger.features.subscription.application.SubscriptionCycleService;
import uk.gegc.creditledger.features.subscription.domain.exception.BillingPeriodAlreadyAppliedException;
import uk.gegc.creditledger.features.subscription.domain.exception.SubscriptionCreditsAlreadyGrantedException;
import uk.gegc.creditledger.features.subscription.domain.model.PeriodGrantType;
import uk.gegc.creditledger.features.subscription.domain.model.SubscriptionPeriodGrant;
import uk.gegc.creditledger.features.subscription.infra.repository.SubscriptionPeriodGrantRepository;
import uk.gegc.creditledger.features.wallet.application.CreditMetricsService;
import uk.gegc.creditledger.features.wallet.application.LedgerStructuredLogger;
import uk.gegc.creditledger.features.wallet.application.impl.LedgerMetadataCodec;
import uk.gegc.creditledger.features.wallet.application.impl.LedgerWriter;
import uk.gegc.creditledger.features.wallet.application.impl.LegacyBalanceSync;
import uk.gegc.creditledger.features.wallet.application.impl.WalletStore;
import uk.gegc.creditledger.features.wallet.domain.exception.InvalidAmountException;
import uk.gegc.creditledger.features.wallet.domain.model.LedgerEntryKind;
import uk.gegc.creditledger.features.wallet.domain.model.LedgerSources;
import uk.gegc.creditledger.features.wallet.domain.model.Wallet;
import uk.gegc.creditledger.features.wallet.domain.model.WalletPool;
import uk.gegc.creditledger.features.wallet.infra.repository.WalletRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class SubscriptionCycleServiceImpl implements SubscriptionCycleService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionCycleServiceImpl.class);

    private final WalletStore walletStore;
    private final WalletRepository walletRepository;
    private final LedgerWriter ledgerWriter;
    private final LegacyBalanceSync legacyBalanceSync;
    private final LedgerMetadataCodec metadataCodec;
    private final SubscriptionPeriodGrantRepository periodGrantRepository;
    private final CreditMetricsService metricsService;
    private final Clock clock;

    @Override
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public void grantInitialSubscriptionCredits(UUID userId, int credits, LocalDateTime expiresAt, String sourceId) {
        doGrant(userId, credits, expiresAt, sourceId);
    }

    @Override
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public void resetSubscriptionCredits(UUID userId, int planLimit, LocalDateTime expiresAt, String sourceId) {
        doReset(userId, planLimit, expiresAt, sourceId);
    }

    @Override
    @Transactional
    public void revokeSubscriptionCredits(UUID userId, String reason) {
        Wallet wallet = walletStore.getOrCreate(userId);
        int previous = wallet.getSubscriptionCredits();
        if (previous <= 0) {
            log.debug("Nothing to revoke for user {}", userId);
            return;
        }

        wallet.setSubscriptionCredits(0);
        wallet.setSubscriptionExpiresAt(null);
        wallet.setUpdatedAt(LocalDateTime.now(clock));
        walletRepository.save(wallet);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("revocationReason", reason);
        ledgerWriter.append(ledgerWriter.entry(userId, WalletPool.SUBSCRIPTION, LedgerEntryKind.DEBIT)
                .amount(previous)
                .balanceBefore(previous)
                .balanceAfter(0)
                .sourceType(LedgerSources.SYSTEM)
                .description("Credits revoked: " + reason)
                .metadata(metadataCodec.write(meta))
                .build());

        legacyBalanceSync.sync(wallet);
        metricsService.incrementSubscriptionRevoked(previous);
        LedgerStructuredLogger.logCycleOperation(log, "warn",
                "Revoked {} subscription credits from user {}: {}",
                userId, "REVOKE", null, null, previous, userId, reason);
    }

    @Override
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public boolean applyInitialGrant(UUID userId, String subscriptionId, LocalDateTime periodStart,
                                     int credits, LocalDateTime expiresAt) {
        if (!claimPeriod(userId, subscriptionId, periodStart, PeriodGrantType.INITIAL, credits)) {
            return false;
        }
        doGrant(userId, credits, expiresAt, subscriptionId);
        return true;
    }

    @Override
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public boolean applyRenewal(UUID userId, String subscriptionId, LocalDateTime periodStart,
                                int planLimit, LocalDateTime expiresAt) {
        if (!claimPeriod(userId, subscriptionId, periodStart, PeriodGrantType.RENEWAL, planLimit)) {
            return false;
        }
        doReset(userId, planLimit, expiresAt, subscriptionId);
        return true;
    }

    private void doGrant(UUID userId, int credits, LocalDateTime expiresAt, String sourceId) {
        if (credits <= 0) {
            throw new InvalidAmountException("credits", credits);
        }

        Wallet wallet = walletStore.getOrCreate(userId);
        if (wallet.getSubscriptionCredits() != 0) {
            throw new SubscriptionCreditsAlreadyGrantedException(userId, wallet.getSubscriptionCredits());
        }

        wallet.setSubscriptionCredits(credits);
        wallet.setSubscriptionExpiresAt(expiresAt);
        wallet.setUpdatedAt(LocalDateTime.now(clock));
        walletRepository.save(wallet);

        ledgerWriter.append(ledgerWriter.entry(userId, WalletPool.SUBSCRIPTION, LedgerEntryKind.CREDIT)
                .amount(credits)
                .balanceBefore(0)
                .balanceAfter(credits)
                .sourceType(LedgerSources.SUBSCRIPTION_CYCLE)
                .sourceId(sourceId)
                .description("Initial subscription credits")
                .build());

        legacyBalanceSync.sync(wallet);
        metricsService.incrementSubscriptionGranted(credits);
        LedgerStructuredLogger.logCycleOperation(log, "info",
                "Granted {} initial subscription credits to user {}, expiring {}",
                userId, "GRANT", sourceId, null, credits, userId, expiresAt);
    }

    private void doReset(UUID userId, int planLimit, LocalDateTime expiresAt, String sourceId) {
        if (planLimit < 0) {
            throw new InvalidAmountException("planLimit", planLimit, "planLimit must not be negative, was " + planLimit);
        }

        Wallet wallet = walletStore.getOrCreate(userId);
        int expired = wallet.getSubscriptionCredits();

        wallet.setSubscriptionCredits(planLimit);
        wallet.setSubscriptionExpiresAt(expiresAt);
        wallet.setUpdatedAt(LocalDateTime.now(clock));
        walletRepository.save(wallet);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("planLimit", planLimit);
        meta.put("expiredCredits", expired);
        ledgerWriter.append(ledgerWriter.entry(userId, WalletPool.SUBSCRIPTION, LedgerEntryKind.RESET)
                .amount(planLimit)
                .balanceBefore(expired)
                .balanceAfter(planLimit)
                .sourceType(LedgerSources.SUBSCRIPTION_CYCLE)
                .sourceId(sourceId)
                .description("Subscription reset to " + planLimit + " credits")
                .metadata(metadataCodec.write(meta))
                .build());

        legacyBalanceSync.sync(wallet);
        metricsService.incrementSubscriptionReset(planLimit, expired);
        LedgerStructuredLogger.logCycleOperation(log, "info",
                "Reset subscription credits for user {} to {}, {} forfeited",
                userId, "RESET", sourceId, null, userId, planLimit, expired);
    }

    /**
     * Records the billing period. Returns false when an earlier delivery already recorded it;
     * throws when a concurrent delivery wins the unique constraint.
     */
    private boolean claimPeriod(UUID userId, String subscriptionId, LocalDateTime periodStart,
                                PeriodGrantType type, int credits) {
        if (subscriptionId == null || subscriptionId.isBlank()) {
            throw new IllegalArgumentException("subscriptionId must not be blank");
        }
        if (periodStart == null) {
            throw new IllegalArgumentException("periodStart must not be null");
        }

        if (periodGrantRepository.existsBySubscriptionIdAndPeriodStart(subscriptionId, periodStart)) {
            metricsService.incrementBillingPeriodDuplicate(type.name());
            LedgerStructuredLogger.logCycleOperation(log, "info",
                    "Billing period {} of subscription {} already applied; skipping {}",
                    userId, type.name(), subscriptionId, periodStart.toString(), periodStart, subscriptionId, type);
            return false;
        }

        SubscriptionPeriodGrant grant = new SubscriptionPeriodGrant();
        grant.setSubscriptionId(subscriptionId);
        grant.setPeriodStart(periodStart);
        grant.setUserId(userId);
        grant.setGrantType(type);
        grant.setCredits(credits);
        grant.setCreatedAt(LocalDateTime.now(clock));
        try {
            periodGrantRepository.saveAndFlush(grant);
        } catch (DataIntegrityViolationException ex) {
            metricsService.incrementBillingPeriodDuplicate(type.name());
            throw new BillingPeriodAlreadyAppliedException(subscriptionId, periodStart, ex);
        }
        return true;
    }
}
