package uk.gegc.creditledger.features.wallet.application.impl;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.creditledger.features.wallet.api.dto.DeductResultDto;
import uk.gegc.creditledger.features.wallet.api.dto.LedgerEntryDto;
import uk.gegc.creditledger.features.wallet.api.dto.WalletBalanceDto;
import uk.gegc.creditledger.features.wallet.application.CreditMetricsService;
import uk.gegc.creditledger.features.wallet.application.CreditsProperties;
import uk.gegc.creditledger.features.wallet.application.WalletService;
import uk.gegc.creditledger.features.wallet.domain.exception.InsufficientCreditsException;
import uk.gegc.creditledger.features.wallet.domain.exception.InvalidAmountException;
import uk.gegc.creditledger.features.wallet.domain.model.DeductionPlan;
import uk.gegc.creditledger.features.wallet.domain.model.LedgerEntryKind;
import uk.gegc.creditledger.features.wallet.domain.model.LedgerSources;
import uk.gegc.creditledger.features.wallet.domain.model.Wallet;
import uk.gegc.creditledger.features.wallet.domain.model.WalletPool;
import uk.gegc.creditledger.features.wallet.domain.service.DeductionEngine;
import uk.gegc.creditledger.features.wallet.infra.mapping.LedgerEntryMapper;
import uk.gegc.creditledger.features.wallet.infra.mapping.WalletMapper;
import uk.gegc.creditledger.features.wallet.infra.repository.WalletRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class WalletServiceImpl implements WalletService {

    private static final Logger log = LoggerFactory.getLogger(WalletServiceImpl.class);

    private static final String DEFAULT_USAGE_DESCRIPTION = "Usage";
    private static final String DEFAULT_TOP_UP_DESCRIPTION = "Top-up purchase";

    private final WalletStore walletStore;
    private final WalletRepository walletRepository;
    private final LedgerWriter ledgerWriter;
    private final LegacyBalanceSync legacyBalanceSync;
    private final DeductionEngine deductionEngine;
    private final LedgerMetadataCodec metadataCodec;
    private final CreditsProperties creditsProperties;
    private final CreditMetricsService metricsService;
    private final WalletMapper walletMapper;
    private final LedgerEntryMapper ledgerEntryMapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public WalletBalanceDto getBalance(UUID userId) {
        return walletMapper.toDto(walletStore.peek(userId));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasCredits(UUID userId, int cost) {
        Wallet wallet = walletStore.peek(userId);
        return deductionEngine.canAfford(wallet.getSubscriptionCredits(), wallet.getTopUpCredits(), wallet.getGraceLimit(), cost);
    }

    @Override
    @Transactional
    public DeductResultDto deductCredits(UUID userId, int cost, String sourceType, String sourceId, String description) {
        if (cost <= 0) {
            throw new InvalidAmountException("cost", cost);
        }
        requireSourceType(sourceType);

        Wallet wallet = walletStore.getOrCreate(userId);
        int subscriptionBefore = wallet.getSubscriptionCredits();
        int topUpBefore = wallet.getTopUpCredits();

        DeductionPlan plan;
        try {
            plan = deductionEngine.plan(subscriptionBefore, topUpBefore, wallet.getGraceLimit(), cost);
        } catch (InsufficientCreditsException ex) {
            log.warn("Rejected deduction of {} credits for user {} ({}): available={}, graceLimit={}",
                    cost, userId, sourceType, ex.getAvailable(), wallet.getGraceLimit());
            metricsService.incrementDeductionRejected(sourceType);
            throw ex;
        }

        wallet.setSubscriptionCredits(plan.newSubscriptionBalance());
        wallet.setTopUpCredits(plan.newTopUpBalance());
        wallet.setGraceLimit(plan.newGraceLimit());
        wallet.setGraceUsed(wallet.getGraceUsed() + plan.graceUsed());
        touch(wallet);
        walletRepository.save(wallet);

        String label = description != null && !description.isBlank() ? description : DEFAULT_USAGE_DESCRIPTION;

        if (plan.subscriptionDeducted() > 0) {
            ledgerWriter.append(ledgerWriter.entry(userId, WalletPool.SUBSCRIPTION, LedgerEntryKind.DEBIT)
                    .amount(plan.subscriptionDeducted())
                    .balanceBefore(subscriptionBefore)
                    .balanceAfter(plan.newSubscriptionBalance())
                    .sourceType(sourceType)
                    .sourceId(sourceId)
                    .description(label)
                    .build());
            metricsService.incrementCreditsDeducted(WalletPool.SUBSCRIPTION, plan.subscriptionDeducted(), sourceType);
        }

        if (plan.topUpDeducted() > 0) {
            ledgerWriter.append(ledgerWriter.entry(userId, WalletPool.TOPUP, LedgerEntryKind.DEBIT)
                    .amount(plan.topUpDeducted())
                    .balanceBefore(topUpBefore)
                    .balanceAfter(plan.newTopUpBalance())
                    .sourceType(sourceType)
                    .sourceId(sourceId)
                    .description(label)
                    .build());
            metricsService.incrementCreditsDeducted(WalletPool.TOPUP, plan.topUpDeducted(), sourceType);
        }

        if (plan.usesGrace()) {
            Map<String, Object> graceMeta = new LinkedHashMap<>();
            graceMeta.put(LedgerReplayer.GRACE_FLAG, true);
            graceMeta.put("graceAmount", plan.graceUsed());
            ledgerWriter.append(ledgerWriter.entry(userId, WalletPool.TOPUP, LedgerEntryKind.DEBIT)
                    .amount(plan.graceUsed())
                    .balanceBefore(plan.newTopUpBalance())
                    .balanceAfter(plan.newTopUpBalance())
                    .sourceType(sourceType)
                    .sourceId(sourceId)
                    .description(label + " (grace: " + plan.graceUsed() + " credits)")
                    .metadata(metadataCodec.write(graceMeta))
                    .build());
            metricsService.incrementGraceConsumed(plan.graceUsed());
            log.info("User {} drew {} grace credits, {} grace remaining", userId, plan.graceUsed(), plan.newGraceLimit());
        }

        legacyBalanceSync.sync(wallet);

        return new DeductResultDto(
                plan.subscriptionDeducted(),
                plan.topUpDeducted(),
                plan.graceUsed(),
                cost,
                plan.newSubscriptionBalance(),
                plan.newTopUpBalance()
        );
    }

    @Override
    @Transactional
    public void addTopUpCredits(UUID userId, int amount, String sourceId, String description) {
        if (amount <= 0) {
            throw new InvalidAmountException("amount", amount);
        }

        Wallet wallet = walletStore.getOrCreate(userId);
        int before = wallet.getTopUpCredits();
        wallet.setTopUpCredits(Math.addExact(before, amount));
        touch(wallet);
        walletRepository.save(wallet);

        ledgerWriter.append(ledgerWriter.entry(userId, WalletPool.TOPUP, LedgerEntryKind.CREDIT)
                .amount(amount)
                .balanceBefore(before)
                .balanceAfter(wallet.getTopUpCredits())
                .sourceType(LedgerSources.PAYMENT)
                .sourceId(sourceId)
                .description(description != null && !description.isBlank() ? description : DEFAULT_TOP_UP_DESCRIPTION)
                .build());

        legacyBalanceSync.sync(wallet);
        metricsService.incrementTopUpAdded(amount);
    }

    @Override
    @Transactional
    public void refundCredits(UUID userId, int amount, WalletPool originalPool, String reason, String sourceId) {
        if (amount <= 0) {
            throw new InvalidAmountException("amount", amount);
        }

        Wallet wallet = walletStore.getOrCreate(userId);
        int before = wallet.getTopUpCredits();
        wallet.setTopUpCredits(Math.addExact(before, amount));
        touch(wallet);
        walletRepository.save(wallet);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("originalPool", originalPool != null ? originalPool.name() : null);
        ledgerWriter.append(ledgerWriter.entry(userId, WalletPool.TOPUP, LedgerEntryKind.REFUND)
                .amount(amount)
                .balanceBefore(before)
                .balanceAfter(wallet.getTopUpCredits())
                .sourceType(LedgerSources.SYSTEM)
                .sourceId(sourceId)
                .description(reason)
                .metadata(metadataCodec.write(meta))
                .build());

        legacyBalanceSync.sync(wallet);
        metricsService.incrementCreditsRefunded(amount);
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerEntryDto> getTransactionHistory(UUID userId, int limit) {
        int effective = limit < 1
                ? creditsProperties.getHistoryDefaultLimit()
                : Math.min(limit, creditsProperties.getHistoryMaxLimit());
        return ledgerEntryMapper.toDtos(ledgerWriter.history(userId, effective));
    }

    private void touch(Wallet wallet) {
        wallet.setUpdatedAt(LocalDateTime.now(clock));
    }

    private static void requireSourceType(String sourceType) {
        if (sourceType == null || sourceType.isBlank()) {
            throw new IllegalArgumentException("sourceType must not be blank");
        }
    }
}
