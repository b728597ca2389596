package uk.gegc.creditledger.features.wallet.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only record of one pool movement. Built once, never updated.
 */
@Entity
@Table(name = "wallet_ledger_entries", indexes = {
        @Index(name = "idx_ledger_user_id", columnList = "user_id, id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "pool", nullable = false, updatable = false, length = 16)
    private WalletPool pool;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, updatable = false, length = 16)
    private LedgerEntryKind kind;

    @Column(name = "amount", nullable = false, updatable = false)
    private int amount;

    @Column(name = "balance_before", nullable = false, updatable = false)
    private int balanceBefore;

    @Column(name = "balance_after", nullable = false, updatable = false)
    private int balanceAfter;

    @Column(name = "source_type", nullable = false, updatable = false, length = 64)
    private String sourceType;

    @Column(name = "source_id", updatable = false)
    private String sourceId;

    @Column(name = "description", updatable = false, length = 500)
    private String description;

    @Column(name = "metadata", updatable = false, columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
