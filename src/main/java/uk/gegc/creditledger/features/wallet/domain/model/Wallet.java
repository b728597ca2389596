package uk.gegc.creditledger.features.wallet.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "wallets")
@Getter
@Setter
public class Wallet {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "subscription_credits", nullable = false)
    private int subscriptionCredits;

    @Column(name = "top_up_credits", nullable = false)
    private int topUpCredits;

    @Column(name = "subscription_expires_at")
    private LocalDateTime subscriptionExpiresAt;

    /**
     * Remaining overdraft. Decreases as grace is used.
     */
    @Column(name = "grace_limit", nullable = false)
    private int graceLimit;

    /**
     * Total overdraft consumed over the wallet's life.
     */
    @Column(name = "grace_used", nullable = false)
    private int graceUsed;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public int getTotalCredits() {
        return subscriptionCredits + topUpCredits;
    }

    public int balanceOf(WalletPool pool) {
        return pool == WalletPool.SUBSCRIPTION ? subscriptionCredits : topUpCredits;
    }

    @PrePersist
    @PreUpdate
    void checkNonNegative() {
        if (subscriptionCredits < 0 || topUpCredits < 0 || graceLimit < 0 || graceUsed < 0) {
            throw new IllegalStateException("Wallet " + userId + " would hold a negative value: subscription="
                    + subscriptionCredits + ", topUp=" + topUpCredits
                    + ", graceLimit=" + graceLimit + ", graceUsed=" + graceUsed);
        }
    }
}
