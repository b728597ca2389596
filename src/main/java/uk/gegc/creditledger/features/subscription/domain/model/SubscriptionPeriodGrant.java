package uk.gegc.creditledger.features.subscription.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Idempotency key for one billing period of one subscription. The unique constraint on
 * (subscription_id, period_start) makes the store reject a second grant for the same period.
 */
@Entity
@Table(name = "subscription_period_grants", uniqueConstraints = {
        @UniqueConstraint(name = "uk_period_grant_subscription_period", columnNames = {"subscription_id", "period_start"})
})
@Getter
@Setter
public class SubscriptionPeriodGrant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "subscription_id", nullable = false, updatable = false, length = 255)
    private String subscriptionId;

    @Column(name = "period_start", nullable = false, updatable = false)
    private LocalDateTime periodStart;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "grant_type", nullable = false, updatable = false, length = 16)
    private PeriodGrantType grantType;

    @Column(name = "credits", nullable = false, updatable = false)
    private int credits;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
